package logfanout.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("logging_targets", TableNames.validate("logging_targets"));
        assertEquals("Targets", TableNames.validate("Targets"));
        assertEquals("targets2", TableNames.validate("targets2"));
        assertEquals("_targets", TableNames.validate("_targets"));
    }

    @Test
    void defaultTableConstant() {
        assertEquals("logging_targets", TableNames.DEFAULT_TABLE);
    }

    @Test
    void nullTableNameThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void invalidTableNamesThrow() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1targets"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("logging-targets"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("app.targets"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("t; DROP TABLE x"));
    }
}
