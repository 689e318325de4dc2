package logfanout.spi;

import logfanout.InMemoryTargetStore;
import logfanout.MapSettingsReader;
import logfanout.target.LegacySettings;
import logfanout.target.TargetConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetStoreMigrationTest {

    private static MapSettingsReader legacy() {
        return new MapSettingsReader()
                .put(LegacySettings.SYSLOG_ENABLED, "true")
                .put(LegacySettings.SYSLOG_HOST, "logs.local")
                .put(LegacySettings.SYSLOG_PORT, "1514")
                .put(LegacySettings.HTTP_ENABLED, "true")
                .put(LegacySettings.HTTP_URL, "http://ingest.local/logs")
                .put(LegacySettings.HTTP_BATCH_SIZE, "25");
    }

    @Test
    void createsOneRowPerEnabledLegacyTarget() {
        InMemoryTargetStore store = new InMemoryTargetStore();
        List<TargetConfig> created = store.migrateFromLegacySettings(legacy());

        assertEquals(2, created.size());
        List<TargetConfig> rows = store.list();
        assertEquals(LegacySettings.HTTP_TARGET_NAME, rows.get(0).name());
        assertEquals(25, rows.get(0).batchSize());
        assertEquals(LegacySettings.SYSLOG_TARGET_NAME, rows.get(1).name());
        assertEquals(1514, rows.get(1).port());
        assertFalse(rows.get(0).id().isEmpty());
        assertTrue(rows.get(1).enabled());
    }

    @Test
    void repeatedMigrationCreatesNoDuplicates() {
        InMemoryTargetStore store = new InMemoryTargetStore();
        store.migrateFromLegacySettings(legacy());
        List<TargetConfig> second = store.migrateFromLegacySettings(legacy());

        assertTrue(second.isEmpty());
        assertEquals(2, store.list().size());
    }

    @Test
    void invalidLegacyRowDoesNotStopTheOther() {
        InMemoryTargetStore store = new InMemoryTargetStore();
        MapSettingsReader settings = legacy().put(LegacySettings.SYSLOG_PROTOCOL, "carrier-pigeon");

        List<TargetConfig> created = store.migrateFromLegacySettings(settings);

        assertEquals(1, created.size());
        assertEquals(LegacySettings.HTTP_TARGET_NAME, created.get(0).name());
    }

    @Test
    void nothingEnabledMigratesNothing() {
        InMemoryTargetStore store = new InMemoryTargetStore();
        assertTrue(store.migrateFromLegacySettings(new MapSettingsReader()).isEmpty());
        assertTrue(store.list().isEmpty());
    }
}
