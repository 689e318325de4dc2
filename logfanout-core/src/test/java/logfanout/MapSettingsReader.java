package logfanout;

import logfanout.spi.SettingsReader;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Settings backed by a mutable map.
 */
public final class MapSettingsReader implements SettingsReader {
    private final Map<String, String> values = new ConcurrentHashMap<>();

    public MapSettingsReader put(String key, String value) {
        values.put(key, value);
        return this;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
}
