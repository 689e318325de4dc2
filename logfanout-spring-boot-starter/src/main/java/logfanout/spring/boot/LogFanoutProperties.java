package logfanout.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for logfanout.
 *
 * @see LogFanoutAutoConfiguration
 */
@ConfigurationProperties(prefix = "logfanout")
public class LogFanoutProperties {

    /**
     * Whether to create the target manager.
     */
    private boolean enabled = true;

    /**
     * Database table holding logging targets.
     */
    private String tableName = "logging_targets";

    /**
     * JUL logger the dispatch hook is attached to. Empty means the root logger.
     */
    private String loggerName = "";

    /**
     * Copy legacy single syslog / HTTP settings into the store when it is empty.
     */
    private boolean migrateLegacySettings = true;

    /**
     * Prefix under which host settings such as {@code logging.level} are looked up in
     * the Spring environment.
     */
    private String settingsPrefix = "logfanout.settings.";

    private final Dispatch dispatch = new Dispatch();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getLoggerName() {
        return loggerName;
    }

    public void setLoggerName(String loggerName) {
        this.loggerName = loggerName;
    }

    public boolean isMigrateLegacySettings() {
        return migrateLegacySettings;
    }

    public void setMigrateLegacySettings(boolean migrateLegacySettings) {
        this.migrateLegacySettings = migrateLegacySettings;
    }

    public String getSettingsPrefix() {
        return settingsPrefix;
    }

    public void setSettingsPrefix(String settingsPrefix) {
        this.settingsPrefix = settingsPrefix;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatch {
        private int queueCapacity = 1000;
        private long drainTimeoutMs = 5000;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "logfanout";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
