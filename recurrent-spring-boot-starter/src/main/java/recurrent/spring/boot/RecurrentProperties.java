package recurrent.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import recurrent.jdbc.TableNames;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the expiry sweeper and recurring job processing.
 *
 * @see RecurrentAutoConfiguration
 */
@ConfigurationProperties(prefix = "recurrent")
public class RecurrentProperties {

    /**
     * Prefix shared by all store table names.
     */
    private String tablePrefix = TableNames.DEFAULT_PREFIX;

    private final Expiry expiry = new Expiry();
    private final Schedule schedule = new Schedule();
    private final Lock lock = new Lock();
    private final Metrics metrics = new Metrics();

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Expiry getExpiry() {
        return expiry;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public Lock getLock() {
        return lock;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum LockType {
        /** Row in the lock table; works on every supported database. */
        TABLE,
        /** PostgreSQL advisory lock or MySQL named lock, falling back to the lock table elsewhere. */
        ADVISORY
    }

    public static class Expiry {
        private boolean enabled = true;
        private int batchSize = 1000;
        /**
         * How long superseded state history is kept. Zero disables the state sweep.
         */
        private Duration stateRetention = Duration.ZERO;
        private Duration interval = Duration.ofMinutes(30);
        private Duration lockTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getStateRetention() {
            return stateRetention;
        }

        public void setStateRetention(Duration stateRetention) {
            this.stateRetention = stateRetention;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Schedule {
        /**
         * Whether this node fires due recurring jobs. Requires a JobTrigger bean.
         */
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(15);
        private Duration precision = Duration.ofMinutes(1);
        private int batchSize = 1000;
        private ZoneId defaultTimeZone = ZoneId.of("UTC");
        private int maxRetryAttempts = 10;
        private Duration lockTimeout = Duration.ofMinutes(1);
        private final Retry retry = new Retry();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getPrecision() {
            return precision;
        }

        public void setPrecision(Duration precision) {
            this.precision = precision;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public ZoneId getDefaultTimeZone() {
            return defaultTimeZone;
        }

        public void setDefaultTimeZone(ZoneId defaultTimeZone) {
            this.defaultTimeZone = defaultTimeZone;
        }

        public int getMaxRetryAttempts() {
            return maxRetryAttempts;
        }

        public void setMaxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = maxRetryAttempts;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofHours(1);

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Lock {
        private LockType type = LockType.TABLE;

        public LockType getType() {
            return type;
        }

        public void setType(LockType type) {
            this.type = type;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "recurrent";

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
