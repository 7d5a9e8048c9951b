package io.kudos.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the Kudos delivery scheduler.
 *
 * @see KudosAutoConfiguration
 */
@ConfigurationProperties(prefix = "kudos")
public class KudosProperties {

    private final Store store = new Store();
    private final Scheduler scheduler = new Scheduler();
    private final Delivery delivery = new Delivery();
    private final Messages messages = new Messages();
    private final Metrics metrics = new Metrics();

    public Store getStore() {
        return store;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Messages getMessages() {
        return messages;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum DeliveryMode {
        /** Log deliveries instead of sending them. */
        CONSOLE,
        /** Send e-mail through the application's {@code JavaMailSender} and POST webhooks. */
        LIVE
    }

    public static class Store {
        /**
         * Connection string: {@code :memory:}, a database file path, a {@code jdbc:h2:} URL,
         * or a {@code postgres://} / {@code jdbc:postgresql:} URL.
         */
        private String url = ":memory:";

        /**
         * Passphrase for encrypting sensitive columns. Unset means plaintext storage.
         */
        private String dataEncryptionKey;

        /**
         * How long a due schedule claimed by another poller is honored (PostgreSQL only).
         */
        private Duration claimTimeout = Duration.ofMinutes(5);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getDataEncryptionKey() {
            return dataEncryptionKey;
        }

        public void setDataEncryptionKey(String dataEncryptionKey) {
            this.dataEncryptionKey = dataEncryptionKey;
        }

        public Duration getClaimTimeout() {
            return claimTimeout;
        }

        public void setClaimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofMinutes(1);
        private Duration revocationRetention = Duration.ofDays(30);
        private Duration revocationCleanupCadence = Duration.ofHours(6);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getRevocationRetention() {
            return revocationRetention;
        }

        public void setRevocationRetention(Duration revocationRetention) {
            this.revocationRetention = revocationRetention;
        }

        public Duration getRevocationCleanupCadence() {
            return revocationCleanupCadence;
        }

        public void setRevocationCleanupCadence(Duration revocationCleanupCadence) {
            this.revocationCleanupCadence = revocationCleanupCadence;
        }
    }

    public static class Delivery {
        private DeliveryMode mode = DeliveryMode.CONSOLE;

        /**
         * Sender address for e-mail deliveries.
         */
        private String from = "kudos@localhost";

        public DeliveryMode getMode() {
            return mode;
        }

        public void setMode(DeliveryMode mode) {
            this.mode = mode;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }
    }

    public static class Messages {
        /**
         * Whether tough-love templates may be chosen.
         */
        private boolean toughLove = true;

        public boolean isToughLove() {
            return toughLove;
        }

        public void setToughLove(boolean toughLove) {
            this.toughLove = toughLove;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "kudos";

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
