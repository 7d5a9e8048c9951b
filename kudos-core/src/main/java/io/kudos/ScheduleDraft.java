package io.kudos;

import java.util.Objects;

/**
 * Creation input for a schedule: every {@link Schedule} field except the store-assigned
 * {@code id} and {@code createdAt}.
 *
 * <p>Create instances via {@link #builder()}. The builder checks presence only; semantic
 * checks (cron validity, endpoint/type combinations) belong to {@link ScheduleValidator}.
 */
public final class ScheduleDraft {
    private final String recipient;
    private final String recipientEmail;
    private final String endpoint;
    private final String messageType;
    private final String from;
    private final String cron;
    private final long nextRun;
    private final DeliveryMethod deliveryMethod;
    private final String webhookUrl;
    private final String webhookSecret;
    private final String createdBy;

    private ScheduleDraft(Builder builder) {
        this.recipient = Objects.requireNonNull(builder.recipient, "recipient");
        this.recipientEmail = Objects.requireNonNull(builder.recipientEmail, "recipientEmail");
        this.endpoint = Objects.requireNonNull(builder.endpoint, "endpoint");
        this.cron = Objects.requireNonNull(builder.cron, "cron");
        this.createdBy = Objects.requireNonNull(builder.createdBy, "createdBy");
        if (builder.nextRun == null) {
            throw new IllegalArgumentException("nextRun must be set");
        }
        this.nextRun = builder.nextRun;
        this.messageType = emptyToNull(builder.messageType);
        this.from = emptyToNull(builder.from);
        this.deliveryMethod = builder.deliveryMethod == null ? DeliveryMethod.EMAIL : builder.deliveryMethod;
        this.webhookUrl = emptyToNull(builder.webhookUrl);
        this.webhookSecret = emptyToNull(builder.webhookSecret);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String recipient() {
        return recipient;
    }

    public String recipientEmail() {
        return recipientEmail;
    }

    public String endpoint() {
        return endpoint;
    }

    public String messageType() {
        return messageType;
    }

    public String from() {
        return from;
    }

    public String cron() {
        return cron;
    }

    public long nextRun() {
        return nextRun;
    }

    public DeliveryMethod deliveryMethod() {
        return deliveryMethod;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public String webhookSecret() {
        return webhookSecret;
    }

    public String createdBy() {
        return createdBy;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Builder for {@link ScheduleDraft}.
     */
    public static final class Builder {
        private String recipient;
        private String recipientEmail;
        private String endpoint;
        private String messageType;
        private String from;
        private String cron;
        private Long nextRun;
        private DeliveryMethod deliveryMethod;
        private String webhookUrl;
        private String webhookSecret;
        private String createdBy;

        private Builder() {
        }

        /**
         * Sets the recipient display name. <b>Required.</b>
         */
        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        /**
         * Sets the recipient e-mail address. <b>Required.</b> Encrypted at rest.
         */
        public Builder recipientEmail(String recipientEmail) {
            this.recipientEmail = recipientEmail;
            return this;
        }

        /**
         * Sets the endpoint code. <b>Required.</b>
         */
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(MessageEndpoint endpoint) {
            this.endpoint = endpoint.code();
            return this;
        }

        public Builder messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder messageType(MessageType messageType) {
            this.messageType = messageType.code();
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        /**
         * Sets the cron expression. <b>Required.</b>
         */
        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        /**
         * Sets the first occurrence in unix seconds. <b>Required.</b>
         */
        public Builder nextRun(long nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        /**
         * Sets the delivery method. Defaults to {@link DeliveryMethod#EMAIL}.
         */
        public Builder deliveryMethod(DeliveryMethod deliveryMethod) {
            this.deliveryMethod = deliveryMethod;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder webhookSecret(String webhookSecret) {
            this.webhookSecret = webhookSecret;
            return this;
        }

        /**
         * Sets the owner identifier. <b>Required.</b>
         */
        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        /**
         * Builds the draft.
         *
         * @return a new draft
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if {@code nextRun} was never set
         */
        public ScheduleDraft build() {
            return new ScheduleDraft(this);
        }
    }
}
