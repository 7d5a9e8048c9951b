package io.kudos;

/**
 * How a schedule's message reaches its recipient. Stored as a lowercase code in the database.
 */
public enum DeliveryMethod {
    /**
     * Plain e-mail to {@link Schedule#recipientEmail()}.
     */
    EMAIL("email"),
    /**
     * JSON POST to {@link Schedule#webhookUrl()}, optionally HMAC-signed.
     */
    WEBHOOK("webhook");

    private final String code;

    DeliveryMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a stored code.
     *
     * @param code the stored code (case-insensitive)
     * @return the matching method
     * @throws IllegalArgumentException if the code is unknown
     */
    public static DeliveryMethod fromCode(String code) {
        for (DeliveryMethod method : values()) {
            if (method.code.equalsIgnoreCase(code)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown delivery method: " + code);
    }
}
