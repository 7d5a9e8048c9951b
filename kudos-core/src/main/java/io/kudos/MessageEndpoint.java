package io.kudos;

/**
 * Message-generation mode a schedule invokes when it fires.
 */
public enum MessageEndpoint {
    AWESOME("awesome"),
    WEEKLY("weekly"),
    RANDOM("random"),
    /**
     * A typed message; requires {@link Schedule#messageType()}.
     */
    MESSAGE("message");

    private final String code;

    MessageEndpoint(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves an endpoint code.
     *
     * @param code the endpoint code
     * @return the matching endpoint, or {@code null} if the code is unknown
     */
    public static MessageEndpoint fromCode(String code) {
        for (MessageEndpoint endpoint : values()) {
            if (endpoint.code.equals(code)) {
                return endpoint;
            }
        }
        return null;
    }
}
