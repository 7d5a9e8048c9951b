package io.kudos;

/**
 * Template family used by the {@link MessageEndpoint#MESSAGE} endpoint.
 */
public enum MessageType {
    ANIMAL("animal"),
    ABSURD("absurd"),
    META("meta"),
    UNEXPECTED("unexpected"),
    TOUGH_LOVE("toughLove");

    private final String code;

    MessageType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a message type code.
     *
     * @param code the type code
     * @return the matching type, or {@code null} if the code is unknown
     */
    public static MessageType fromCode(String code) {
        for (MessageType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        return null;
    }
}
