package mediaflow.model;

/**
 * State of a pending-notification record.
 */
public enum DeliveryStatus {
    PENDING(0),
    ABANDONED(1);

    private final int code;

    DeliveryStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static DeliveryStatus fromCode(int code) {
        return switch (code) {
            case 0 -> PENDING;
            case 1 -> ABANDONED;
            default -> throw new IllegalArgumentException("Unknown delivery status code: " + code);
        };
    }
}
