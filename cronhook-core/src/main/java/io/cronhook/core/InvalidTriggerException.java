package io.cronhook.core;

/**
 * A single trigger failed validation. When raised for a batch, {@link #index()} is its position.
 */
public class InvalidTriggerException extends IllegalArgumentException {

    private final int index;
    private final String field;
    private final String reason;

    public InvalidTriggerException(String field, String reason) {
        this(-1, field, reason);
    }

    public InvalidTriggerException(int index, String field, String reason) {
        super(describe(index, field, reason));
        this.index = index;
        this.field = field;
        this.reason = reason;
    }

    /**
     * Position in the submitted batch, or {@code -1} when validated on its own.
     */
    public int index() {
        return index;
    }

    public String field() {
        return field;
    }

    public String reason() {
        return reason;
    }

    public InvalidTriggerException atIndex(int index) {
        return new InvalidTriggerException(index, field, reason);
    }

    private static String describe(int index, String field, String reason) {
        if (index < 0) {
            return reason;
        }
        return "Invalid trigger at index " + index + " (" + field + "): " + reason;
    }
}
