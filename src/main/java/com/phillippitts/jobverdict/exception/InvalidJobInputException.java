package com.phillippitts.jobverdict.exception;

/**
 * Thrown when caller-supplied job or candidate text is missing or unusable.
 */
public class InvalidJobInputException extends JobVerdictException {

    private final String field;
    private final String reason;

    public InvalidJobInputException(String field, String reason) {
        super("Invalid job input (" + field + "): " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
