package com.sysmuse.leadership.parse;

/**
 * Structural problem with a roster that aborts the whole parse.
 */
public class RosterParseException extends IllegalArgumentException {

    public enum Reason {
        EMPTY_INPUT("Roster data is empty"),
        HEADER_NOT_FOUND("Could not find header row"),
        MISSING_REQUIRED_COLUMNS("Could not find required columns (POSITION, BARS EMAIL)");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Reason reason;

    public RosterParseException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public RosterParseException(Reason reason, String detail) {
        super(reason.getMessage() + ": " + detail);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
