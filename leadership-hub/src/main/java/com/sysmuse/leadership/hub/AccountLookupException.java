package com.sysmuse.leadership.hub;

/**
 * A directory lookup failed. Carries the remote status code when there was one.
 */
public class AccountLookupException extends Exception {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public AccountLookupException(String message) {
        this(message, NO_STATUS, null);
    }

    public AccountLookupException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public AccountLookupException(String message, Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public AccountLookupException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }
}
