package com.couchsession.error;

/**
 * Raised when a caller passes an option the server would not understand.
 * Always thrown before any request leaves the client.
 */
public class CouchArgumentException extends CouchClientException {

    private final int code;

    public CouchArgumentException(int code, String message) {
        super(message);
        this.code = code;
    }

    public CouchArgumentException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
