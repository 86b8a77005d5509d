package com.couchsession.error;

/**
 * A login, logout or session-info call was answered with a non-success status.
 */
public class AuthenticationException extends CouchClientException {

    private final int statusCode;

    public AuthenticationException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
