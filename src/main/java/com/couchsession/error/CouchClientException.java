package com.couchsession.error;

/**
 * Base type for every error raised by this library.
 */
public class CouchClientException extends RuntimeException {

    public CouchClientException(String message) {
        super(message);
    }

    public CouchClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
