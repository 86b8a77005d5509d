package com.couchsession.error;

public class TokenServiceException extends CouchClientException {

    public TokenServiceException(String message) {
        super(message);
    }

    public TokenServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
