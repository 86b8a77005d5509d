package com.couchsession.error;

public class InvalidTokenResponseException extends CouchClientException {

    public InvalidTokenResponseException(String message) {
        super(message);
    }
}
