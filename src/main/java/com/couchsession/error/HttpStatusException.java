package com.couchsession.error;

public class HttpStatusException extends CouchClientException {

    private final int statusCode;

    public HttpStatusException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
