package com.couchsession.error;

/**
 * The server refused to trade an IAM access token for a session cookie.
 */
public class AuthenticationExchangeException extends CouchClientException {

    public AuthenticationExchangeException(String message) {
        super(message);
    }

    public AuthenticationExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
