package com.couchsession.error;

public class ConfigurationException extends CouchClientException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
