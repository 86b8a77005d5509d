package com.couchsession.error;

public class OptionConversionException extends CouchArgumentException {

    public OptionConversionException(String option, Throwable cause) {
        super(136, "Error converting argument " + option + ": " + (cause != null ? cause.getMessage() : "unsupported value"), cause);
    }
}
