package com.couchsession.error;

public class UnknownOptionException extends CouchArgumentException {

    private final String option;

    public UnknownOptionException(String option) {
        super(116, "Invalid argument " + option);
        this.option = option;
    }

    public String getOption() {
        return option;
    }
}
