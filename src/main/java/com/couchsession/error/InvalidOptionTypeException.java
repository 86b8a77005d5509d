package com.couchsession.error;

import java.util.Set;

public class InvalidOptionTypeException extends CouchArgumentException {

    private final String option;

    public InvalidOptionTypeException(String option, Set<?> expected) {
        super(117, "Argument " + option + " not instance of expected type: " + expected);
        this.option = option;
    }

    public String getOption() {
        return option;
    }
}
