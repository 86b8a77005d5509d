package com.couchsession.error;

public class InvalidStaleValueException extends CouchArgumentException {

    public InvalidStaleValueException(Object value) {
        super(135, "Invalid value for stale option " + value + " must be ok or update_after.");
    }
}
