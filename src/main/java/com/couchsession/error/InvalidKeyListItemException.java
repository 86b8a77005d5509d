package com.couchsession.error;

import java.util.Set;

public class InvalidKeyListItemException extends CouchArgumentException {

    public InvalidKeyListItemException(Set<?> expected) {
        super(134, "Key list element not of expected type: " + expected);
    }
}
