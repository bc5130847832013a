package com.leadgen.backend.exceptions;

/**
 * The campaign state store could not read or write. Halts the campaign run without advancing
 * its checkpoint.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
