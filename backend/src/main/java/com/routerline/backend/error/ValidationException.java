package com.routerline.backend.error;

/**
 * A required value was missing or structurally invalid. Raised before anything is appended to a batch.
 */
public class ValidationException extends RouterlineException {

    public ValidationException(String message) {
        super(message);
    }
}
