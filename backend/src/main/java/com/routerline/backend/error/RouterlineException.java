package com.routerline.backend.error;

/**
 * Base type for every failure the compiler or the batch engine reports to callers.
 */
public abstract class RouterlineException extends RuntimeException {

    protected RouterlineException(String message) {
        super(message);
    }

    protected RouterlineException(String message, Throwable cause) {
        super(message, cause);
    }
}
