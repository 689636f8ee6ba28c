package com.routerline.backend.error;

public class UnknownOperationException extends RouterlineException {

    private final String operation;

    public UnknownOperationException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public String getOperation() { return operation; }
}
