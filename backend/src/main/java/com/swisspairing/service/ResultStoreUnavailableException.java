package com.swisspairing.service;

public class ResultStoreUnavailableException extends RuntimeException {

    private final String operation;

    public ResultStoreUnavailableException(String operation, Throwable cause) {
        super("Result store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
