package com.campus.insight.exception;

public class ModelPersistenceException extends InsightException {
    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
