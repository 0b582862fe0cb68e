package com.campus.insight.exception;

public class InvalidInputException extends InsightException {
    public InvalidInputException(String message) {
        super(message);
    }

    public static double requireRange(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new InvalidInputException(field + " must be within [" + min + ", " + max + "] but was " + value);
        }
        return value;
    }

    public static double requireNonNegative(String field, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new InvalidInputException(field + " must be >= 0 but was " + value);
        }
        return value;
    }
}
