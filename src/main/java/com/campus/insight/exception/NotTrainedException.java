package com.campus.insight.exception;

public class NotTrainedException extends InsightException {
    public NotTrainedException(String modelName) {
        super(modelName + " has no fitted parameters; train or load it first");
    }
}
