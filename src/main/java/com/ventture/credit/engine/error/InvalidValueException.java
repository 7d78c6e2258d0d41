package com.ventture.credit.engine.error;

public class InvalidValueException extends CreditEngineException {

    private final String feature;

    public InvalidValueException(String feature, String message) {
        super(message);
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }
}
