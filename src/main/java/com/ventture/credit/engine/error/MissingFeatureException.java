package com.ventture.credit.engine.error;

import java.util.List;

public class MissingFeatureException extends CreditEngineException {

    private final List<String> missingFeatures;

    public MissingFeatureException(List<String> missingFeatures) {
        super("Missing required feature(s): " + String.join(", ", missingFeatures));
        this.missingFeatures = List.copyOf(missingFeatures);
    }

    public List<String> getMissingFeatures() {
        return missingFeatures;
    }
}
