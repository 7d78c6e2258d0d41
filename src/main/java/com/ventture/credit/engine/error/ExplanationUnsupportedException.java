package com.ventture.credit.engine.error;

import com.ventture.credit.engine.model.Prediction;

/** The prediction is valid but no explanation method can be applied to this model. */
public class ExplanationUnsupportedException extends ExplanationException {

    public ExplanationUnsupportedException(String message) {
        super(message, null, null);
    }

    private ExplanationUnsupportedException(String message, Prediction prediction, Throwable cause) {
        super(message, prediction, cause);
    }

    @Override
    public ExplanationUnsupportedException withPrediction(Prediction prediction) {
        return new ExplanationUnsupportedException(getMessage(), prediction, this);
    }
}
