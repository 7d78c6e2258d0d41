package com.ventture.credit.engine.error;

import com.ventture.credit.engine.model.Prediction;

import java.time.Duration;

public class ExplanationTimeoutException extends ExplanationException {

    public ExplanationTimeoutException(Duration timeout, int explained, int total) {
        super("Explanation exceeded " + timeout.toMillis() + " ms after " + explained + " of " + total + " features",
                null, null);
    }

    private ExplanationTimeoutException(String message, Prediction prediction, Throwable cause) {
        super(message, prediction, cause);
    }

    @Override
    public ExplanationTimeoutException withPrediction(Prediction prediction) {
        return new ExplanationTimeoutException(getMessage(), prediction, this);
    }
}
