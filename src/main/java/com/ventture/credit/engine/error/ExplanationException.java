package com.ventture.credit.engine.error;

import com.ventture.credit.engine.model.Prediction;

import java.util.Optional;

/**
 * The model scored the application but its output could not be explained. When raised from a full
 * evaluation the prediction is attached, so callers can still show the bare decision.
 */
public abstract class ExplanationException extends CreditEngineException {

    private final transient Prediction prediction;

    protected ExplanationException(String message, Prediction prediction, Throwable cause) {
        super(message, cause);
        this.prediction = prediction;
    }

    public Optional<Prediction> getPrediction() {
        return Optional.ofNullable(prediction);
    }

    /** Same failure, with the prediction the explanation was meant for. */
    public abstract ExplanationException withPrediction(Prediction prediction);
}
