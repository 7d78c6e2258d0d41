package com.ventture.credit.engine.error;

/** Base type of every request-scoped failure raised by the decision engine. */
public class CreditEngineException extends RuntimeException {

    public CreditEngineException(String message) {
        super(message);
    }

    public CreditEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
