package com.ventture.credit.engine.error;

public class DimensionMismatchException extends CreditEngineException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Feature vector has " + actual + " values, model expects " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
