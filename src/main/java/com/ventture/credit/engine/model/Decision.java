package com.ventture.credit.engine.model;

public enum Decision {
    APPROVED,
    DENIED
}
