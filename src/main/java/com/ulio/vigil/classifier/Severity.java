package com.ulio.vigil.classifier;

public enum Severity {
    NONE("none"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isAnomalous() {
        return this != NONE;
    }
}
