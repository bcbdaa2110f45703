package com.ulio.vigil.record;

public enum ResolutionStatus {
    OPEN("open"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved");

    private final String value;

    ResolutionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    boolean canMoveTo(ResolutionStatus next) {
        return next != null && next.ordinal() > ordinal();
    }
}
