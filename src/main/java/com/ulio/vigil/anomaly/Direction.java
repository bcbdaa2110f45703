package com.ulio.vigil.anomaly;

public enum Direction {
    UP,
    DOWN,
    FLAT;

    public static Direction of(double value, double baseline) {
        if (value > baseline) {
            return UP;
        }
        if (value < baseline) {
            return DOWN;
        }
        return FLAT;
    }
}
