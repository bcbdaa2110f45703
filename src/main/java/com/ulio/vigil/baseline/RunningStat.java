package com.ulio.vigil.baseline;

final class RunningStat {
    private long count;
    private double mean;
    private double m2;

    boolean add(double value) {
        if (!Double.isFinite(value)) {
            return false;
        }

        count++;
        double delta = value - mean;
        mean += delta / count;
        double delta2 = value - mean;
        m2 += delta * delta2;
        return true;
    }

    long getCount() {
        return count;
    }

    double getMean() {
        return count > 0 ? mean : 0.0;
    }

    double getM2() {
        return m2;
    }

    double getStdDev() {
        if (count < 2) {
            return 0.0;
        }
        double variance = m2 / (count - 1);
        if (!Double.isFinite(variance) || variance <= 0.0) {
            return 0.0;
        }
        return Math.sqrt(variance);
    }

    boolean restore(long count, double mean, double m2) {
        if (count < 0 || !Double.isFinite(mean) || !Double.isFinite(m2) || m2 < 0.0) {
            return false;
        }
        this.count = count;
        this.mean = count > 0 ? mean : 0.0;
        this.m2 = count > 1 ? m2 : 0.0;
        return true;
    }
}
