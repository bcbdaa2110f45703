package com.ulio.vigil.record;

import java.time.Instant;
import java.util.Locale;

public final class AnomalyIds {
    private AnomalyIds() {
    }

    // <metric>_<epochSeconds>.<micros>
    public static String of(String metricName, Instant detectedAt) {
        long micros = detectedAt.getNano() / 1000L;
        return metricName + "_" + detectedAt.getEpochSecond() + "." + String.format(Locale.ROOT, "%06d", micros);
    }
}
