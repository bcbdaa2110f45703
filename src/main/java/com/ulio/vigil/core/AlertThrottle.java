package com.ulio.vigil.core;

import com.ulio.vigil.record.AnomalyRecord;

import java.util.concurrent.ConcurrentHashMap;

// one alert per metric and severity within the cooldown, measured on detection time
public class AlertThrottle {
    private final long cooldownMs;
    private final ConcurrentHashMap<String, Long> lastAlertMs = new ConcurrentHashMap<>();

    public AlertThrottle(long cooldownMs) {
        this.cooldownMs = Math.max(0L, cooldownMs);
    }

    public boolean shouldAlert(AnomalyRecord record) {
        if (record == null) {
            return false;
        }

        String key = record.getMetricName() + ":" + record.getSeverity().value();
        long now = record.getDetectedAt().toEpochMilli();
        boolean[] allowed = new boolean[1];
        lastAlertMs.compute(key, (k, previous) -> {
            if (previous == null || cooldownMs == 0L || now - previous > cooldownMs) {
                allowed[0] = true;
                return now;
            }
            return previous;
        });
        return allowed[0];
    }
}
