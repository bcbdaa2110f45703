package com.ulio.vigil.telemetry;

import java.util.Optional;

public interface MetricSampler {
    Optional<SystemSnapshot> sample();
}
