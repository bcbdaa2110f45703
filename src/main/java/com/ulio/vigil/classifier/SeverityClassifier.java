package com.ulio.vigil.classifier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

public class SeverityClassifier {
    public static final double DEFAULT_WARNING_DEVIATION = 1.5;

    private final double warningDeviation;
    private final Map<MetricClass, SeverityRule> rules;
    private final Map<String, MetricClass> metricClasses;

    public SeverityClassifier() {
        this(DEFAULT_WARNING_DEVIATION, Collections.emptyMap(), Collections.emptyMap());
    }

    public SeverityClassifier(
            double warningDeviation,
            Map<MetricClass, SeverityRule> ruleOverrides,
            Map<String, MetricClass> metricClassOverrides
    ) {
        this.warningDeviation = Double.isFinite(warningDeviation) && warningDeviation > 0.0
                ? warningDeviation
                : DEFAULT_WARNING_DEVIATION;

        Map<MetricClass, SeverityRule> resolvedRules = new EnumMap<>(MetricClass.class);
        for (MetricClass metricClass : MetricClass.values()) {
            resolvedRules.put(metricClass, metricClass.defaultRule());
        }
        if (ruleOverrides != null) {
            ruleOverrides.forEach((metricClass, rule) -> {
                if (metricClass != null && rule != null) {
                    resolvedRules.put(metricClass, rule);
                }
            });
        }
        this.rules = Collections.unmodifiableMap(resolvedRules);

        Map<String, MetricClass> resolvedClasses = new HashMap<>(MetricClass.defaultAssignments());
        if (metricClassOverrides != null) {
            metricClassOverrides.forEach((metricName, metricClass) -> {
                if (metricName != null && metricClass != null) {
                    resolvedClasses.put(metricName, metricClass);
                }
            });
        }
        this.metricClasses = Collections.unmodifiableMap(resolvedClasses);
    }

    public Severity classify(double deviation, double percentageChange, String metricName) {
        if (!Double.isFinite(deviation) || deviation < warningDeviation) {
            return Severity.NONE;
        }

        SeverityRule rule = rules.get(classOf(metricName));
        double change = Double.isFinite(percentageChange) ? percentageChange : 0.0;
        return rule.escalates(deviation, change) ? Severity.CRITICAL : Severity.WARNING;
    }

    public MetricClass classOf(String metricName) {
        if (metricName == null) {
            return MetricClass.GENERIC;
        }
        return metricClasses.getOrDefault(metricName, MetricClass.GENERIC);
    }

    public SeverityRule ruleFor(MetricClass metricClass) {
        return rules.get(metricClass == null ? MetricClass.GENERIC : metricClass);
    }

    public double getWarningDeviation() {
        return warningDeviation;
    }
}
