package com.ulio.vigil.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ulio.vigil.classifier.MetricClass;
import com.ulio.vigil.classifier.SeverityClassifier;
import com.ulio.vigil.classifier.SeverityRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeverityRuleSettings {
        private Double criticalDeviation;
        private Double criticalPercentChange;

        public Double getCriticalDeviation() {
            return criticalDeviation;
        }

        public void setCriticalDeviation(Double criticalDeviation) {
            this.criticalDeviation = criticalDeviation;
        }

        public Double getCriticalPercentChange() {
            return criticalPercentChange;
        }

        public void setCriticalPercentChange(Double criticalPercentChange) {
            this.criticalPercentChange = criticalPercentChange;
        }

        private SeverityRule applyTo(SeverityRule rule) {
            SeverityRule resolved = rule;
            if (criticalDeviation != null && Double.isFinite(criticalDeviation) && criticalDeviation > 0.0) {
                resolved = resolved.withCriticalDeviation(criticalDeviation);
            }
            if (criticalPercentChange != null && Double.isFinite(criticalPercentChange)) {
                resolved = resolved.withCriticalPercentChange(criticalPercentChange);
            }
            return resolved;
        }
    }

    private long samplingIntervalMs = 60_000;
    private int baselineMinSamples = 10;
    private int confidenceMinSamples = 30;
    private double warningDeviation = SeverityClassifier.DEFAULT_WARNING_DEVIATION;
    private String baselinePath = "baselines.json";
    private int baselineSaveEveryTicks = 10;
    private long notificationCooldownMs = 300_000;
    private int recentAnomaliesMax = 1000;
    private boolean collectResourceUsage = true;
    private String replayPath = "";

    private String backendUrl = "";
    private String vigilToken = "";
    private boolean postAnomalies = true;
    private int postTimeoutMs = 1500;
    private int postQueueMax = 500;
    private String agentId = "local-agent-01";

    private Map<String, SeverityRuleSettings> severityRules = new LinkedHashMap<>();
    private Map<String, String> metricClasses = new LinkedHashMap<>();

    public static Config load(Path path) throws IOException {
        Config defaults = new Config();
        if (path == null || !Files.exists(path)) {
            log.warn("Config file not found, using defaults: {}", path);
            defaults.applyDefaults();
            return defaults;
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        Config loaded = mapper.readValue(path.toFile(), Config.class);
        if (loaded == null) {
            defaults.applyDefaults();
            return defaults;
        }

        loaded.applyDefaults();
        return loaded;
    }

    public static Config defaults() {
        Config config = new Config();
        config.applyDefaults();
        return config;
    }

    void applyDefaults() {
        if (samplingIntervalMs <= 0) {
            samplingIntervalMs = 60_000;
        }
        if (baselineMinSamples <= 0) {
            baselineMinSamples = 10;
        }
        if (confidenceMinSamples < baselineMinSamples) {
            confidenceMinSamples = baselineMinSamples;
        }
        if (!Double.isFinite(warningDeviation) || warningDeviation <= 0.0) {
            warningDeviation = SeverityClassifier.DEFAULT_WARNING_DEVIATION;
        }
        baselinePath = baselinePath == null ? "" : baselinePath.trim();
        if (baselineSaveEveryTicks <= 0) {
            baselineSaveEveryTicks = 10;
        }
        if (notificationCooldownMs < 0) {
            notificationCooldownMs = 300_000;
        }
        if (recentAnomaliesMax <= 0) {
            recentAnomaliesMax = 1000;
        }
        replayPath = replayPath == null ? "" : replayPath.trim();

        backendUrl = backendUrl == null ? "" : backendUrl.trim();
        vigilToken = resolveVigilToken(vigilToken);

        if (postTimeoutMs <= 0) {
            postTimeoutMs = 1500;
        }
        if (postQueueMax <= 0) {
            postQueueMax = 500;
        }
        if (agentId == null || agentId.isBlank()) {
            agentId = "local-agent-01";
        }

        if (severityRules == null) {
            severityRules = new LinkedHashMap<>();
        }
        if (metricClasses == null) {
            metricClasses = new LinkedHashMap<>();
        }
    }

    public Map<MetricClass, SeverityRule> buildSeverityRules() {
        Map<MetricClass, SeverityRule> rules = new EnumMap<>(MetricClass.class);
        for (Map.Entry<String, SeverityRuleSettings> entry : severityRules.entrySet()) {
            MetricClass metricClass = parseMetricClass(entry.getKey());
            if (metricClass == null || entry.getValue() == null) {
                log.warn("Ignoring severity rule for unknown metric class '{}'", entry.getKey());
                continue;
            }
            rules.put(metricClass, entry.getValue().applyTo(metricClass.defaultRule()));
        }
        return rules;
    }

    public Map<String, MetricClass> buildMetricClasses() {
        Map<String, MetricClass> assignments = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : metricClasses.entrySet()) {
            MetricClass metricClass = parseMetricClass(entry.getValue());
            if (metricClass == null) {
                log.warn("Metric '{}' mapped to unknown class '{}', using GENERIC", entry.getKey(), entry.getValue());
                metricClass = MetricClass.GENERIC;
            }
            assignments.put(entry.getKey(), metricClass);
        }
        return assignments;
    }

    private static MetricClass parseMetricClass(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MetricClass metricClass : MetricClass.values()) {
            if (metricClass.name().equals(normalized)) {
                return metricClass;
            }
        }
        return null;
    }

    private String resolveVigilToken(String configuredToken) {
        String envToken = System.getenv("VIGIL_TOKEN");
        if (envToken != null) {
            return envToken.trim();
        }

        return configuredToken == null ? "" : configuredToken.trim();
    }

    public long getSamplingIntervalMs() {
        return samplingIntervalMs;
    }

    public void setSamplingIntervalMs(long samplingIntervalMs) {
        this.samplingIntervalMs = samplingIntervalMs;
    }

    public int getBaselineMinSamples() {
        return baselineMinSamples;
    }

    public void setBaselineMinSamples(int baselineMinSamples) {
        this.baselineMinSamples = baselineMinSamples;
    }

    public int getConfidenceMinSamples() {
        return confidenceMinSamples;
    }

    public void setConfidenceMinSamples(int confidenceMinSamples) {
        this.confidenceMinSamples = confidenceMinSamples;
    }

    public double getWarningDeviation() {
        return warningDeviation;
    }

    public void setWarningDeviation(double warningDeviation) {
        this.warningDeviation = warningDeviation;
    }

    public String getBaselinePath() {
        return baselinePath;
    }

    public void setBaselinePath(String baselinePath) {
        this.baselinePath = baselinePath;
    }

    public int getBaselineSaveEveryTicks() {
        return baselineSaveEveryTicks;
    }

    public void setBaselineSaveEveryTicks(int baselineSaveEveryTicks) {
        this.baselineSaveEveryTicks = baselineSaveEveryTicks;
    }

    public long getNotificationCooldownMs() {
        return notificationCooldownMs;
    }

    public void setNotificationCooldownMs(long notificationCooldownMs) {
        this.notificationCooldownMs = notificationCooldownMs;
    }

    public int getRecentAnomaliesMax() {
        return recentAnomaliesMax;
    }

    public void setRecentAnomaliesMax(int recentAnomaliesMax) {
        this.recentAnomaliesMax = recentAnomaliesMax;
    }

    public boolean isCollectResourceUsage() {
        return collectResourceUsage;
    }

    public void setCollectResourceUsage(boolean collectResourceUsage) {
        this.collectResourceUsage = collectResourceUsage;
    }

    public String getReplayPath() {
        return replayPath;
    }

    public void setReplayPath(String replayPath) {
        this.replayPath = replayPath;
    }

    public String getBackendUrl() {
        return backendUrl;
    }

    public void setBackendUrl(String backendUrl) {
        this.backendUrl = backendUrl;
    }

    public String getVigilToken() {
        return vigilToken;
    }

    public void setVigilToken(String vigilToken) {
        this.vigilToken = vigilToken;
    }

    public boolean isPostAnomalies() {
        return postAnomalies;
    }

    public void setPostAnomalies(boolean postAnomalies) {
        this.postAnomalies = postAnomalies;
    }

    public int getPostTimeoutMs() {
        return postTimeoutMs;
    }

    public void setPostTimeoutMs(int postTimeoutMs) {
        this.postTimeoutMs = postTimeoutMs;
    }

    public int getPostQueueMax() {
        return postQueueMax;
    }

    public void setPostQueueMax(int postQueueMax) {
        this.postQueueMax = postQueueMax;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public Map<String, SeverityRuleSettings> getSeverityRules() {
        return severityRules;
    }

    public void setSeverityRules(Map<String, SeverityRuleSettings> severityRules) {
        this.severityRules = severityRules;
    }

    public Map<String, String> getMetricClasses() {
        return metricClasses;
    }

    public void setMetricClasses(Map<String, String> metricClasses) {
        this.metricClasses = metricClasses;
    }
}
