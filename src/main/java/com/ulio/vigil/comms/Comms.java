package com.ulio.vigil.comms;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ulio.vigil.core.Config;
import com.ulio.vigil.record.AnomalyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.net.InetAddress;

public class Comms implements AnomalyReporter {
    private static final Logger log = LoggerFactory.getLogger(Comms.class);

    private final ObjectMapper objectMapper;
    private final String agentId;
    private final String host;
    private final PrintStream out;
    private final AnomalyPoster anomalyPoster;

    public Comms(Config config) {
        this(config, System.out);
    }

    Comms(Config config, PrintStream out) {
        this.objectMapper = new ObjectMapper();
        this.agentId = resolveAgentId(config);
        this.host = resolveHostName();
        this.out = out;
        this.anomalyPoster = buildAnomalyPoster(config);
    }

    @Override
    public void report(AnomalyRecord record) {
        if (record == null) {
            return;
        }

        try {
            ObjectNode root = AnomalyRecordJson.toJson(objectMapper, record);
            ObjectNode metadata = (ObjectNode) root.get("metadata");
            metadata.put("agent_id", agentId);
            metadata.put("host", host);

            String payload = objectMapper.writeValueAsString(root);
            out.println(payload);

            if (anomalyPoster != null) {
                anomalyPoster.enqueue(payload);
            }
        } catch (Exception e) {
            // Output failures must never stop detection.
            log.error("Failed to publish anomaly {}: {}", record.getAnomalyId(), e.getMessage());
        }
    }

    @Override
    public void close() {
        if (anomalyPoster != null) {
            anomalyPoster.close();
        }
    }

    private AnomalyPoster buildAnomalyPoster(Config config) {
        if (config == null || !config.isPostAnomalies()) {
            return null;
        }

        String backendUrl = config.getBackendUrl();
        if (backendUrl == null || backendUrl.isBlank()) {
            return null;
        }

        try {
            return new AnomalyPoster(
                    backendUrl,
                    config.getVigilToken(),
                    config.getPostTimeoutMs(),
                    config.getPostQueueMax()
            );
        } catch (IllegalArgumentException e) {
            log.warn("Anomaly POST disabled: {}", e.getMessage());
            return null;
        }
    }

    private String resolveAgentId(Config config) {
        if (config == null || config.getAgentId() == null || config.getAgentId().isBlank()) {
            return "local-agent-01";
        }
        return config.getAgentId().trim();
    }

    private String resolveHostName() {
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            if (hostname != null && !hostname.isBlank()) {
                return hostname;
            }
        } catch (Exception e) {
            log.debug("Local host name lookup failed, falling back to HOSTNAME: {}", e.getMessage());
        }

        String envHostname = System.getenv("HOSTNAME");
        if (envHostname != null && !envHostname.isBlank()) {
            return envHostname.trim();
        }

        return "unknown-host";
    }
}
