package com.ulio.vigil;

import com.ulio.vigil.comms.Comms;
import com.ulio.vigil.core.AlertThrottle;
import com.ulio.vigil.core.Config;
import com.ulio.vigil.core.DetectionEngine;
import com.ulio.vigil.core.DetectionLoop;
import com.ulio.vigil.telemetry.MetricSampler;
import com.ulio.vigil.telemetry.ReplaySampler;
import com.ulio.vigil.telemetry.RequestMetricsRegistry;
import com.ulio.vigil.telemetry.ResourceUsage;
import com.ulio.vigil.telemetry.ResourceUsageCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Supplier;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Path configPath = parseOption(args, "--config", "-c", Path.of("config.yml"));
        Path replayOverride = parseOption(args, "--replay", "-r", null);

        try {
            Config config = Config.load(configPath);
            if (replayOverride != null) {
                config.setReplayPath(replayOverride.toString());
                config.setSamplingIntervalMs(0);
            }

            Clock clock = Clock.systemUTC();
            MetricSampler sampler = buildSampler(config, clock);
            DetectionEngine engine = DetectionEngine.create(config, clock);
            DetectionLoop loop = new DetectionLoop(
                    config.getSamplingIntervalMs(),
                    sampler,
                    engine,
                    new Comms(config),
                    new AlertThrottle(config.getNotificationCooldownMs()),
                    config.getBaselineSaveEveryTicks()
            );

            Runtime.getRuntime().addShutdownHook(new Thread(loop::shutdown, "vigil-shutdown"));
            loop.run();
        } catch (Exception e) {
            log.error("Failed to start anomaly detection: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static MetricSampler buildSampler(Config config, Clock clock) throws IOException {
        if (!config.getReplayPath().isEmpty()) {
            log.info("Replaying snapshots from {}", config.getReplayPath());
            return new ReplaySampler(Path.of(config.getReplayPath()), clock);
        }

        Supplier<ResourceUsage> resources = config.isCollectResourceUsage()
                ? new ResourceUsageCollector()
                : () -> ResourceUsage.unavailable("resource collection disabled");
        log.warn("No replay source configured: sampling the in-process request registry. "
                + "Standalone, nothing records requests into it, so request metrics stay at zero; "
                + "pass --replay <snapshots.jsonl> or embed the agent and feed RequestMetricsRegistry");
        return new RequestMetricsRegistry(clock, resources);
    }

    static Path parseOption(String[] args, String longName, String shortName, Path defaultValue) {
        if (args == null || args.length == 0) {
            return defaultValue;
        }

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ((longName.equals(arg) || shortName.equals(arg)) && i + 1 < args.length) {
                return Path.of(args[i + 1]);
            }
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printHelpAndExit();
            }
        }

        return defaultValue;
    }

    private static void printHelpAndExit() {
        System.out.println("Usage: java -jar target/vigil-agent.jar [--config <path>] [--replay <snapshots.jsonl>]");
        System.exit(0);
    }
}
