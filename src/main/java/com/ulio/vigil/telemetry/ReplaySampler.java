package com.ulio.vigil.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

public class ReplaySampler implements MetricSampler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReplaySampler.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BufferedReader reader;
    private final Clock clock;
    private final Path source;
    private long lineNumber;

    public ReplaySampler(Path source, Clock clock) throws IOException {
        this.source = source;
        this.reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public synchronized Optional<SystemSnapshot> sample() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                try {
                    return Optional.of(SnapshotJson.read(objectMapper.readTree(trimmed), clock.instant()));
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Skipping malformed snapshot at {}:{}: {}", source, lineNumber, e.getMessage());
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshots from " + source, e);
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
