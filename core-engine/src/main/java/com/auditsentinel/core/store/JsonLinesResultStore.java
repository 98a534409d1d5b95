package com.auditsentinel.core.store;

import com.auditsentinel.core.exception.PersistenceException;
import com.auditsentinel.core.json.JsonMappers;
import com.auditsentinel.core.model.DetectionRun;
import com.auditsentinel.core.model.DetectorPerformance;
import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.IntegratedAnomaly;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ResultStore} writing one JSON document per line to files in a
 * directory.
 *
 * <h3>Layout</h3>
 * <ul>
 * <li>{@value #RUNS_FILE}: one {@link DetectionRun} per line</li>
 * <li>{@value #ANOMALIES_FILE}: one {@link IntegratedAnomaly} per line, keyed
 * by {@code anomalyId}</li>
 * <li>{@value #PERFORMANCE_FILE}: one {@link DetectorPerformance} per
 * line</li>
 * <li>{@value #FEEDBACK_FILE}: one {@link ExpertFeedback} per line, keyed by
 * {@code anomalyId}</li>
 * </ul>
 * <p>
 * Writes are serialised on the store instance. Reads scan the file, which is
 * fine for the tuning workloads this store serves.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesResultStore implements ResultStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesResultStore.class);

    static final String RUNS_FILE = "runs.jsonl";
    static final String ANOMALIES_FILE = "anomalies.jsonl";
    static final String PERFORMANCE_FILE = "performance.jsonl";
    static final String FEEDBACK_FILE = "feedback.jsonl";

    private final Path directory;
    private final ObjectMapper mapper;

    /**
     * @param directory target directory, created if missing
     * @throws PersistenceException if the directory cannot be created
     */
    public JsonLinesResultStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.mapper = JsonMappers.create();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create result store directory " + directory, e);
        }
        LOG.info("JSON-lines result store at {}", directory.toAbsolutePath());
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    @Override
    public void appendRun(DetectionRun run) {
        append(RUNS_FILE, List.of(Objects.requireNonNull(run, "run must not be null")));
    }

    @Override
    public void appendAnomalies(List<IntegratedAnomaly> anomalies) {
        append(ANOMALIES_FILE, anomalies);
    }

    @Override
    public void appendPerformance(List<DetectorPerformance> performance) {
        append(PERFORMANCE_FILE, performance);
    }

    @Override
    public void appendFeedback(ExpertFeedback feedback) {
        append(FEEDBACK_FILE, List.of(Objects.requireNonNull(feedback, "feedback must not be null")));
    }

    private synchronized void append(String fileName, List<?> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        if (rows.isEmpty()) {
            return;
        }
        Path file = directory.resolve(fileName);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (Object row : rows) {
                writer.write(mapper.writeValueAsString(row));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to append " + rows.size() + " row(s) to " + file, e);
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    @Override
    public List<DetectionRun> listRuns() {
        return read(RUNS_FILE, DetectionRun.class);
    }

    @Override
    public List<IntegratedAnomaly> findAnomalies(String runId) {
        return read(ANOMALIES_FILE, IntegratedAnomaly.class).stream()
                .filter(a -> Objects.equals(a.getRunId(), runId))
                .toList();
    }

    @Override
    public Optional<IntegratedAnomaly> findAnomaly(String anomalyId) {
        return read(ANOMALIES_FILE, IntegratedAnomaly.class).stream()
                .filter(a -> Objects.equals(a.getAnomalyId(), anomalyId))
                .findFirst();
    }

    @Override
    public List<DetectorPerformance> listPerformance() {
        return read(PERFORMANCE_FILE, DetectorPerformance.class);
    }

    @Override
    public List<ExpertFeedback> findFeedback(String anomalyId) {
        return read(FEEDBACK_FILE, ExpertFeedback.class).stream()
                .filter(f -> Objects.equals(f.getAnomalyId(), anomalyId))
                .toList();
    }

    @Override
    public List<ExpertFeedback> listFeedback() {
        return read(FEEDBACK_FILE, ExpertFeedback.class);
    }

    private synchronized <T> List<T> read(String fileName, Class<T> type) {
        Path file = directory.resolve(fileName);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }

        List<T> rows = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                rows.add(mapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                throw new PersistenceException("Corrupt line " + (i + 1) + " in " + file + ": "
                        + e.getOriginalMessage(), e);
            }
        }
        return rows;
    }

    public Path getDirectory() {
        return directory;
    }
}
