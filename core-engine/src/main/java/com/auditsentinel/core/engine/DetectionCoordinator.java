package com.auditsentinel.core.engine;

import com.auditsentinel.core.config.EngineConfig;
import com.auditsentinel.core.config.RunConfig;
import com.auditsentinel.core.detection.DetectorRegistry;
import com.auditsentinel.core.detection.model.ModelRegistry;
import com.auditsentinel.core.exception.AnomalyEngineException;
import com.auditsentinel.core.exception.ConfigurationException;
import com.auditsentinel.core.exception.FeatureExtractionException;
import com.auditsentinel.core.exception.PersistenceException;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.feature.FeatureBuilder;
import com.auditsentinel.core.fusion.FeatureImportanceAnalyzer;
import com.auditsentinel.core.fusion.FusionEngine;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.DetectionReport;
import com.auditsentinel.core.model.DetectionRun;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorPerformance;
import com.auditsentinel.core.model.DetectorRunResult;
import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.FeatureImportance;
import com.auditsentinel.core.model.FeedbackType;
import com.auditsentinel.core.model.IntegratedAnomaly;
import com.auditsentinel.core.model.Record;
import com.auditsentinel.core.model.ReportStatus;
import com.auditsentinel.core.store.DetectorFeedbackSummary;
import com.auditsentinel.core.store.FeedbackAnalyzer;
import com.auditsentinel.core.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the engine: runs feature building, detection, fusion and
 * persistence for one batch and returns a {@link DetectionReport}.
 *
 * <h3>Run lifecycle</h3>
 * <ol>
 * <li>Snapshot the engine configuration and resolve the requested
 * detectors. Unknown names end the run with a {@code CONFIGURATION_ERROR}
 * before any detector starts.</li>
 * <li>Build features. A malformed batch ends the run with
 * {@code FEATURE_EXTRACTION_ERROR}, a batch without usable records with
 * {@value #NO_USABLE_FEATURES}.</li>
 * <li>Run the detectors in parallel and fuse their candidates (weighted, or a
 * plain union when the ensemble is disabled).</li>
 * <li>Optionally attribute the anomalies to features.</li>
 * <li>Persist the run, its anomalies and per-detector performance. A
 * persistence failure is logged and flagged on the report; it never discards
 * the result.</li>
 * </ol>
 * <p>
 * A run whose thread is interrupted ends {@code CANCELLED} and persists
 * nothing.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Concurrent runs are supported. Each run works on its own copy of the
 * configuration; {@link #reconfigure(EngineConfig)} affects only runs that
 * start afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionCoordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionCoordinator.class);

    /** Error code of a run whose batch yielded no features. */
    public static final String NO_USABLE_FEATURES = "NO_USABLE_FEATURES";

    /** Error code of an interrupted run. */
    public static final String RUN_CANCELLED = "RUN_CANCELLED";

    // Performance metric keys
    public static final String METRIC_DETECTION_TIME_MS = "detection_time_ms";
    public static final String METRIC_RECORDS_PER_SECOND = "records_per_second";
    public static final String METRIC_ANOMALY_RATE = "anomaly_rate";
    public static final String METRIC_CANDIDATES = "candidates";
    public static final String METRIC_DETECTORS_RUN = "detectors_run";

    private final AtomicReference<EngineConfig> config;
    private final ModelRegistry models;
    private final ResultStore store;
    private final DetectorRegistry detectorRegistry;
    private final FeatureImportanceAnalyzer importanceAnalyzer;
    private final ExecutorService runExecutor;

    /**
     * @param config engine configuration; validated and copied
     * @param models fitted models for detectors that need them
     * @param store  where completed runs are recorded
     * @throws ConfigurationException if {@code config} is invalid
     */
    public DetectionCoordinator(EngineConfig config, ModelRegistry models, ResultStore store) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        this.config = new AtomicReference<>(config.copy());
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.detectorRegistry = new DetectorRegistry(config.getMaxWorkers());
        this.importanceAnalyzer = new FeatureImportanceAnalyzer();

        AtomicInteger counter = new AtomicInteger();
        this.runExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "detection-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        LOG.info("Detection coordinator ready: {} detector(s) configured, {} worker(s)",
                config.getDetectors().size(), config.getMaxWorkers());
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Run detection on a batch.
     *
     * @param records   the batch
     * @param runConfig options of this run
     * @return the report; errors are reported through its status, never thrown
     */
    public DetectionReport detectAnomalies(List<Record> records, RunConfig runConfig) {
        Objects.requireNonNull(runConfig, "runConfig must not be null");
        String runId = "run-" + UUID.randomUUID();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        EngineConfig snapshot = config.get().copy();
        int totalRecords = records != null ? records.size() : 0;

        LOG.info("Run {} started: {} record(s)", runId, totalRecords);

        List<DetectorConfig> selected;
        double minConfidence;
        try {
            selected = selectDetectors(snapshot, runConfig);
            minConfidence = resolveMinConfidence(snapshot, runConfig);
        } catch (ConfigurationException e) {
            return fail(runId, ReportStatus.ERROR, e, totalRecords, startedAt);
        }

        FeatureBatch batch;
        try {
            batch = new FeatureBuilder(snapshot).build(records);
        } catch (FeatureExtractionException e) {
            return fail(runId, ReportStatus.ERROR, e, totalRecords, startedAt);
        }
        if (batch.isEmpty()) {
            LOG.warn("Run {} aborted: no usable features in {} record(s)", runId, totalRecords);
            return DetectionReport.failure(runId, ReportStatus.ERROR, NO_USABLE_FEATURES,
                    "The batch contains no usable records", totalRecords, startedAt);
        }

        Map<String, DetectorRunResult> results;
        try {
            results = detectorRegistry.runAll(batch, selected, snapshot.getContamination(), models.snapshot(),
                    snapshot.getDetectorTimeoutSeconds());
        } catch (ConfigurationException e) {
            return fail(runId, ReportStatus.ERROR, e, totalRecords, startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelled(runId, totalRecords, startedAt);
        }

        List<AnomalyCandidate> candidates = new ArrayList<>();
        results.values().forEach(r -> candidates.addAll(r.getCandidates()));

        Instant detectedAt = Instant.now();
        FusionEngine fusion = FusionEngine.forDetectors(selected, snapshot.getSeverity());
        List<IntegratedAnomaly> fused = runConfig.isUseEnsemble()
                ? fusion.fuse(candidates, minConfidence, batch, detectedAt)
                : fusion.union(candidates, batch, detectedAt);

        FeatureImportance importance = runConfig.isAnalyzeFeatureImportance()
                ? analyzeImportance(runId, batch, fused)
                : null;

        List<IntegratedAnomaly> anomalies = new ArrayList<>(fused.size());
        for (IntegratedAnomaly anomaly : fused) {
            anomalies.add(anomaly.withIds(runId, "anomaly-" + UUID.randomUUID()));
        }

        if (Thread.currentThread().isInterrupted()) {
            return cancelled(runId, totalRecords, startedAt);
        }

        boolean degraded = !runConfig.isUseEnsemble()
                || results.values().stream().anyMatch(DetectorRunResult::isDegraded);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        Map<String, Double> metrics = metrics(batch.size(), anomalies.size(), candidates.size(), results.size(),
                elapsedMs);

        DetectionReport report = DetectionReport.builder()
                .runId(runId)
                .status(degraded ? ReportStatus.DEGRADED : ReportStatus.SUCCESS)
                .totalRecords(totalRecords)
                .anomalies(anomalies)
                .detectorResults(results)
                .performanceMetrics(metrics)
                .featureImportance(importance)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();

        LOG.info("Run {} finished {}: {} anomaly(ies) in {} record(s), {} ms", runId, report.getStatus(),
                anomalies.size(), batch.size(), elapsedMs);

        return runConfig.isPersist() ? persist(report, batch.size()) : report;
    }

    /**
     * Run detection on a worker thread.
     *
     * <p>
     * Cancelling the returned future with {@code mayInterruptIfRunning}
     * abandons the run; nothing of it is persisted.
     * </p>
     */
    public Future<DetectionReport> submit(List<Record> records, RunConfig runConfig) {
        Objects.requireNonNull(runConfig, "runConfig must not be null");
        return runExecutor.submit(() -> detectAnomalies(records, runConfig));
    }

    // ---------------------------------------------------------------
    // Feedback
    // ---------------------------------------------------------------

    /**
     * Record an expert's verdict on a stored anomaly.
     *
     * @return the stored feedback
     * @throws IllegalArgumentException if the anomaly is unknown
     * @throws PersistenceException     if the store cannot be written
     */
    public ExpertFeedback recordFeedback(String anomalyId, FeedbackType type, String expertName,
            String comments) {
        Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        Objects.requireNonNull(type, "feedbackType must not be null");
        if (store.findAnomaly(anomalyId).isEmpty()) {
            throw new IllegalArgumentException("Unknown anomaly: '" + anomalyId + "'");
        }
        ExpertFeedback feedback = new ExpertFeedback("feedback-" + UUID.randomUUID(), anomalyId, type,
                expertName, comments, Instant.now());
        store.appendFeedback(feedback);
        LOG.info("Recorded {} feedback on {} from {}", type.getValue(), anomalyId, expertName);
        return feedback;
    }

    /**
     * @return per-detector feedback summary, for manual tuning
     */
    public Map<String, DetectorFeedbackSummary> summarizeFeedback() {
        return new FeedbackAnalyzer(store).summarize();
    }

    // ---------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------

    /**
     * Replace the engine configuration for subsequent runs.
     *
     * @throws ConfigurationException if {@code newConfig} is invalid; the
     *                                current configuration is kept
     */
    public void reconfigure(EngineConfig newConfig) {
        Objects.requireNonNull(newConfig, "config must not be null");
        newConfig.validate();
        EngineConfig previous = config.getAndSet(newConfig.copy());
        if (previous.getMaxWorkers() != newConfig.getMaxWorkers()) {
            LOG.warn("maxWorkers changed from {} to {}; the worker pool keeps {} until restart",
                    previous.getMaxWorkers(), newConfig.getMaxWorkers(), detectorRegistry.getMaxWorkers());
        }
        LOG.info("Engine reconfigured: {}", newConfig);
    }

    /**
     * @return a copy of the current configuration
     */
    public EngineConfig getConfig() {
        return config.get().copy();
    }

    public ModelRegistry getModels() {
        return models;
    }

    public ResultStore getStore() {
        return store;
    }

    @Override
    public void close() {
        runExecutor.shutdownNow();
        detectorRegistry.close();
        LOG.info("Detection coordinator closed");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<DetectorConfig> selectDetectors(EngineConfig snapshot, RunConfig runConfig) {
        List<String> requested = runConfig.getDetectors();
        if (requested == null || requested.isEmpty()) {
            return snapshot.getDetectors().stream().filter(DetectorConfig::isEnabled).toList();
        }
        List<DetectorConfig> selected = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String name : requested) {
            snapshot.findDetector(name).ifPresentOrElse(selected::add, () -> unknown.add(name));
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown detector(s) requested: " + unknown);
        }
        selected.stream()
                .filter(d -> !d.isEnabled())
                .forEach(d -> LOG.info("Detector '{}' requested but disabled in configuration", d.getName()));
        return selected;
    }

    private static double resolveMinConfidence(EngineConfig snapshot, RunConfig runConfig) {
        Double override = runConfig.getMinConfidence();
        if (override == null) {
            return snapshot.getMinConfidence();
        }
        if (!(override >= 0 && override <= 1)) {
            throw new ConfigurationException("'minConfidence' must be in [0, 1], got: " + override);
        }
        return override;
    }

    private FeatureImportance analyzeImportance(String runId, FeatureBatch batch,
            List<IntegratedAnomaly> anomalies) {
        try {
            return importanceAnalyzer.analyze(batch, anomalies);
        } catch (RuntimeException e) {
            LOG.warn("Run {}: feature importance analysis failed: {}", runId, e.getMessage(), e);
            return FeatureImportance.empty();
        }
    }

    private static Map<String, Double> metrics(int records, int anomalies, int candidates, int detectorsRun,
            long elapsedMs) {
        double seconds = Math.max(elapsedMs, 1L) / 1000.0;
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(METRIC_DETECTION_TIME_MS, (double) elapsedMs);
        metrics.put(METRIC_RECORDS_PER_SECOND, records / seconds);
        metrics.put(METRIC_ANOMALY_RATE, records == 0 ? 0.0 : (double) anomalies / records);
        metrics.put(METRIC_CANDIDATES, (double) candidates);
        metrics.put(METRIC_DETECTORS_RUN, (double) detectorsRun);
        return metrics;
    }

    private DetectionReport persist(DetectionReport report, int datasetSize) {
        try {
            // the run row goes last so a listed run always has its anomalies
            store.appendAnomalies(report.getAnomalies());
            store.appendPerformance(report.getDetectorResults().values().stream()
                    .map(r -> new DetectorPerformance(report.getRunId(), r, datasetSize))
                    .toList());
            store.appendRun(new DetectionRun(report.getRunId(), report.getStartedAt(), report.getCompletedAt(),
                    report.getStatus(), report.getTotalRecords(), report.getAnomaliesFound(),
                    new ArrayList<>(report.getDetectorResults().keySet()), report.getPerformanceMetrics()));
            return report.withPersistence(true, null);
        } catch (PersistenceException e) {
            LOG.warn("Run {}: results computed but not persisted: {}", report.getRunId(), e.getMessage(), e);
            return report.withPersistence(false, e.getMessage());
        }
    }

    private static DetectionReport fail(String runId, ReportStatus status, AnomalyEngineException e,
            int totalRecords, Instant startedAt) {
        LOG.warn("Run {} aborted [{}]: {}", runId, e.getCode(), e.getMessage());
        return DetectionReport.failure(runId, status, e.getCode(), e.getMessage(), totalRecords, startedAt);
    }

    private static DetectionReport cancelled(String runId, int totalRecords, Instant startedAt) {
        LOG.warn("Run {} cancelled; nothing persisted", runId);
        return DetectionReport.failure(runId, ReportStatus.CANCELLED, RUN_CANCELLED, "The run was cancelled",
                totalRecords, startedAt);
    }
}
