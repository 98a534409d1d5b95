package com.auditsentinel.core.detection;

import com.auditsentinel.core.detection.model.ModelHandles;
import com.auditsentinel.core.exception.ModelUnavailableException;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the enabled detectors of a run concurrently on a bounded worker pool.
 *
 * <h3>Fault isolation</h3>
 * <ul>
 * <li>A detector that throws is reported {@code FAILED} with no
 * candidates.</li>
 * <li>A detector without its fitted model is reported {@code SKIPPED}.</li>
 * <li>Detectors still running when the run timeout expires are cancelled and
 * reported {@code TIMED_OUT}.</li>
 * </ul>
 * <p>
 * None of these abort the run. Only an invalid detector configuration, found
 * before any detector starts, and interruption of the calling thread
 * propagate.
 * </p>
 *
 * <p>
 * The pool is shared by all runs of one coordinator; each call joins only its
 * own tasks.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRegistry.class);

    private final ExecutorService pool;
    private final int maxWorkers;

    /**
     * @param maxWorkers pool size, at least 1
     */
    public DetectorRegistry(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(maxWorkers, r -> {
            Thread t = new Thread(r, "detector-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run every enabled detector of {@code configs} against {@code batch}.
     *
     * @param batch          features of the run, non-empty
     * @param configs        detector configurations of the run; disabled ones
     *                       are ignored
     * @param contamination  expected anomaly share
     * @param models         fitted models of the run
     * @param timeoutSeconds time limit for the whole detector group; 0 or less
     *                       waits indefinitely
     * @return one result per enabled detector, in configuration order
     * @throws com.auditsentinel.core.exception.ConfigurationException if a
     *         detector cannot be created
     * @throws InterruptedException if the calling thread is interrupted; running
     *                              detectors are cancelled
     */
    public Map<String, DetectorRunResult> runAll(FeatureBatch batch, List<DetectorConfig> configs,
            double contamination, ModelHandles models, long timeoutSeconds) throws InterruptedException {
        Objects.requireNonNull(batch, "batch must not be null");
        Objects.requireNonNull(configs, "configs must not be null");
        Objects.requireNonNull(models, "models must not be null");

        List<DetectorConfig> enabled = configs.stream().filter(DetectorConfig::isEnabled).toList();
        return runDetectors(batch, DetectorFactory.createAll(enabled, contamination), models, timeoutSeconds);
    }

    /**
     * Run already created detectors against {@code batch}.
     *
     * @see #runAll(FeatureBatch, List, double, ModelHandles, long)
     */
    public Map<String, DetectorRunResult> runDetectors(FeatureBatch batch, List<AnomalyDetector> detectors,
            ModelHandles models, long timeoutSeconds) throws InterruptedException {
        Objects.requireNonNull(batch, "batch must not be null");
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (detectors.isEmpty()) {
            LOG.info("No enabled detectors for this run");
            return Map.of();
        }

        Instant groupStart = Instant.now();
        List<Callable<DetectorRunResult>> tasks = new ArrayList<>(detectors.size());
        for (AnomalyDetector detector : detectors) {
            tasks.add(() -> execute(detector, batch, models));
        }

        LOG.debug("Running {} detector(s) on {} record(s) with {} worker(s)", tasks.size(), batch.size(),
                maxWorkers);
        List<Future<DetectorRunResult>> futures = timeoutSeconds > 0
                ? pool.invokeAll(tasks, timeoutSeconds, TimeUnit.SECONDS)
                : pool.invokeAll(tasks);

        Map<String, DetectorRunResult> results = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            String name = detectors.get(i).getName();
            results.put(name, collect(name, futures.get(i), groupStart));
        }
        return Collections.unmodifiableMap(results);
    }

    private DetectorRunResult collect(String name, Future<DetectorRunResult> future, Instant groupStart)
            throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            long elapsed = Instant.now().toEpochMilli() - groupStart.toEpochMilli();
            LOG.warn("Detector [{}] timed out after {} ms", name, elapsed);
            return DetectorRunResult.timedOut(name, groupStart, elapsed);
        } catch (ExecutionException e) {
            // only non-RuntimeException throwables get here; execute() handles the rest
            LOG.error("Detector [{}] crashed: {}", name, e.getCause(), e.getCause());
            return DetectorRunResult.failed(name, String.valueOf(e.getCause()), groupStart, 0L);
        }
    }

    private DetectorRunResult execute(AnomalyDetector detector, FeatureBatch batch, ModelHandles models) {
        String name = detector.getName();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        try {
            List<AnomalyCandidate> candidates = detector.detect(batch, models);
            long elapsed = elapsedMs(start);
            LOG.debug("Detector [{}] produced {} candidate(s) in {} ms", name, candidates.size(), elapsed);
            return DetectorRunResult.success(name, candidates, startedAt, elapsed);
        } catch (ModelUnavailableException e) {
            LOG.warn("Detector [{}] skipped: {}", name, e.getMessage());
            return DetectorRunResult.skipped(name, e.getMessage(), startedAt, elapsedMs(start));
        } catch (RuntimeException e) {
            LOG.error("Detector [{}] failed: {}", name, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return DetectorRunResult.failed(name, message, startedAt, elapsedMs(start));
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Stop the worker pool. Running detectors are interrupted.
     */
    @Override
    public void close() {
        pool.shutdownNow();
        LOG.debug("Detector pool shut down");
    }
}
