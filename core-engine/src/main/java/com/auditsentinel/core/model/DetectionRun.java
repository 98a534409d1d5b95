package com.auditsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata of one detection run, finalized once fusion completes and then
 * appended to the result store.
 *
 * @since 1.0.0
 */
public class DetectionRun implements Serializable {

    private static final long serialVersionUID = 1L;

    private String runId;
    private Instant startedAt;
    private Instant completedAt;
    private ReportStatus status;
    private int totalRecords;
    private int anomaliesFound;
    private List<String> detectorsUsed = new ArrayList<>();
    private Map<String, Double> performanceMetrics = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public DetectionRun() {
    }

    public DetectionRun(String runId, Instant startedAt, Instant completedAt, ReportStatus status,
            int totalRecords, int anomaliesFound, List<String> detectorsUsed,
            Map<String, Double> performanceMetrics) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.completedAt = completedAt;
        this.status = status;
        this.totalRecords = totalRecords;
        this.anomaliesFound = anomaliesFound;
        setDetectorsUsed(detectorsUsed);
        setPerformanceMetrics(performanceMetrics);
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public void setStatus(ReportStatus status) {
        this.status = status;
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public void setTotalRecords(int totalRecords) {
        this.totalRecords = totalRecords;
    }

    public int getAnomaliesFound() {
        return anomaliesFound;
    }

    public void setAnomaliesFound(int anomaliesFound) {
        this.anomaliesFound = anomaliesFound;
    }

    public List<String> getDetectorsUsed() {
        return Collections.unmodifiableList(detectorsUsed);
    }

    public void setDetectorsUsed(List<String> detectorsUsed) {
        this.detectorsUsed = detectorsUsed != null ? new ArrayList<>(detectorsUsed) : new ArrayList<>();
    }

    public Map<String, Double> getPerformanceMetrics() {
        return Collections.unmodifiableMap(performanceMetrics);
    }

    public void setPerformanceMetrics(Map<String, Double> performanceMetrics) {
        this.performanceMetrics = performanceMetrics != null
                ? new LinkedHashMap<>(performanceMetrics)
                : new LinkedHashMap<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRun that))
            return false;
        return Objects.equals(runId, that.runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId);
    }

    @Override
    public String toString() {
        return "DetectionRun{" +
                "runId='" + runId + '\'' +
                ", status=" + status +
                ", totalRecords=" + totalRecords +
                ", anomaliesFound=" + anomaliesFound +
                ", detectorsUsed=" + detectorsUsed +
                '}';
    }
}
