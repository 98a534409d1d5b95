package com.auditsentinel.core.store;

/**
 * Expert verdicts on the anomalies one detector contributed to.
 *
 * @since 1.0.0
 */
public final class DetectorFeedbackSummary {

    private final String detectorName;
    private final int confirmed;
    private final int falsePositives;
    private final int needsReview;

    public DetectorFeedbackSummary(String detectorName, int confirmed, int falsePositives, int needsReview) {
        this.detectorName = detectorName;
        this.confirmed = confirmed;
        this.falsePositives = falsePositives;
        this.needsReview = needsReview;
    }

    public String getDetectorName() {
        return detectorName;
    }

    public int getConfirmed() {
        return confirmed;
    }

    public int getFalsePositives() {
        return falsePositives;
    }

    public int getNeedsReview() {
        return needsReview;
    }

    public int getTotal() {
        return confirmed + falsePositives + needsReview;
    }

    /**
     * @return confirmed / (confirmed + false positives), 0 when nothing was
     *         resolved yet
     */
    public double getPrecision() {
        int resolved = confirmed + falsePositives;
        return resolved == 0 ? 0.0 : (double) confirmed / resolved;
    }

    DetectorFeedbackSummary add(DetectorFeedbackSummary other) {
        return new DetectorFeedbackSummary(detectorName, confirmed + other.confirmed,
                falsePositives + other.falsePositives, needsReview + other.needsReview);
    }

    @Override
    public String toString() {
        return "DetectorFeedbackSummary{" +
                "detector='" + detectorName + '\'' +
                ", confirmed=" + confirmed +
                ", falsePositives=" + falsePositives +
                ", needsReview=" + needsReview +
                '}';
    }
}
