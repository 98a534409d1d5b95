package com.auditsentinel.core.store;

import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.IntegratedAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Summarises expert feedback per detector so weights and thresholds can be
 * tuned by hand.
 *
 * <p>
 * A verdict on an anomaly counts for every detector that contributed to it.
 * Feedback on anomalies the store no longer knows is ignored. Nothing here
 * changes the engine configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedbackAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(FeedbackAnalyzer.class);

    private final ResultStore store;

    public FeedbackAnalyzer(ResultStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * @return detector name to summary, sorted by detector name
     */
    public Map<String, DetectorFeedbackSummary> summarize() {
        Map<String, DetectorFeedbackSummary> summaries = new TreeMap<>();
        int orphaned = 0;

        for (ExpertFeedback feedback : store.listFeedback()) {
            Optional<IntegratedAnomaly> anomaly = store.findAnomaly(feedback.getAnomalyId());
            if (anomaly.isEmpty() || feedback.getFeedbackType() == null) {
                orphaned++;
                continue;
            }
            for (String detector : anomaly.get().getContributingDetectors()) {
                DetectorFeedbackSummary delta = switch (feedback.getFeedbackType()) {
                    case CONFIRMED -> new DetectorFeedbackSummary(detector, 1, 0, 0);
                    case FALSE_POSITIVE -> new DetectorFeedbackSummary(detector, 0, 1, 0);
                    case NEEDS_REVIEW -> new DetectorFeedbackSummary(detector, 0, 0, 1);
                };
                summaries.merge(detector, delta, DetectorFeedbackSummary::add);
            }
        }

        if (orphaned > 0) {
            LOG.warn("Ignored {} feedback entry(ies) without a known anomaly", orphaned);
        }
        return Collections.unmodifiableMap(summaries);
    }

    /**
     * @return summaries ordered by precision ascending, weakest detector first
     */
    public List<DetectorFeedbackSummary> rankByPrecision() {
        return summarize().values().stream()
                .sorted((a, b) -> Double.compare(a.getPrecision(), b.getPrecision()))
                .toList();
    }
}
