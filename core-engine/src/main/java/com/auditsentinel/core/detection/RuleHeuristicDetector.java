package com.auditsentinel.core.detection;

import com.auditsentinel.core.detection.model.ModelHandles;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import com.auditsentinel.core.model.FeatureVector;
import com.auditsentinel.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic auditor checks on the monetary fields of each record.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li><b>zero amount</b>: an amount of exactly 0</li>
 * <li><b>negative balance</b>: a negative amount on an account that should
 * never go negative (account field contains one of
 * {@code negativeAccountKeywords}, default receivable / 应收)</li>
 * <li><b>ceiling</b>: {@code |amount| > ceiling} (default 10,000,000)</li>
 * </ul>
 *
 * <p>
 * Rules apply to every field whose name matches an amount keyword and read
 * the values as submitted, never imputed ones. A non-numeric entry is skipped
 * without disabling the rules for the rest of the column. A record breaking at
 * least one rule becomes a candidate with the configured {@code confidence}
 * (default 0.9) and a raw score equal to the number of violations. Needs no
 * model and always runs.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleHeuristicDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RuleHeuristicDetector.class);

    static final double DEFAULT_CEILING = 10_000_000d;
    static final double DEFAULT_CONFIDENCE = 0.9;
    static final List<String> DEFAULT_NEGATIVE_ACCOUNT_KEYWORDS = List.of("receivable", "应收");

    private final String name;
    private final String accountField;
    private final List<String> negativeAccountKeywords;
    private final double ceiling;
    private final double confidence;

    public RuleHeuristicDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.name = Objects.requireNonNull(config.getName(), "Detector name must not be null");
        this.accountField = config.stringParameter("accountField", "account");
        this.negativeAccountKeywords = config.stringListParameter("negativeAccountKeywords",
                DEFAULT_NEGATIVE_ACCOUNT_KEYWORDS).stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        this.ceiling = config.doubleParameter("ceiling", DEFAULT_CEILING);
        this.confidence = config.doubleParameter("confidence", DEFAULT_CONFIDENCE);

        if (!(ceiling > 0)) {
            throw new IllegalArgumentException("ceiling must be > 0, got: " + ceiling);
        }
        if (!(confidence >= 0 && confidence <= 1)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
    }

    @Override
    public List<AnomalyCandidate> detect(FeatureBatch batch, ModelHandles models) {
        List<String> amountFields = batch.getMonetaryFields();
        if (amountFields.isEmpty()) {
            LOG.debug("Detector [{}]: batch has no amount fields", name);
            return List.of();
        }

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (FeatureVector vector : batch.getVectors()) {
            List<String> violations = new ArrayList<>();
            boolean neverNegative = isNeverNegativeAccount(vector);

            for (String field : amountFields) {
                Optional<Double> amount = Record.toNumber(vector.getSource().get(field));
                if (amount.isEmpty()) {
                    continue;
                }
                double value = amount.get();
                if (value == 0.0) {
                    violations.add(field + " is zero");
                }
                if (value < 0 && neverNegative) {
                    violations.add(String.format("%s is negative (%.2f) on account '%s'", field, value,
                            vector.getSource().get(accountField)));
                }
                if (Math.abs(value) > ceiling) {
                    violations.add(String.format("%s %.2f exceeds ceiling %.0f", field, value, ceiling));
                }
            }

            if (!violations.isEmpty()) {
                LOG.debug("Detector [{}] flagged {}: {}", name, vector.getRecordId(), violations);
                candidates.add(AnomalyCandidate.builder()
                        .recordId(vector.getRecordId())
                        .detectorName(name)
                        .rawScore(violations.size())
                        .confidence(confidence)
                        .anomalyType(AnomalyType.BUSINESS)
                        .explanation(String.join(", ", violations))
                        .build());
            }
        }
        return candidates;
    }

    private boolean isNeverNegativeAccount(FeatureVector vector) {
        Object account = vector.getSource().get(accountField);
        if (account == null) {
            return false;
        }
        String lower = account.toString().toLowerCase(Locale.ROOT);
        return negativeAccountKeywords.stream().anyMatch(lower::contains);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.RULE_HEURISTIC;
    }

    @Override
    public boolean requiresFittedModel() {
        return false;
    }
}
