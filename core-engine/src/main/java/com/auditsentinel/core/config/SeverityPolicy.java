package com.auditsentinel.core.config;

import com.auditsentinel.core.model.Severity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Step function mapping fused confidence and score to a {@link Severity}.
 *
 * <p>
 * Levels are evaluated from critical down to medium; the first level whose
 * confidence <em>or</em> score bound is reached (inclusive) wins, anything
 * else is {@link Severity#LOW}.
 * </p>
 *
 * @since 1.0.0
 */
public class SeverityPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    private double criticalConfidence = 0.9;
    private double criticalScore = 3.0;
    private double highConfidence = 0.8;
    private double highScore = 2.0;
    private double mediumConfidence = 0.7;
    private double mediumScore = 1.0;

    /**
     * @param confidence fused confidence
     * @param score      fused score
     * @return severity level
     */
    public Severity classify(double confidence, double score) {
        if (confidence >= criticalConfidence || score >= criticalScore) {
            return Severity.CRITICAL;
        }
        if (confidence >= highConfidence || score >= highScore) {
            return Severity.HIGH;
        }
        if (confidence >= mediumConfidence || score >= mediumScore) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    /**
     * @return problems found, empty when the levels are ordered
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!(criticalConfidence >= highConfidence && highConfidence >= mediumConfidence)) {
            errors.add("Severity confidence bounds must satisfy critical >= high >= medium");
        }
        if (!(criticalScore >= highScore && highScore >= mediumScore)) {
            errors.add("Severity score bounds must satisfy critical >= high >= medium");
        }
        return errors;
    }

    public SeverityPolicy copy() {
        SeverityPolicy copy = new SeverityPolicy();
        copy.criticalConfidence = criticalConfidence;
        copy.criticalScore = criticalScore;
        copy.highConfidence = highConfidence;
        copy.highScore = highScore;
        copy.mediumConfidence = mediumConfidence;
        copy.mediumScore = mediumScore;
        return copy;
    }

    public double getCriticalConfidence() {
        return criticalConfidence;
    }

    public void setCriticalConfidence(double criticalConfidence) {
        this.criticalConfidence = criticalConfidence;
    }

    public double getCriticalScore() {
        return criticalScore;
    }

    public void setCriticalScore(double criticalScore) {
        this.criticalScore = criticalScore;
    }

    public double getHighConfidence() {
        return highConfidence;
    }

    public void setHighConfidence(double highConfidence) {
        this.highConfidence = highConfidence;
    }

    public double getHighScore() {
        return highScore;
    }

    public void setHighScore(double highScore) {
        this.highScore = highScore;
    }

    public double getMediumConfidence() {
        return mediumConfidence;
    }

    public void setMediumConfidence(double mediumConfidence) {
        this.mediumConfidence = mediumConfidence;
    }

    public double getMediumScore() {
        return mediumScore;
    }

    public void setMediumScore(double mediumScore) {
        this.mediumScore = mediumScore;
    }

    @Override
    public String toString() {
        return "SeverityPolicy{critical=" + criticalConfidence + "/" + criticalScore
                + ", high=" + highConfidence + "/" + highScore
                + ", medium=" + mediumConfidence + "/" + mediumScore + '}';
    }
}
