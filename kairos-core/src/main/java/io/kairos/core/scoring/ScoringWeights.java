package io.kairos.core.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weights of the five relevance signals. They need not sum to 1; the total is clamped instead.
 */
public record ScoringWeights(
    double alpha,
    double beta,
    double gamma,
    double delta,
    double epsilon
) {
    private static final Logger LOG = LoggerFactory.getLogger(ScoringWeights.class);

    public static final ScoringWeights DEFAULTS = new ScoringWeights(0.6, 0.2, 0.15, 0.05, 0.1);

    public static ScoringWeights defaults() {
        return DEFAULTS;
    }

    /**
     * Replaces every weight that is not a finite number in [0, 1] with its default.
     */
    public ScoringWeights sanitized() {
        double a = sane("alpha", alpha, DEFAULTS.alpha);
        double b = sane("beta", beta, DEFAULTS.beta);
        double g = sane("gamma", gamma, DEFAULTS.gamma);
        double d = sane("delta", delta, DEFAULTS.delta);
        double e = sane("epsilon", epsilon, DEFAULTS.epsilon);
        if (a == alpha && b == beta && g == gamma && d == delta && e == epsilon) {
            return this;
        }
        return new ScoringWeights(a, b, g, d, e);
    }

    private static double sane(String name, double value, double fallback) {
        if (Double.isFinite(value) && value >= 0.0 && value <= 1.0) {
            return value;
        }
        LOG.warn("Scoring weight {}={} is outside [0, 1]; using default {}", name, value, fallback);
        return fallback;
    }
}
