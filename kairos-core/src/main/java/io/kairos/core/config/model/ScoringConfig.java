package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.scoring.ScoringEngine;
import io.kairos.core.scoring.ScoringWeights;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoringConfig(
    double alpha,
    double beta,
    double gamma,
    double delta,
    double epsilon,
    double decayLambdaPerDay
) {

    public static ScoringConfig defaults() {
        ScoringWeights weights = ScoringWeights.defaults();
        return new ScoringConfig(
            weights.alpha(),
            weights.beta(),
            weights.gamma(),
            weights.delta(),
            weights.epsilon(),
            ScoringEngine.DEFAULT_DECAY_LAMBDA
        );
    }

    public ScoringWeights toWeights() {
        return new ScoringWeights(alpha, beta, gamma, delta, epsilon).sanitized();
    }
}
