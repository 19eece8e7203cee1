package io.kairos.core.scoring;

/**
 * Unweighted signal values, each in [0, 1].
 */
public record ScoreSignals(
    double semantic,
    double timeDecay,
    double salience,
    double emotion,
    double accessFrequency
) {
}
