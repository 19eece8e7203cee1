package io.kairos.core.scoring;

/**
 * Weighted contribution of each signal. {@link #sum()} is the total before clamping.
 */
public record ScoreBreakdown(
    double semantic,
    double timeDecay,
    double salience,
    double emotion,
    double accessFrequency
) {
    public double sum() {
        return semantic + timeDecay + salience + emotion + accessFrequency;
    }
}
