package io.kairos.core.scoring;

public record ScoreResult(double total, ScoreBreakdown breakdown, ScoreSignals signals) {
}
