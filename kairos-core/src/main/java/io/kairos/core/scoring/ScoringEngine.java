package io.kairos.core.scoring;

import io.kairos.core.memory.Memory;
import io.kairos.core.vector.DimensionMismatchException;
import io.kairos.core.vector.VectorMath;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-signal relevance score of a memory against a query embedding.
 *
 * <pre>
 * total = clamp01(alpha*semantic + beta*timeDecay + gamma*salience + delta*emotion + epsilon*accessFrequency)
 * </pre>
 */
public final class ScoringEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ScoringEngine.class);
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final double CREATION_DECAY_SHARE = 0.7;
    private static final double ACCESS_DECAY_SHARE = 0.3;
    private static final int TOP_STATS = 5;

    public static final double DEFAULT_DECAY_LAMBDA = 0.1;

    private final Clock clock;
    private final double decayLambda;

    public ScoringEngine(Clock clock) {
        this(clock, DEFAULT_DECAY_LAMBDA);
    }

    public ScoringEngine(Clock clock, double decayLambda) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (!Double.isFinite(decayLambda) || decayLambda < 0) {
            LOG.warn("Decay lambda {} is invalid; using {}", decayLambda, DEFAULT_DECAY_LAMBDA);
            decayLambda = DEFAULT_DECAY_LAMBDA;
        }
        this.decayLambda = decayLambda;
    }

    public ScoreResult score(List<Double> queryEmbedding, Memory memory) {
        return score(queryEmbedding, memory, ScoringWeights.DEFAULTS);
    }

    public ScoreResult score(List<Double> queryEmbedding, Memory memory, ScoringWeights weights) {
        ScoringWeights w = weights == null ? ScoringWeights.DEFAULTS : weights.sanitized();
        Instant now = clock.instant();
        double daysSinceCreation = daysBetween(memory.createdAt(), now);
        double daysSinceAccess = daysBetween(memory.lastAccessedAt(), now);

        ScoreSignals signals = new ScoreSignals(
            semantic(queryEmbedding, memory),
            timeDecay(daysSinceCreation, daysSinceAccess, decayLambda),
            memory.salience(),
            (memory.emotionScore() + 1.0) / 2.0,
            accessFrequency(memory.accessCount(), daysSinceCreation)
        );
        ScoreBreakdown breakdown = new ScoreBreakdown(
            w.alpha() * signals.semantic(),
            w.beta() * signals.timeDecay(),
            w.gamma() * signals.salience(),
            w.delta() * signals.emotion(),
            w.epsilon() * signals.accessFrequency()
        );
        double total = Math.max(0.0, Math.min(1.0, breakdown.sum()));
        return new ScoreResult(total, breakdown, signals);
    }

    /**
     * Sorts by total, highest first. Equal totals keep their input order.
     */
    public List<ScoredMemory> rank(List<Double> queryEmbedding, List<Memory> memories, ScoringWeights weights) {
        if (memories == null || memories.isEmpty()) {
            return List.of();
        }
        ScoringWeights w = weights == null ? ScoringWeights.DEFAULTS : weights.sanitized();
        List<ScoredMemory> scored = new ArrayList<>(memories.size());
        for (Memory memory : memories) {
            scored.add(new ScoredMemory(memory, score(queryEmbedding, memory, w)));
        }
        scored.sort(Comparator.comparingDouble(ScoredMemory::total).reversed());
        return scored;
    }

    public List<ScoredMemory> topK(List<Double> queryEmbedding, List<Memory> memories, ScoringWeights weights, int k) {
        if (k <= 0) {
            return List.of();
        }
        List<ScoredMemory> ranked = rank(queryEmbedding, memories, weights);
        return ranked.size() <= k ? ranked : List.copyOf(ranked.subList(0, k));
    }

    public ScoringStats stats(List<Double> queryEmbedding, List<Memory> memories, ScoringWeights weights) {
        List<ScoredMemory> ranked = rank(queryEmbedding, memories, weights);
        if (ranked.isEmpty()) {
            return ScoringStats.empty();
        }
        List<Double> sorted = ranked.stream().map(ScoredMemory::total).sorted().toList();
        double mean = sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        int size = sorted.size();
        double median = size % 2 == 1
            ? sorted.get(size / 2)
            : (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;

        int high = 0;
        int medium = 0;
        int low = 0;
        for (double total : sorted) {
            if (total > 0.7) {
                high++;
            } else if (total > 0.3) {
                medium++;
            } else {
                low++;
            }
        }
        List<ScoringStats.TopScore> top = ranked.stream()
            .limit(TOP_STATS)
            .map(s -> new ScoringStats.TopScore(s.memory().id(), s.memory().kind(), s.total()))
            .toList();
        return new ScoringStats(
            size,
            mean,
            median,
            sorted.get(0),
            sorted.get(size - 1),
            new ScoringStats.Distribution(high, medium, low),
            top
        );
    }

    public static double timeDecay(double daysSinceCreation, double daysSinceLastAccess, double lambda) {
        return CREATION_DECAY_SHARE * Math.exp(-lambda * Math.max(0.0, daysSinceCreation))
            + ACCESS_DECAY_SHARE * Math.exp(-lambda * Math.max(0.0, daysSinceLastAccess));
    }

    public static double accessFrequency(long accessCount, double daysSinceCreation) {
        double dailyRate = Math.max(0, accessCount) / Math.max(1.0, daysSinceCreation);
        return Math.min(1.0, Math.log(1.0 + dailyRate) / Math.log(10.0));
    }

    private double semantic(List<Double> queryEmbedding, Memory memory) {
        try {
            return Math.max(0.0, VectorMath.cosine(queryEmbedding, memory.embedding()));
        } catch (DimensionMismatchException e) {
            LOG.debug("Memory {} not comparable with query: {}", memory.id(), e.getMessage());
            return 0.0;
        }
    }

    private static double daysBetween(Instant from, Instant to) {
        return Math.max(0.0, Duration.between(from, to).toMillis() / MILLIS_PER_DAY);
    }
}
