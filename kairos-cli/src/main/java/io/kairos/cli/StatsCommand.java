package io.kairos.cli;

import io.kairos.core.EmotionalStats;
import io.kairos.core.MemoryStats;
import io.kairos.core.scoring.ScoringStats;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "stats", description = "Show memory counts and score statistics for an owner")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1", arity = "0..1", description = "Query text to score against")
    String query;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryStats memoryStats = context.engine().getMemoryStats(ownerId);
            System.out.println("Owner: " + ownerId);
            System.out.println("Memories: " + memoryStats.totalMemories());
            memoryStats.byKind().forEach((kind, count) -> System.out.println("  " + kind + ": " + count));
            System.out.println("Relationships: " + memoryStats.relationships());
            System.out.println("Goals: " + memoryStats.goals() + " (" + memoryStats.activeGoals() + " active)");
            System.out.println("Interests: " + memoryStats.interests());

            EmotionalStats emotional = context.engine().getEmotionalStats(ownerId);
            System.out.println("Dominant emotion: " + emotional.dominant().label() + " over " + emotional.totalStates() + " states");

            List<Double> embedding = query == null || query.isBlank() ? List.of() : context.engine().embed(query);
            ScoringStats scores = context.engine().getScoringStats(ownerId, embedding);
            System.out.println(String.format(
                Locale.ROOT,
                "Scores: mean %.3f, median %.3f, min %.3f, max %.3f",
                scores.mean(),
                scores.median(),
                scores.min(),
                scores.max()
            ));
            System.out.println("Distribution: high " + scores.distribution().high()
                + ", medium " + scores.distribution().medium()
                + ", low " + scores.distribution().low());
            for (ScoringStats.TopScore top : scores.topMemories()) {
                System.out.println(String.format(Locale.ROOT, "  %.3f %s %s", top.total(), top.kind(), top.id()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Stats command failed: " + e.getMessage());
            return 1;
        }
    }
}
