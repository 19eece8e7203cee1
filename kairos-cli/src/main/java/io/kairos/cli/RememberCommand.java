package io.kairos.cli;

import io.kairos.core.MemoryEngine;
import io.kairos.core.memory.Intensity;
import io.kairos.core.memory.Memory;
import io.kairos.core.profile.Goal;
import io.kairos.core.profile.Interest;
import io.kairos.core.profile.Relationship;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "remember",
    description = "Store a fact, preference, goal, interest, relationship or long-term memory"
)
public final class RememberCommand implements Callable<Integer> {
    private final CliContext context;

    enum Kind {
        fact,
        preference,
        goal,
        interest,
        relationship,
        longterm
    }

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1", description = "One of: ${COMPLETION-CANDIDATES}")
    Kind kind;

    @Parameters(index = "2..*", arity = "1..*", description = "Text; preference takes <key> <value>, relationship <person> <relation>")
    List<String> values;

    @Option(names = {"-c", "--category"}, description = "Category label")
    String category;

    @Option(names = "--deadline", description = "Goal deadline (yyyy-MM-dd)")
    LocalDate deadline;

    @Option(names = "--importance", defaultValue = "MEDIUM", description = "Long-term importance: ${COMPLETION-CANDIDATES}")
    Intensity importance;

    public RememberCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(remember(context.engine()));
            return 0;
        } catch (Exception e) {
            System.err.println("Remember command failed: " + e.getMessage());
            return 1;
        }
    }

    private String remember(MemoryEngine engine) {
        switch (kind) {
            case fact -> {
                Memory fact = engine.addFact(ownerId, joined(0), category);
                return "Stored fact " + fact.id();
            }
            case preference -> {
                requireValues(2, "preference needs <key> <value>");
                Memory preference = engine.addPreference(ownerId, values.get(0), joined(1));
                return "Stored preference " + preference.id() + " (" + preference.describe() + ")";
            }
            case goal -> {
                Goal goal = engine.addGoal(ownerId, joined(0), category, deadline);
                return "Stored goal " + goal.id();
            }
            case interest -> {
                Interest interest = engine.addInterest(ownerId, joined(0), category);
                return "Stored interest " + interest.id();
            }
            case relationship -> {
                requireValues(2, "relationship needs <person> <relation>");
                Relationship relationship = engine.addRelationship(ownerId, values.get(0), joined(1), "");
                return "Stored relationship " + relationship.id() + " (" + relationship.describe() + ")";
            }
            case longterm -> {
                Memory memory = engine.addLongTermMemory(ownerId, joined(0), category, importance, List.of());
                return "Stored long-term memory " + memory.id();
            }
            default -> throw new IllegalArgumentException("unsupported kind " + kind);
        }
    }

    private void requireValues(int count, String message) {
        if (values == null || values.size() < count) {
            throw new IllegalArgumentException(message);
        }
    }

    private String joined(int from) {
        return String.join(" ", values.subList(from, values.size()));
    }
}
