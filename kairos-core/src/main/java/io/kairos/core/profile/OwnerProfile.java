package io.kairos.core.profile;

import java.util.List;

/**
 * Category records kept next to an owner's memories: people, goals and interests.
 */
public record OwnerProfile(
    List<Relationship> relationships,
    List<Goal> goals,
    List<Interest> interests
) {
    public OwnerProfile {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        goals = goals == null ? List.of() : List.copyOf(goals);
        interests = interests == null ? List.of() : List.copyOf(interests);
    }

    public static OwnerProfile empty() {
        return new OwnerProfile(List.of(), List.of(), List.of());
    }

    public List<Goal> activeGoals() {
        return goals.stream().filter(Goal::active).toList();
    }
}
