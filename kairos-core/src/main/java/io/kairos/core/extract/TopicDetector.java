package io.kairos.core.extract;

import io.kairos.core.memory.Topic;
import java.util.List;

public final class TopicDetector {
    private static final KeywordLexicon<Topic> TOPICS = KeywordLexicon.<Topic>builder()
        .add(Topic.WORK, "work", "working", "job", "office", "company", "project", "projects", "career", "deadline", "meeting")
        .add(Topic.FAMILY, "family", "parents", "parent", "mom", "dad", "mother", "father", "son", "daughter", "brother", "sister", "kids")
        .add(Topic.HEALTH, "health", "healthy", "sick", "exercise", "workout", "diet", "doctor", "sleep", "treatment")
        .add(Topic.EDUCATION, "study", "studying", "learn", "learning", "school", "class", "course", "exam", "education")
        .add(Topic.RELATIONSHIPS, "friend", "friends", "relationship", "partner", "girlfriend", "boyfriend", "colleague", "colleagues", "coworker")
        .add(Topic.HOBBIES, "hobby", "hobbies", "game", "games", "gaming", "reading", "book", "books", "music", "painting", "guitar")
        .add(Topic.EMOTIONS, "feel", "feeling", "feelings", "mood", "stress", "stressed", "emotion", "emotions")
        .add(Topic.GOALS, "goal", "goals", "plan", "plans", "future", "dream", "dreams", "hope", "ambition")
        .build();

    public List<Topic> detect(String text) {
        return TOPICS.allMatches(text);
    }
}
