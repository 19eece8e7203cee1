package io.kairos.core.extract;

import io.kairos.core.memory.Intensity;
import io.kairos.core.memory.LifeEventCategory;
import io.kairos.core.memory.LifeEventPayload;
import java.util.Optional;

public final class KeywordLifeEventClassifier implements LifeEventClassifier {
    private static final KeywordLexicon<LifeEventCategory> CATEGORIES = KeywordLexicon.<LifeEventCategory>builder()
        .add(LifeEventCategory.EDUCATION, "graduate", "graduated", "graduation", "exam", "exams", "school", "university", "college", "degree", "enrolled")
        .add(LifeEventCategory.CAREER, "job", "career", "promotion", "promoted", "hired", "new role", "company", "boss", "interview", "resigned", "laid off")
        .add(LifeEventCategory.RELATIONSHIP, "married", "marriage", "wedding", "divorce", "divorced", "dating", "engaged", "breakup", "broke up", "girlfriend", "boyfriend")
        .add(LifeEventCategory.FAMILY, "born", "birth", "birthday", "anniversary", "baby", "pregnant", "family")
        .add(LifeEventCategory.RESIDENCE, "moved", "moving", "new house", "new apartment", "new home", "relocated", "relocating")
        .add(LifeEventCategory.TRAVEL, "trip", "travel", "traveling", "travelling", "vacation", "holiday", "visited", "visiting", "flight")
        .add(LifeEventCategory.HEALTH, "sick", "hospital", "illness", "surgery", "diagnosed", "doctor", "treatment", "injury", "injured")
        .add(LifeEventCategory.LOSS, "passed away", "died", "death", "funeral", "lost my")
        .add(LifeEventCategory.ACHIEVEMENT, "achieved", "accomplished", "succeeded", "success", "won", "milestone", "reached my goal")
        .add(LifeEventCategory.CHALLENGE, "failed", "failure", "struggling", "struggle", "setback", "rejected", "disappointed")
        .build();

    private static final KeywordLexicon<Intensity> IMPORTANCE = KeywordLexicon.<Intensity>builder()
        .add(Intensity.HIGH, "important", "major", "big", "huge", "life-changing", "turning point", "significant")
        .add(Intensity.MEDIUM, "normal", "usual", "ordinary", "regular")
        .add(Intensity.LOW, "small", "minor", "little", "trivial")
        .build();

    @Override
    public Optional<LifeEventCandidate> classify(String userMessage) {
        return CATEGORIES.firstMatch(userMessage).map(category -> new LifeEventCandidate(
            category,
            IMPORTANCE.firstMatch(userMessage).orElse(Intensity.MEDIUM),
            userMessage.length() > LifeEventPayload.MAX_DESCRIPTION
                ? userMessage.substring(0, LifeEventPayload.MAX_DESCRIPTION)
                : userMessage
        ));
    }
}
