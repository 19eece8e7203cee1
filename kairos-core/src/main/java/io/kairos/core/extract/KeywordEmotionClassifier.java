package io.kairos.core.extract;

import io.kairos.core.memory.Emotion;
import io.kairos.core.memory.Intensity;
import java.util.List;

public final class KeywordEmotionClassifier implements EmotionClassifier {
    private static final KeywordLexicon<Emotion> EMOTIONS = KeywordLexicon.<Emotion>builder()
        .add(Emotion.HAPPY, "happy", "glad", "joy", "joyful", "pleased", "delighted", "grateful", "thankful", "satisfied", "cheerful")
        .add(Emotion.SAD, "sad", "depressed", "unhappy", "lonely", "heartbroken", "miserable", "down", "crying", "tears", "grief")
        .add(Emotion.ANGRY, "angry", "mad", "furious", "annoyed", "irritated", "frustrated", "outraged", "pissed")
        .add(Emotion.ANXIOUS, "anxious", "worried", "nervous", "stressed", "stress", "afraid", "scared", "tense", "overwhelmed", "panic")
        .add(Emotion.EXCITED, "excited", "thrilled", "eager", "pumped", "motivated", "can't wait", "looking forward")
        .add(Emotion.CALM, "calm", "relaxed", "peaceful", "serene", "at ease", "content", "chill")
        .build();

    private static final KeywordLexicon<Intensity> INTENSITY = KeywordLexicon.<Intensity>builder()
        .add(Intensity.HIGH, "very", "really", "extremely", "incredibly", "totally", "completely", "deeply", "so much")
        .add(Intensity.MEDIUM, "quite", "fairly", "pretty", "moderately", "rather")
        .add(Intensity.LOW, "slightly", "a bit", "a little", "somewhat", "kind of", "mildly")
        .build();

    @Override
    public DetectedEmotion classify(String userMessage, String assistantMessage) {
        String user = userMessage == null ? "" : userMessage;
        String assistant = assistantMessage == null ? "" : assistantMessage;
        List<Emotion> matched = EMOTIONS.allMatches(user + " " + assistant);
        Intensity intensity = INTENSITY.firstMatch(user).orElse(Intensity.MEDIUM);
        if (matched.isEmpty()) {
            return new DetectedEmotion(Emotion.NEUTRAL, List.of(), intensity);
        }
        return new DetectedEmotion(matched.get(0), matched.subList(1, matched.size()), intensity);
    }
}
