package io.kairos.core.extract;

public interface EmotionClassifier {

    /**
     * Emotions are read from both messages, intensity from the user message only.
     * Never returns null; text without any emotion keyword has a neutral primary emotion.
     */
    DetectedEmotion classify(String userMessage, String assistantMessage);
}
