package io.kairos.core.extract;

import io.kairos.core.memory.Sentiment;

public final class SentimentAnalyzer {
    private static final KeywordLexicon<Sentiment> WORDS = KeywordLexicon.<Sentiment>builder()
        .add(Sentiment.POSITIVE, "good", "great", "happy", "glad", "love", "satisfied", "success", "hope", "thanks", "thank")
        .add(Sentiment.NEGATIVE, "bad", "sad", "angry", "disappointed", "worried", "anxious", "stress", "stressed", "terrible", "hate")
        .build();

    /**
     * Score is {@code (positive - negative) / (positive + negative)}, 0 when neither occurs.
     */
    public SentimentReading analyze(String text) {
        int positive = WORDS.count(text, Sentiment.POSITIVE);
        int negative = WORDS.count(text, Sentiment.NEGATIVE);
        if (positive + negative == 0) {
            return new SentimentReading(Sentiment.NEUTRAL, 0.0);
        }
        double score = (positive - negative) / (double) (positive + negative);
        Sentiment sentiment = positive > negative ? Sentiment.POSITIVE
            : negative > positive ? Sentiment.NEGATIVE
            : Sentiment.NEUTRAL;
        return new SentimentReading(sentiment, score);
    }
}
