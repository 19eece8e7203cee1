package io.kairos.core.extract;

import io.kairos.core.memory.Sentiment;

public record SentimentReading(Sentiment sentiment, double score) {
}
