package io.kairos.core.extract;

public interface MemoryExtractor {

    /**
     * Best-effort derivation of memory records from a turn. Never throws on malformed input.
     */
    ExtractedMemories extract(ConversationTurn turn, ExtractionHistory history);
}
