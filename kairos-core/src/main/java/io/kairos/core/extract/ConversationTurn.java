package io.kairos.core.extract;

public record ConversationTurn(String ownerId, String userMessage, String assistantMessage) {
    public ConversationTurn {
        ownerId = ownerId == null ? "" : ownerId.trim();
        userMessage = userMessage == null ? "" : userMessage.trim();
        assistantMessage = assistantMessage == null ? "" : assistantMessage.trim();
    }

    public String combinedText() {
        return (userMessage + " " + assistantMessage).trim();
    }
}
