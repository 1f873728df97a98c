package app.chatarchive.graph;

/**
 * A conversation graph that cannot be linearized. The conversation is skipped, the rest of the
 * export is unaffected.
 */
public abstract class InvalidGraphException extends RuntimeException {

    private final String conversationId;
    private final String reason;

    protected InvalidGraphException(String conversationId, String reason) {
        super("Conversation " + conversationId + ": " + reason);
        this.conversationId = conversationId;
        this.reason = reason;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getReason() {
        return reason;
    }
}
