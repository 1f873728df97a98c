package app.chatarchive.graph;

public class MalformedGraphException extends InvalidGraphException {

    public MalformedGraphException(String conversationId, String reason) {
        super(conversationId, reason);
    }
}
