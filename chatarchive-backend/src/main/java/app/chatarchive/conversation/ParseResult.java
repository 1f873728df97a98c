package app.chatarchive.conversation;

import java.util.ArrayList;
import java.util.List;

public record ParseResult(List<Conversation> conversations, List<SkippedConversation> skipped) {

    public ParseResult {
        conversations = List.copyOf(conversations);
        skipped = List.copyOf(skipped);
    }

    public ParseResult withSkipped(List<SkippedConversation> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        List<SkippedConversation> merged = new ArrayList<>(additional);
        merged.addAll(skipped);
        return new ParseResult(conversations, merged);
    }
}
