package app.chatarchive.conversation;

public record SkippedConversation(String conversationId, String reason) {
}
