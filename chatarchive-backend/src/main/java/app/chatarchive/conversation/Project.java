package app.chatarchive.conversation;

import java.util.List;

/**
 * A project bucket. Members are referenced by conversation id, ordered most recently updated first.
 */
public record Project(String id, String name, List<String> conversationIds) {

    public Project {
        conversationIds = List.copyOf(conversationIds);
    }

    public boolean isUnassigned() {
        return ProjectGrouper.UNASSIGNED_ID.equals(id);
    }
}
