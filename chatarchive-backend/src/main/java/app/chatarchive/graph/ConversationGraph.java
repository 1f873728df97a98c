package app.chatarchive.graph;

/**
 * Raw graph of one conversation: its node table plus the export's "current" leaf pointer,
 * which may be absent or dangling.
 */
public record ConversationGraph(String conversationId, NodeStore nodes, String currentNodeId) {

    public ConversationGraph {
        nodes = nodes == null ? NodeStore.empty() : nodes;
    }
}
