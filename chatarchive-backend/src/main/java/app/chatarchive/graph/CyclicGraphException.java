package app.chatarchive.graph;

public class CyclicGraphException extends InvalidGraphException {

    private final String nodeId;

    public CyclicGraphException(String conversationId, String nodeId) {
        super(conversationId, "cycle detected at node " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
