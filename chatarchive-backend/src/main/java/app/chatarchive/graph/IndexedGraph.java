package app.chatarchive.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A validated conversation graph: exactly one root and children lists derived from parent links.
 * Traversals take ids and look nodes up through the store, so malformed input can at worst
 * produce a {@link CyclicGraphException}, never an endless walk.
 */
public final class IndexedGraph {

    private final String conversationId;
    private final NodeStore store;
    private final String rootId;
    private final Map<String, List<String>> children;

    IndexedGraph(String conversationId, NodeStore store, String rootId, Map<String, List<String>> children) {
        this.conversationId = conversationId;
        this.store = store;
        this.rootId = rootId;
        this.children = Map.copyOf(children);
    }

    public String conversationId() {
        return conversationId;
    }

    public MessageNode root() {
        return store.find(rootId).orElseThrow();
    }

    public Optional<MessageNode> node(String id) {
        return store.find(id);
    }

    public List<String> children(String id) {
        return children.getOrDefault(id, List.of());
    }

    public List<MessageNode> leaves() {
        List<MessageNode> leaves = new ArrayList<>();
        for (MessageNode node : store.nodes()) {
            if (children(node.id()).isEmpty()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /**
     * Ancestor chain of {@code leafId}, starting with the leaf itself and ending at the first node
     * without a resolvable parent (the root, for any node attached to the tree).
     *
     * @throws IllegalArgumentException if the id is not part of this graph
     * @throws CyclicGraphException if following parent links revisits a node
     */
    public List<MessageNode> pathToRoot(String leafId) {
        MessageNode current = store.find(leafId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node " + leafId));
        List<MessageNode> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        while (current != null) {
            if (!visited.add(current.id())) {
                throw new CyclicGraphException(conversationId, current.id());
            }
            path.add(current);
            current = current.hasParent() ? store.find(current.parentId()).orElse(null) : null;
        }
        return path;
    }
}
