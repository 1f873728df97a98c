package app.chatarchive.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Id-indexed node table of a single conversation. Iteration follows the order in which nodes
 * were added, so everything derived from it is deterministic for identical exports.
 */
public final class NodeStore {

    private final Map<String, MessageNode> nodes;

    private NodeStore(Map<String, MessageNode> nodes) {
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    public static NodeStore of(Collection<MessageNode> nodes) {
        Map<String, MessageNode> table = new LinkedHashMap<>();
        for (MessageNode node : nodes) {
            if (table.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id " + node.id());
            }
        }
        return new NodeStore(table);
    }

    public static NodeStore empty() {
        return new NodeStore(new LinkedHashMap<>());
    }

    public Optional<MessageNode> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    public Collection<MessageNode> nodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }
}
