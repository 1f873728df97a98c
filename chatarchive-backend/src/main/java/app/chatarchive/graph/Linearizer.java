package app.chatarchive.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

/**
 * Selects the one path through a conversation graph that represents what the user last saw.
 * The walk is sequential; no node is emitted twice.
 */
@Slf4j
public class Linearizer {

    public LinearThread linearize(IndexedGraph graph, String currentNodeId) {
        if (currentNodeId != null && graph.node(currentNodeId).isPresent()) {
            List<MessageNode> path = graph.pathToRoot(currentNodeId);
            MessageNode top = path.get(path.size() - 1);
            if (top.id().equals(graph.root().id())) {
                List<MessageNode> ordered = new ArrayList<>(path);
                Collections.reverse(ordered);
                return new LinearThread(ordered, LinearizationPolicy.CURRENT_NODE);
            }
            log.debug("Conversation {}: current node {} is not attached to root {}",
                    graph.conversationId(), currentNodeId, graph.root().id());
        } else {
            log.debug("Conversation {}: current node {} unresolvable, using last-child fallback",
                    graph.conversationId(), currentNodeId);
        }
        return new LinearThread(descendLastChild(graph), LinearizationPolicy.LAST_CHILD_FALLBACK);
    }

    private List<MessageNode> descendLastChild(IndexedGraph graph) {
        List<MessageNode> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        MessageNode node = graph.root();
        while (node != null) {
            if (!visited.add(node.id())) {
                throw new CyclicGraphException(graph.conversationId(), node.id());
            }
            path.add(node);
            List<String> children = graph.children(node.id());
            node = children.isEmpty()
                    ? null
                    : graph.node(children.get(children.size() - 1)).orElse(null);
        }
        return path;
    }
}
