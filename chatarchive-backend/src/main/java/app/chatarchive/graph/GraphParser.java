package app.chatarchive.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates a conversation's node table and indexes its parent/child relationships.
 * <p>
 * {@code parentId} is trusted over {@code childrenIds}: the children of a node are the nodes that
 * name it as parent, kept in the node's declared order where the two agree, followed by any
 * undeclared children in store order. Disagreements are repaired and logged, never fatal.
 * A node whose parent does not exist in the table counts as an additional root.
 */
@Slf4j
public class GraphParser {

    public IndexedGraph index(ConversationGraph graph) {
        String conversationId = graph.conversationId();
        NodeStore store = graph.nodes();

        List<String> roots = new ArrayList<>();
        Map<String, Set<String>> claimedChildren = new LinkedHashMap<>();
        for (MessageNode node : store.nodes()) {
            if (!node.hasParent()) {
                roots.add(node.id());
            } else if (!store.contains(node.parentId())) {
                log.warn("Conversation {}: node {} references missing parent {}",
                        conversationId, node.id(), node.parentId());
                roots.add(node.id());
            } else {
                claimedChildren.computeIfAbsent(node.parentId(), key -> new LinkedHashSet<>()).add(node.id());
            }
        }

        if (roots.isEmpty()) {
            throw new MalformedGraphException(conversationId, "no root node found");
        }
        if (roots.size() > 1) {
            throw new MalformedGraphException(conversationId,
                    roots.size() + " root nodes found " + roots);
        }

        Map<String, List<String>> children = new HashMap<>();
        int repairs = 0;
        for (MessageNode node : store.nodes()) {
            Set<String> claimants = claimedChildren.getOrDefault(node.id(), Set.of());
            Set<String> ordered = new LinkedHashSet<>();
            for (String childId : node.childrenIds()) {
                if (claimants.contains(childId)) {
                    ordered.add(childId);
                } else {
                    log.debug("Conversation {}: dropping child link {} -> {} not confirmed by parent id",
                            conversationId, node.id(), childId);
                    repairs++;
                }
            }
            for (String claimant : claimants) {
                if (ordered.add(claimant)) {
                    log.debug("Conversation {}: restoring child link {} -> {} from parent id",
                            conversationId, node.id(), claimant);
                    repairs++;
                }
            }
            if (!ordered.isEmpty()) {
                children.put(node.id(), List.copyOf(ordered));
            }
        }
        if (repairs > 0) {
            log.warn("Conversation {}: repaired {} inconsistent parent/child links", conversationId, repairs);
        }

        return new IndexedGraph(conversationId, store, roots.get(0), children);
    }
}
