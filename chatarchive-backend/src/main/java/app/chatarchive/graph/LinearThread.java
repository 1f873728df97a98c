package app.chatarchive.graph;

import java.util.List;

/**
 * Root-to-leaf node sequence selected by the {@link Linearizer}, structural nodes included.
 */
public record LinearThread(List<MessageNode> nodes, LinearizationPolicy policy) {

    public LinearThread {
        nodes = List.copyOf(nodes);
    }
}
