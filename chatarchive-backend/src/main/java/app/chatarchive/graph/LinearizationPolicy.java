package app.chatarchive.graph;

/**
 * How a conversation's single thread was selected from its branching graph.
 */
public enum LinearizationPolicy {

    /**
     * The path from the export's current node back to the root. Exactly the branch the source
     * application displayed at export time.
     */
    CURRENT_NODE,

    /**
     * Best effort used when the current node is absent or does not resolve to a node attached
     * to the root: descend from the root taking the last child at every fork. Exports append
     * regenerations and edits to the children list, so the last child approximates the most
     * recent branch. This is a guess at intent, not a guarantee.
     */
    LAST_CHILD_FALLBACK
}
