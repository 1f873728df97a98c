package app.chatarchive.graph;

import static app.chatarchive.graph.TestNodes.graph;
import static app.chatarchive.graph.TestNodes.node;
import static app.chatarchive.graph.TestNodes.root;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GraphParserTest {

    private GraphParser parser;

    @BeforeEach
    void setUp() {
        parser = new GraphParser();
    }

    @Test
    void indexesSingleRootAndChildren() {
        IndexedGraph indexed = parser.index(graph("b",
                root("r", "a"),
                node("a", "r", MessageRole.USER, "Hi", "b"),
                node("b", "a", MessageRole.ASSISTANT, "Hello")));

        assertThat(indexed.root().id()).isEqualTo("r");
        assertThat(indexed.children("r")).containsExactly("a");
        assertThat(indexed.children("a")).containsExactly("b");
        assertThat(indexed.children("b")).isEmpty();
        assertThat(indexed.leaves()).extracting(MessageNode::id).containsExactly("b");
    }

    @Test
    void rejectsGraphWithoutRoot() {
        ConversationGraph graph = graph(null,
                node("a", "b", MessageRole.USER, "Hi"),
                node("b", "a", MessageRole.ASSISTANT, "Hello"));

        assertThatThrownBy(() -> parser.index(graph))
                .isInstanceOf(MalformedGraphException.class)
                .hasMessageContaining("no root node found");
    }

    @Test
    void rejectsGraphWithSeveralRoots() {
        ConversationGraph graph = graph(null,
                root("r1"),
                root("r2"));

        assertThatThrownBy(() -> parser.index(graph))
                .isInstanceOf(MalformedGraphException.class)
                .satisfies(error -> assertThat(((MalformedGraphException) error).getReason())
                        .startsWith("2 root nodes found"));
    }

    @Test
    void rejectsEmptyGraph() {
        ConversationGraph graph = new ConversationGraph("empty", NodeStore.empty(), null);

        assertThatThrownBy(() -> parser.index(graph)).isInstanceOf(MalformedGraphException.class);
    }

    @Test
    void countsNodeWithMissingParentAsRoot() {
        ConversationGraph graph = graph(null,
                root("r", "a"),
                node("a", "r", MessageRole.USER, "Hi"),
                node("orphan", "gone", MessageRole.ASSISTANT, "Lost"));

        assertThatThrownBy(() -> parser.index(graph))
                .isInstanceOf(MalformedGraphException.class)
                .hasMessageContaining("[r, orphan]");
    }

    @Test
    void trustsParentIdsOverChildrenLists() {
        IndexedGraph indexed = parser.index(graph(null,
                root("r", "a", "ghost"),
                node("a", "r", MessageRole.USER, "Hi"),
                node("b", "a", MessageRole.ASSISTANT, "Unlisted"),
                node("c", "r", MessageRole.USER, "Also unlisted")));

        assertThat(indexed.children("r")).containsExactly("a", "c");
        assertThat(indexed.children("a")).containsExactly("b");
    }

    @Test
    void keepsDeclaredChildOrderWhenConsistent() {
        IndexedGraph indexed = parser.index(graph(null,
                root("r", "a"),
                node("a", "r", MessageRole.USER, "Hi", "y", "x"),
                node("x", "a", MessageRole.ASSISTANT, "first"),
                node("y", "a", MessageRole.ASSISTANT, "second")));

        assertThat(indexed.children("a")).containsExactly("y", "x");
    }

    @Test
    void pathToRootRunsFromLeafToRoot() {
        IndexedGraph indexed = parser.index(graph(null,
                root("r", "a"),
                node("a", "r", MessageRole.USER, "Hi", "b"),
                node("b", "a", MessageRole.ASSISTANT, "Hello")));

        List<MessageNode> path = indexed.pathToRoot("b");

        assertThat(path).extracting(MessageNode::id).containsExactly("b", "a", "r");
    }

    @Test
    void pathToRootDetectsCycle() {
        IndexedGraph indexed = parser.index(graph(null,
                root("r"),
                node("loop", "loop", MessageRole.USER, "Me again")));

        assertThatThrownBy(() -> indexed.pathToRoot("loop"))
                .isInstanceOf(CyclicGraphException.class)
                .hasMessageContaining("loop");
    }

    @Test
    void pathToRootRejectsUnknownNode() {
        IndexedGraph indexed = parser.index(graph(null, root("r")));

        assertThatThrownBy(() -> indexed.pathToRoot("missing")).isInstanceOf(IllegalArgumentException.class);
    }
}
