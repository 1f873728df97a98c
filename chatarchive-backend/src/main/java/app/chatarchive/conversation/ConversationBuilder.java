package app.chatarchive.conversation;

import java.util.List;

import app.chatarchive.content.ContentNormalizer;
import app.chatarchive.export.ExportRecord;
import app.chatarchive.export.ProjectRef;
import app.chatarchive.graph.ConversationGraph;
import app.chatarchive.graph.GraphParser;
import app.chatarchive.graph.IndexedGraph;
import app.chatarchive.graph.InvalidGraphException;
import app.chatarchive.graph.LinearThread;
import app.chatarchive.graph.Linearizer;
import app.chatarchive.graph.MessageNode;
import app.chatarchive.graph.MessageRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds one {@link Conversation} from one export record: index the graph, pick the thread,
 * normalize its content, then derive title, model and project membership.
 */
@Slf4j
@RequiredArgsConstructor
public class ConversationBuilder {

    private final GraphParser graphParser;
    private final Linearizer linearizer;
    private final ContentNormalizer contentNormalizer;
    private final TitleDeriver titleDeriver;

    /**
     * @throws InvalidGraphException if the record's graph has no single root or contains a cycle
     *                               on the selected thread
     */
    public Conversation build(ExportRecord record) {
        ConversationGraph graph = new ConversationGraph(record.id(), record.mapping(), record.currentNodeId());
        IndexedGraph indexed = graphParser.index(graph);
        LinearThread thread = linearizer.linearize(indexed, graph.currentNodeId());
        List<Message> messages = contentNormalizer.toMessages(thread.nodes());
        if (messages.isEmpty()) {
            log.debug("Conversation {} has no displayable messages", record.id());
        }

        ProjectRef project = record.project();
        return Conversation.builder()
                .id(record.id())
                .title(titleDeriver.deriveTitle(record.title(), messages))
                .createdAt(record.createTime())
                .updatedAt(record.updateTime() != null ? record.updateTime() : record.createTime())
                .projectId(project != null ? project.id() : null)
                .projectName(project != null ? project.name() : null)
                .model(resolveModel(record, thread))
                .systemInstructions(contentNormalizer.systemInstructions(thread.nodes()).orElse(null))
                .linearization(thread.policy())
                .messages(messages)
                .build();
    }

    private String resolveModel(ExportRecord record, LinearThread thread) {
        if (record.model() != null) {
            return record.model();
        }
        List<MessageNode> nodes = thread.nodes();
        for (int index = nodes.size() - 1; index >= 0; index--) {
            MessageNode node = nodes.get(index);
            if (node.role() == MessageRole.ASSISTANT && node.modelSlug() != null) {
                return node.modelSlug();
            }
        }
        return null;
    }
}
