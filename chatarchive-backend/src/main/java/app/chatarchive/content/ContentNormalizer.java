package app.chatarchive.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.util.StringUtils;

import app.chatarchive.conversation.Message;
import app.chatarchive.graph.MessageNode;
import app.chatarchive.graph.MessageRole;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns thread nodes into display messages.
 * <p>
 * Only visible user and assistant nodes with text reach the rendered thread. Tool output,
 * hidden scaffolding and system nodes stay in the graph but are left out here; non-empty
 * system text is still available through {@link #systemInstructions(List)}.
 */
@Slf4j
public class ContentNormalizer {

    private static final String PART_SEPARATOR = "\n";
    private static final String INSTRUCTION_SEPARATOR = "\n\n";

    /**
     * Joins the non-blank content parts with a single newline and strips surrounding whitespace.
     */
    public String displayText(MessageNode node) {
        return node.contentParts().stream()
                .filter(StringUtils::hasText)
                .collect(Collectors.joining(PART_SEPARATOR))
                .strip();
    }

    public boolean isFilterable(MessageNode node) {
        return displayText(node).isEmpty();
    }

    public boolean isConversational(MessageNode node) {
        if (node.hidden()) {
            return false;
        }
        return node.role() == MessageRole.USER || node.role() == MessageRole.ASSISTANT;
    }

    public List<Message> toMessages(List<MessageNode> thread) {
        List<Message> messages = new ArrayList<>();
        for (MessageNode node : thread) {
            if (!isConversational(node)) {
                continue;
            }
            String text = displayText(node);
            if (text.isEmpty()) {
                log.trace("Dropping empty {} node {}", node.role().value(), node.id());
                continue;
            }
            messages.add(new Message(node.id(), node.role(), text, node.createTime(), messages.size()));
        }
        return List.copyOf(messages);
    }

    public Optional<String> systemInstructions(List<MessageNode> thread) {
        String joined = thread.stream()
                .filter(node -> node.role() == MessageRole.SYSTEM)
                .map(this::displayText)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(INSTRUCTION_SEPARATOR));
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }
}
