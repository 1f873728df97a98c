package app.chatarchive.markdown;

import app.chatarchive.content.TimestampFormatter;
import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.Message;
import app.chatarchive.graph.MessageRole;
import lombok.RequiredArgsConstructor;

/**
 * Renders a conversation as the canonical markdown transcript. Downstream tools depend on this
 * layout byte for byte:
 *
 * <pre>
 * # {title}
 *
 * **Project:** {project name or None}
 * **Created:** {date}
 * **Last Updated:** {date}
 * **Model:** {model or unknown}
 *
 * ---
 *
 * ### {icon} {label} – {timestamp}
 *
 * {text}
 * </pre>
 *
 * Messages appear in thread order. The output depends only on the conversation and the
 * configured time zone.
 */
@RequiredArgsConstructor
public class MarkdownRenderer {

    static final String NO_PROJECT = "None";
    static final String UNKNOWN_MODEL = "unknown";

    private final TimestampFormatter timestampFormatter;

    public String render(Conversation conversation) {
        StringBuilder markdown = new StringBuilder();
        markdown.append("# ").append(conversation.getTitle()).append("\n\n");
        markdown.append("**Project:** ").append(projectLabel(conversation)).append('\n');
        markdown.append("**Created:** ").append(timestampFormatter.formatDate(conversation.getCreatedAt())).append('\n');
        markdown.append("**Last Updated:** ").append(timestampFormatter.formatDate(conversation.getUpdatedAt())).append('\n');
        markdown.append("**Model:** ")
                .append(conversation.getModel() != null ? conversation.getModel() : UNKNOWN_MODEL)
                .append('\n');
        markdown.append("\n---\n");

        for (Message message : conversation.getMessages()) {
            markdown.append("\n### ")
                    .append(icon(message.role())).append(' ')
                    .append(label(message.role()))
                    .append(" – ")
                    .append(timestampFormatter.formatMessageTime(message.timestamp()))
                    .append("\n\n")
                    .append(message.displayText())
                    .append('\n');
        }
        return markdown.toString();
    }

    private String projectLabel(Conversation conversation) {
        if (conversation.getProjectName() != null) {
            return conversation.getProjectName();
        }
        return conversation.getProjectId() != null ? conversation.getProjectId() : NO_PROJECT;
    }

    static String icon(MessageRole role) {
        return switch (role) {
            case USER -> "👤";
            case ASSISTANT -> "🤖";
            case SYSTEM -> "⚙️";
            case TOOL -> "🔧";
        };
    }

    static String label(MessageRole role) {
        return switch (role) {
            case USER -> "User";
            case ASSISTANT -> "Assistant";
            case SYSTEM -> "System";
            case TOOL -> "Tool";
        };
    }
}
