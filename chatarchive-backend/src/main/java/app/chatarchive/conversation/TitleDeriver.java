package app.chatarchive.conversation;

import java.util.List;

import org.springframework.util.StringUtils;

import app.chatarchive.graph.MessageRole;

/**
 * Picks a conversation title: the export's own title when present, otherwise the first line of
 * the first user message, cut to a fixed length with an ellipsis marker.
 */
public class TitleDeriver {

    public static final String UNTITLED = "Untitled Conversation";
    static final String ELLIPSIS = "...";

    private final int maxLength;

    public TitleDeriver(int maxLength) {
        if (maxLength <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("maxLength must exceed " + ELLIPSIS.length());
        }
        this.maxLength = maxLength;
    }

    public String deriveTitle(String exportTitle, List<Message> messages) {
        if (StringUtils.hasText(exportTitle)) {
            return exportTitle.trim();
        }
        return messages.stream()
                .filter(message -> message.role() == MessageRole.USER)
                .map(message -> sanitize(message.displayText()))
                .filter(StringUtils::hasText)
                .findFirst()
                .orElse(UNTITLED);
    }

    private String sanitize(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String firstLine = raw.trim().split("\\R", 2)[0].trim();
        if (firstLine.length() <= maxLength) {
            return firstLine;
        }
        return firstLine.substring(0, maxLength - ELLIPSIS.length()).stripTrailing() + ELLIPSIS;
    }
}
