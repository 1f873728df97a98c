package app.chatarchive.conversation;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import app.chatarchive.graph.LinearizationPolicy;
import app.chatarchive.graph.MessageRole;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Conversation {

    public static final String NO_PREVIEW = "No preview available";

    /**
     * Most recently updated first (missing update times last), then title, then id.
     */
    public static final Comparator<Conversation> RECENT_FIRST = Comparator
            .comparing(Conversation::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Conversation::getTitle, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Conversation::getId);

    @NonNull
    String id;

    String title;

    Instant createdAt;

    Instant updatedAt;

    String projectId;

    String projectName;

    String model;

    String systemInstructions;

    LinearizationPolicy linearization;

    @NonNull
    List<Message> messages;

    public boolean hasProject() {
        return projectId != null;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public long wordCount() {
        return messages.stream()
                .map(Message::displayText)
                .mapToLong(text -> text.isBlank() ? 0 : text.strip().split("\\s+").length)
                .sum();
    }

    public String preview(int maxLength) {
        return messages.stream()
                .filter(message -> message.role() == MessageRole.USER)
                .map(message -> message.displayText().strip())
                .filter(text -> !text.isEmpty())
                .findFirst()
                .map(text -> text.length() > maxLength ? text.substring(0, maxLength) + "..." : text)
                .orElse(NO_PREVIEW);
    }
}
