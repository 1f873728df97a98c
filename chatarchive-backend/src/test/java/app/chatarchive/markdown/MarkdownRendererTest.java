package app.chatarchive.markdown;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import app.chatarchive.content.TimestampFormatter;
import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.Message;
import app.chatarchive.graph.MessageRole;

class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer(new TimestampFormatter(ZoneOffset.UTC));

    @Test
    void rendersCanonicalLayout() {
        Conversation conversation = Conversation.builder()
                .id("c1")
                .title("Trip planning")
                .projectId("p1")
                .projectName("Travel")
                .model("gpt-4o")
                .createdAt(Instant.parse("2024-01-05T15:04:00Z"))
                .updatedAt(Instant.parse("2024-01-06T09:30:00Z"))
                .messages(List.of(
                        new Message("u", MessageRole.USER, "Where should I go?", Instant.parse("2024-01-05T15:04:00Z"), 0),
                        new Message("a", MessageRole.ASSISTANT, "Try Lisbon.", Instant.parse("2024-01-05T15:05:00Z"), 1)))
                .build();

        String expected = "# Trip planning\n\n"
                + "**Project:** Travel\n"
                + "**Created:** January 05, 2024\n"
                + "**Last Updated:** January 06, 2024\n"
                + "**Model:** gpt-4o\n"
                + "\n---\n"
                + "\n### 👤 User – Jan 05, 2024 03:04 PM\n\nWhere should I go?\n"
                + "\n### 🤖 Assistant – Jan 05, 2024 03:05 PM\n\nTry Lisbon.\n";

        assertThat(renderer.render(conversation)).isEqualTo(expected);
        assertThat(renderer.render(conversation)).isEqualTo(renderer.render(conversation));
    }

    @Test
    void fallsBackForMissingMetadata() {
        Conversation conversation = Conversation.builder()
                .id("c2")
                .title("Untitled Conversation")
                .messages(List.of(new Message("u", MessageRole.USER, "hi", null, 0)))
                .build();

        String markdown = renderer.render(conversation);

        assertThat(markdown)
                .contains("**Project:** None\n")
                .contains("**Created:** time unknown\n")
                .contains("**Model:** unknown\n")
                .contains("### 👤 User – time unknown\n\nhi\n");
    }

    @Test
    void projectIdStandsInForMissingName() {
        Conversation conversation = Conversation.builder()
                .id("c3")
                .title("T")
                .projectId("g-p-123")
                .messages(List.of())
                .build();

        assertThat(renderer.render(conversation)).contains("**Project:** g-p-123\n");
    }

    @Test
    void conversationWithoutMessagesEndsAfterRule() {
        Conversation conversation = Conversation.builder()
                .id("c4")
                .title("Empty")
                .messages(List.of())
                .build();

        assertThat(renderer.render(conversation)).endsWith("**Model:** unknown\n\n---\n");
    }
}
