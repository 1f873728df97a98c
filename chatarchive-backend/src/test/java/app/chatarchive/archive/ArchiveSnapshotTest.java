package app.chatarchive.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.Message;
import app.chatarchive.conversation.ParseResult;
import app.chatarchive.conversation.ProjectGrouper;
import app.chatarchive.conversation.SkippedConversation;
import app.chatarchive.graph.MessageRole;

class ArchiveSnapshotTest {

    @Test
    void computesStatsAcrossConversations() {
        ParseResult result = new ParseResult(
                List.of(
                        conversation("c1", "p1", "gpt-4o", "2024-01-01T00:00:00Z", "one two three"),
                        conversation("c2", null, "gpt-4o", "2024-01-03T00:00:00Z", "four"),
                        conversation("c3", "p2", null, "2024-01-02T00:00:00Z", "five six")),
                List.of(new SkippedConversation("bad", "no root node found")));

        ArchiveSnapshot snapshot = ArchiveSnapshot.of(result, new ProjectGrouper());
        ArchiveStats stats = snapshot.stats();

        assertThat(snapshot.conversations()).extracting(Conversation::getId).containsExactly("c2", "c3", "c1");
        assertThat(stats.totalConversations()).isEqualTo(3);
        assertThat(stats.totalMessages()).isEqualTo(3);
        assertThat(stats.totalProjects()).isEqualTo(2);
        assertThat(stats.skippedCount()).isEqualTo(1);
        assertThat(stats.unassignedConversations()).isEqualTo(1);
        assertThat(stats.totalWords()).isEqualTo(6);
        assertThat(stats.modelsUsed()).containsExactly(entry("gpt-4o", 2L));
    }

    @Test
    void searchKeepsRecencyOrder() {
        ParseResult result = new ParseResult(
                List.of(
                        conversation("old", null, null, "2024-01-01T00:00:00Z", "kotlin coroutines"),
                        conversation("new", null, null, "2024-02-01T00:00:00Z", "Kotlin flows")),
                List.of());

        ArchiveSnapshot snapshot = ArchiveSnapshot.of(result, new ProjectGrouper());

        assertThat(snapshot.search("kotlin")).extracting(Conversation::getId).containsExactly("new", "old");
        assertThat(snapshot.find("old")).isPresent();
        assertThat(snapshot.find("missing")).isEmpty();
    }

    @Test
    void searchBreaksUpdateTiesByTitle() {
        ParseResult result = new ParseResult(
                List.of(
                        titled("c1", "Zebra facts", "2024-03-01T00:00:00Z", "notes on kotlin"),
                        titled("c2", "Alpha notes", "2024-03-01T00:00:00Z", "more kotlin"),
                        titled("c3", "Middle", "2024-03-02T00:00:00Z", "kotlin again")),
                List.of());

        ArchiveSnapshot snapshot = ArchiveSnapshot.of(result, new ProjectGrouper());

        assertThat(snapshot.search("kotlin")).extracting(Conversation::getTitle)
                .containsExactly("Middle", "Alpha notes", "Zebra facts");
    }

    private static Conversation titled(String id, String title, String updated, String text) {
        return Conversation.builder()
                .id(id)
                .title(title)
                .updatedAt(Instant.parse(updated))
                .messages(List.of(new Message(id + "-u", MessageRole.USER, text, null, 0)))
                .build();
    }

    private static Conversation conversation(String id, String projectId, String model, String updated, String text) {
        return Conversation.builder()
                .id(id)
                .title(id)
                .projectId(projectId)
                .model(model)
                .updatedAt(Instant.parse(updated))
                .messages(List.of(new Message(id + "-u", MessageRole.USER, text, null, 0)))
                .build();
    }
}
