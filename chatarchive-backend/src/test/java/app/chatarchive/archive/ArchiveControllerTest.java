package app.chatarchive.archive;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.server.ResponseStatusException;

import app.chatarchive.config.ArchiveProperties;
import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.Message;
import app.chatarchive.conversation.ProjectGrouper;
import app.chatarchive.conversation.SkippedConversation;
import app.chatarchive.export.ExportFormatException;
import app.chatarchive.graph.LinearizationPolicy;
import app.chatarchive.graph.MessageRole;
import app.chatarchive.search.SearchIndex;

@WebFluxTest(ArchiveController.class)
@AutoConfigureWebTestClient
@Import(ArchiveControllerTest.PropertiesConfig.class)
class ArchiveControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(ArchiveProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private ArchiveSession archiveSession;

    private final Conversation conversation = Conversation.builder()
            .id("c1")
            .title("Sample")
            .projectId("p1")
            .projectName("Research")
            .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
            .updatedAt(Instant.parse("2024-01-02T00:00:00Z"))
            .linearization(LinearizationPolicy.CURRENT_NODE)
            .messages(List.of(
                    new Message("u", MessageRole.USER, "Hello there", Instant.parse("2024-01-01T00:00:00Z"), 0),
                    new Message("a", MessageRole.ASSISTANT, "Hi!", null, 1)))
            .build();

    @Test
    void shouldLoadExport() {
        ArchiveSnapshot snapshot = new ArchiveSnapshot(
                List.of(conversation),
                List.of(new SkippedConversation("broken", "no root node found")),
                List.of(),
                Map.of(),
                SearchIndex.empty());
        Mockito.when(archiveSession.load(any())).thenReturn(snapshot);

        webTestClient.post()
                .uri("/api/archive")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[{\"id\": \"c1\"}]")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Successfully loaded 1 conversations")
                .jsonPath("$.stats.totalMessages").isEqualTo(2)
                .jsonPath("$.skipped[0].conversationId").isEqualTo("broken");
    }

    @Test
    void shouldRejectMalformedExport() {
        Mockito.when(archiveSession.load(any()))
                .thenThrow(new ExportFormatException("Invalid data format. Expected a list of conversations."));

        webTestClient.post()
                .uri("/api/archive")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\": \"x\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid data format. Expected a list of conversations.");
    }

    @Test
    void shouldListConversationSummaries() {
        Mockito.when(archiveSession.conversations()).thenReturn(List.of(conversation));

        webTestClient.get()
                .uri("/api/archive/conversations")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("c1")
                .jsonPath("$[0].projectName").isEqualTo("Research")
                .jsonPath("$[0].messageCount").isEqualTo(2)
                .jsonPath("$[0].preview").isEqualTo("Hello there");
    }

    @Test
    void shouldReturnConversationDetailWithMarkdown() {
        Mockito.when(archiveSession.conversation("c1")).thenReturn(conversation);
        Mockito.when(archiveSession.renderMarkdown("c1")).thenReturn("# Sample\n");

        webTestClient.get()
                .uri("/api/archive/conversations/c1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.title").isEqualTo("Sample")
                .jsonPath("$.linearization").isEqualTo("CURRENT_NODE")
                .jsonPath("$.messages.length()").isEqualTo(2)
                .jsonPath("$.messages[1].content").isEqualTo("Hi!")
                .jsonPath("$.markdown").isEqualTo("# Sample\n");
    }

    @Test
    void shouldReturnNotFoundForUnknownConversation() {
        Mockito.when(archiveSession.conversation("missing"))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));

        webTestClient.get()
                .uri("/api/archive/conversations/missing")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void shouldServeMarkdown() {
        Mockito.when(archiveSession.renderMarkdown("c1")).thenReturn("# Sample\n");

        webTestClient.get()
                .uri("/api/archive/conversations/c1/markdown")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.parseMediaType("text/markdown"))
                .expectBody(String.class).isEqualTo("# Sample\n");
    }

    @Test
    void shouldSearchConversations() {
        Mockito.when(archiveSession.search("hello")).thenReturn(List.of(conversation));

        webTestClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/archive/search").queryParam("q", "hello").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].id").isEqualTo("c1");
    }

    @Test
    void shouldListProjectsInGroupingOrder() {
        Map<String, List<Conversation>> grouped = new LinkedHashMap<>();
        grouped.put("Research", List.of(conversation));
        grouped.put(ProjectGrouper.UNASSIGNED, List.of());
        Mockito.when(archiveSession.groupByProject()).thenReturn(grouped);

        webTestClient.get()
                .uri("/api/archive/projects")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].name").isEqualTo("Research")
                .jsonPath("$[0].conversations[0].id").isEqualTo("c1")
                .jsonPath("$[1].name").isEqualTo(ProjectGrouper.UNASSIGNED);
    }

    @Test
    void shouldExportZipBundle() {
        Mockito.when(archiveSession.exportBundle()).thenReturn(new byte[] {0x50, 0x4b, 0x05, 0x06});

        webTestClient.get()
                .uri("/api/archive/export")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType("application/zip")
                .expectHeader().valueEquals(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"chat_export_markdown.zip\"")
                .expectBody(byte[].class).isEqualTo(new byte[] {0x50, 0x4b, 0x05, 0x06});
    }

    @Test
    void shouldClearLoadedExport() {
        webTestClient.delete()
                .uri("/api/archive")
                .exchange()
                .expectStatus().isNoContent();

        verify(archiveSession).clear();
    }
}
