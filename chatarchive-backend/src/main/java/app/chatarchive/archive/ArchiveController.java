package app.chatarchive.archive;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;

import app.chatarchive.archive.dto.ConversationDetailDto;
import app.chatarchive.archive.dto.ConversationSummaryDto;
import app.chatarchive.archive.dto.LoadResultDto;
import app.chatarchive.archive.dto.MessageDto;
import app.chatarchive.archive.dto.ProjectDto;
import app.chatarchive.config.ArchiveProperties;
import app.chatarchive.conversation.Conversation;
import app.chatarchive.export.ExportFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping(path = "/api/archive", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
public class ArchiveController {

    static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");
    static final String BUNDLE_FILE_NAME = "chat_export_markdown.zip";

    private final ArchiveSession archiveSession;
    private final ArchiveProperties properties;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public LoadResultDto load(@RequestBody JsonNode payload) {
        log.debug("Loading export payload");
        ArchiveSnapshot snapshot = archiveSession.load(payload);
        ArchiveStats stats = snapshot.stats();
        return new LoadResultDto(
                "Successfully loaded " + stats.totalConversations() + " conversations",
                stats,
                snapshot.skipped()
        );
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear() {
        archiveSession.clear();
    }

    @GetMapping("/stats")
    public ArchiveStats stats() {
        return archiveSession.stats();
    }

    @GetMapping("/conversations")
    public List<ConversationSummaryDto> listConversations() {
        return archiveSession.conversations().stream()
                .map(this::toSummaryDto)
                .toList();
    }

    @GetMapping("/conversations/{id}")
    public ConversationDetailDto getConversation(@PathVariable("id") String conversationId) {
        Conversation conversation = archiveSession.conversation(conversationId);
        return new ConversationDetailDto(
                conversation.getId(),
                conversation.getTitle(),
                conversation.getProjectId(),
                conversation.getProjectName(),
                conversation.getModel(),
                conversation.getCreatedAt(),
                conversation.getUpdatedAt(),
                conversation.getSystemInstructions(),
                conversation.getLinearization(),
                conversation.getMessages().stream()
                        .map(message -> new MessageDto(
                                message.nodeId(),
                                message.role(),
                                message.displayText(),
                                message.timestamp(),
                                message.sequenceIndex()))
                        .toList(),
                archiveSession.renderMarkdown(conversationId)
        );
    }

    @GetMapping(path = "/conversations/{id}/markdown", produces = "text/markdown;charset=UTF-8")
    public ResponseEntity<String> getMarkdown(@PathVariable("id") String conversationId) {
        return ResponseEntity.ok()
                .contentType(TEXT_MARKDOWN)
                .body(archiveSession.renderMarkdown(conversationId));
    }

    @GetMapping("/search")
    public List<ConversationSummaryDto> search(@RequestParam(name = "q", defaultValue = "") String query) {
        log.debug("Searching conversations for '{}'", query);
        return archiveSession.search(query).stream()
                .map(this::toSummaryDto)
                .toList();
    }

    @GetMapping("/projects")
    public List<ProjectDto> listProjects() {
        return archiveSession.groupByProject().entrySet().stream()
                .map(entry -> new ProjectDto(
                        entry.getKey(),
                        entry.getValue().stream().map(this::toSummaryDto).toList()))
                .toList();
    }

    @GetMapping(path = "/export", produces = "application/zip")
    public ResponseEntity<byte[]> exportAll() {
        byte[] bundle = archiveSession.exportBundle();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/zip"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + BUNDLE_FILE_NAME + "\"")
                .body(bundle);
    }

    @ExceptionHandler(ExportFormatException.class)
    public ResponseEntity<Map<String, String>> handleExportFormat(ExportFormatException exception) {
        log.warn("Rejected export payload: {}", exception.getMessage());
        return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", exception.getMessage()));
    }

    private ConversationSummaryDto toSummaryDto(Conversation conversation) {
        return new ConversationSummaryDto(
                conversation.getId(),
                conversation.getTitle(),
                conversation.getProjectName(),
                conversation.getCreatedAt(),
                conversation.getUpdatedAt(),
                conversation.getMessages().size(),
                conversation.preview(properties.previewLength())
        );
    }
}
