package app.chatarchive.archive;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import com.fasterxml.jackson.databind.JsonNode;

import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.ConversationParser;
import app.chatarchive.conversation.ParseResult;
import app.chatarchive.conversation.ProjectGrouper;
import app.chatarchive.export.DecodedExport;
import app.chatarchive.export.ExportRecordDecoder;
import app.chatarchive.markdown.MarkdownBundleWriter;
import app.chatarchive.markdown.MarkdownRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the currently loaded export for the server. Parsing stays in the stateless core; this
 * class only swaps complete {@link ArchiveSnapshot}s, so readers never see a half-built export.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ArchiveSession {

    private final ExportRecordDecoder exportRecordDecoder;
    private final ConversationParser conversationParser;
    private final ProjectGrouper projectGrouper;
    private final MarkdownRenderer markdownRenderer;
    private final MarkdownBundleWriter markdownBundleWriter;

    private final AtomicReference<ArchiveSnapshot> current = new AtomicReference<>();

    public ArchiveSnapshot load(JsonNode payload) {
        DecodedExport decoded = exportRecordDecoder.decode(payload);
        if (decoded.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No conversations found in the file.");
        }
        ParseResult result = conversationParser.parse(decoded.records()).withSkipped(decoded.rejected());
        ArchiveSnapshot snapshot = ArchiveSnapshot.of(result, projectGrouper);
        current.set(snapshot);
        log.info("Loaded export: {} conversations, {} projects, {} skipped",
                snapshot.conversations().size(), snapshot.stats().totalProjects(), snapshot.skipped().size());
        return snapshot;
    }

    public void clear() {
        if (current.getAndSet(null) != null) {
            log.info("Cleared loaded export");
        }
    }

    public Optional<ArchiveSnapshot> snapshot() {
        return Optional.ofNullable(current.get());
    }

    public ArchiveStats stats() {
        return requireSnapshot().stats();
    }

    public List<Conversation> conversations() {
        return requireSnapshot().conversations();
    }

    public Conversation conversation(String conversationId) {
        return requireSnapshot().find(conversationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));
    }

    public List<Conversation> search(String query) {
        return requireSnapshot().search(query);
    }

    public Map<String, List<Conversation>> groupByProject() {
        return requireSnapshot().groupedByProject();
    }

    public String renderMarkdown(String conversationId) {
        return markdownRenderer.render(conversation(conversationId));
    }

    public byte[] exportBundle() {
        return markdownBundleWriter.toZip(requireSnapshot().groupedByProject());
    }

    private ArchiveSnapshot requireSnapshot() {
        ArchiveSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No data loaded");
        }
        return snapshot;
    }
}
