package app.chatarchive.conversation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import app.chatarchive.export.ExportRecord;
import app.chatarchive.graph.InvalidGraphException;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses a whole export. Conversations are independent, so each one is built on the supplied
 * executor; results are collected in input order and then sorted, which keeps the output
 * identical for identical input regardless of scheduling. A conversation that fails is reported
 * as skipped and never aborts the others.
 */
@Slf4j
public class ConversationParser {

    private final ConversationBuilder conversationBuilder;
    private final Executor executor;

    public ConversationParser(ConversationBuilder conversationBuilder, Executor executor) {
        this.conversationBuilder = conversationBuilder;
        this.executor = executor;
    }

    public ParseResult parse(List<ExportRecord> records) {
        log.info("Starting to parse {} conversation records", records.size());

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(records.size());
        for (ExportRecord record : records) {
            futures.add(CompletableFuture.supplyAsync(() -> buildOne(record), executor));
        }

        List<Conversation> conversations = new ArrayList<>();
        List<SkippedConversation> skipped = new ArrayList<>();
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            if (outcome.conversation() != null) {
                conversations.add(outcome.conversation());
            } else {
                skipped.add(outcome.skipped());
            }
        }
        conversations.sort(Conversation.RECENT_FIRST);

        if (!skipped.isEmpty()) {
            log.warn("Skipped {} conversations (first 5): {}", skipped.size(),
                    skipped.subList(0, Math.min(5, skipped.size())));
        }
        log.info("Successfully parsed {} conversations", conversations.size());
        return new ParseResult(conversations, skipped);
    }

    private Outcome buildOne(ExportRecord record) {
        try {
            return new Outcome(conversationBuilder.build(record), null);
        } catch (InvalidGraphException exception) {
            log.warn("Skipping conversation {}: {}", record.id(), exception.getReason());
            return new Outcome(null, new SkippedConversation(record.id(), exception.getReason()));
        } catch (RuntimeException exception) {
            log.warn("Error parsing conversation {}", record.id(), exception);
            return new Outcome(null, new SkippedConversation(record.id(),
                    "unexpected error: " + exception.getClass().getSimpleName() + ": " + exception.getMessage()));
        }
    }

    private record Outcome(Conversation conversation, SkippedConversation skipped) {
    }
}
