package app.chatarchive.export;

import java.util.List;

import app.chatarchive.conversation.SkippedConversation;

/**
 * Decoder output: the usable conversation records plus entries rejected before graph parsing.
 */
public record DecodedExport(List<ExportRecord> records, List<SkippedConversation> rejected) {

    public DecodedExport {
        records = List.copyOf(records);
        rejected = List.copyOf(rejected);
    }

    public boolean isEmpty() {
        return records.isEmpty() && rejected.isEmpty();
    }
}
