package app.chatarchive.archive.dto;

import java.time.Instant;

public record ConversationSummaryDto(
        String id,
        String title,
        String projectName,
        Instant createdAt,
        Instant updatedAt,
        int messageCount,
        String preview
) {}
