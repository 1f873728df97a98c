package app.chatarchive.archive.dto;

import java.time.Instant;
import java.util.List;

import app.chatarchive.graph.LinearizationPolicy;

public record ConversationDetailDto(
        String id,
        String title,
        String projectId,
        String projectName,
        String model,
        Instant createdAt,
        Instant updatedAt,
        String systemInstructions,
        LinearizationPolicy linearization,
        List<MessageDto> messages,
        String markdown
) {}
