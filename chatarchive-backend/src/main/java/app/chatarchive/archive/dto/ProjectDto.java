package app.chatarchive.archive.dto;

import java.util.List;

public record ProjectDto(
        String name,
        List<ConversationSummaryDto> conversations
) {}
