package app.chatarchive.archive.dto;

import java.util.List;

import app.chatarchive.archive.ArchiveStats;
import app.chatarchive.conversation.SkippedConversation;

public record LoadResultDto(
        String message,
        ArchiveStats stats,
        List<SkippedConversation> skipped
) {}
