package app.chatarchive.archive.dto;

import java.time.Instant;

import app.chatarchive.graph.MessageRole;

public record MessageDto(
        String nodeId,
        MessageRole role,
        String content,
        Instant timestamp,
        int sequenceIndex
) {}
