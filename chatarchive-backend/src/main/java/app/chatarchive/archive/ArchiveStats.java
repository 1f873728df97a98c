package app.chatarchive.archive;

import java.util.Map;

public record ArchiveStats(int totalConversations,
                           long totalMessages,
                           int totalProjects,
                           int skippedCount,
                           int unassignedConversations,
                           long totalWords,
                           Map<String, Long> modelsUsed) {
}
