package app.chatarchive.export;

import java.time.Instant;

import app.chatarchive.graph.NodeStore;

/**
 * One decoded conversation entry of an export. Optional fields are {@code null} when absent.
 */
public record ExportRecord(String id,
                           String title,
                           Instant createTime,
                           Instant updateTime,
                           String model,
                           String currentNodeId,
                           NodeStore mapping,
                           ProjectRef project) {

    public ExportRecord {
        mapping = mapping == null ? NodeStore.empty() : mapping;
    }
}
