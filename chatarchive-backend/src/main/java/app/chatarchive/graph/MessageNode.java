package app.chatarchive.graph;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One node of a conversation's raw message graph, as decoded from the export mapping.
 * <p>
 * {@code parentId} is authoritative; {@code childrenIds} is only a hint that {@link GraphParser}
 * checks against the parent links. A node decoded from an entry without a message is a
 * structural placeholder: {@link MessageRole#SYSTEM}, hidden, no content parts.
 */
public record MessageNode(String id,
                          String parentId,
                          List<String> childrenIds,
                          MessageRole role,
                          List<String> contentParts,
                          Instant createTime,
                          boolean hidden,
                          String modelSlug) {

    public MessageNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        childrenIds = childrenIds == null ? List.of() : List.copyOf(childrenIds);
        contentParts = contentParts == null ? List.of() : List.copyOf(contentParts);
    }

    public static MessageNode placeholder(String id, String parentId, List<String> childrenIds) {
        return new MessageNode(id, parentId, childrenIds, MessageRole.SYSTEM, List.of(), null, true, null);
    }

    public boolean hasParent() {
        return parentId != null;
    }
}
