package app.chatarchive.export;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.chatarchive.conversation.SkippedConversation;
import app.chatarchive.graph.MessageNode;
import app.chatarchive.graph.MessageRole;
import app.chatarchive.graph.NodeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes the loosely typed export JSON into {@link ExportRecord}s. Every optional field is
 * resolved here once, so the graph code never inspects raw JSON.
 */
@Slf4j
@RequiredArgsConstructor
public class ExportRecordDecoder {

    static final String SYNTHETIC_ROOT_ID = "synthetic-root";
    private static final String ALL_RECIPIENTS = "all";
    private static final String USER_EDITABLE_CONTEXT = "user_editable_context";

    private final ObjectMapper objectMapper;

    public DecodedExport decode(String json) {
        if (!StringUtils.hasText(json)) {
            throw new ExportFormatException("Export payload is empty");
        }
        try {
            return decode(objectMapper.readTree(json));
        } catch (JsonProcessingException exception) {
            throw new ExportFormatException("Export payload is not valid JSON", exception);
        }
    }

    public DecodedExport decode(JsonNode root) {
        JsonNode entries = locateConversationList(root);
        List<ExportRecord> records = new ArrayList<>();
        List<SkippedConversation> rejected = new ArrayList<>();

        // generated ids must never shadow an id the export declares itself
        Set<String> declaredIds = new HashSet<>();
        for (JsonNode entry : entries) {
            String declared = entry != null && entry.isObject() ? declaredId(entry) : null;
            if (declared != null) {
                declaredIds.add(declared);
            }
        }

        Set<String> usedIds = new HashSet<>();
        for (int index = 0; index < entries.size(); index++) {
            JsonNode entry = entries.get(index);
            if (entry == null || !entry.isObject()) {
                String type = entry == null ? "null" : entry.getNodeType().name().toLowerCase(Locale.ROOT);
                rejected.add(new SkippedConversation("entry-" + index, "entry is not an object (" + type + ")"));
                continue;
            }
            String id = declaredId(entry);
            if (id == null) {
                id = generatedId(index, declaredIds, usedIds);
            } else if (!usedIds.add(id)) {
                log.warn("Rejecting entry {}: conversation id {} already used", index, id);
                rejected.add(new SkippedConversation(id, "duplicate conversation id (entry " + index + ")"));
                continue;
            }
            records.add(decodeConversation(entry, id));
        }
        log.debug("Decoded {} conversation records ({} rejected)", records.size(), rejected.size());
        return new DecodedExport(records, rejected);
    }

    private JsonNode locateConversationList(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new ExportFormatException("Export payload is empty");
        }
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            if (root.path("conversations").isArray()) {
                return root.get("conversations");
            }
            if (root.path("data").isArray()) {
                return root.get("data");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isArray() && !value.isEmpty() && looksLikeConversation(value.get(0))) {
                    return value;
                }
            }
        }
        throw new ExportFormatException("Invalid data format. Expected a list of conversations.");
    }

    private boolean looksLikeConversation(JsonNode node) {
        return node.isObject() && (node.has("id") || node.has("conversation_id") || node.has("mapping"));
    }

    private static String declaredId(JsonNode entry) {
        return firstText(entry, "id", "conversation_id", "uuid");
    }

    private static String generatedId(int index, Set<String> declaredIds, Set<String> usedIds) {
        String id = "conversation-" + index;
        int attempt = 2;
        while (declaredIds.contains(id) || !usedIds.add(id)) {
            id = "conversation-" + index + "-" + attempt++;
        }
        return id;
    }

    private ExportRecord decodeConversation(JsonNode entry, String id) {
        NodeStore mapping;
        String currentNodeId;
        JsonNode rawMapping = entry.get("mapping");
        if (rawMapping != null && rawMapping.isObject() && !rawMapping.isEmpty()) {
            mapping = decodeMapping(rawMapping);
            currentNodeId = text(entry, "current_node");
        } else if (entry.path("messages").isArray()) {
            mapping = decodeMessageList(entry.get("messages"));
            currentNodeId = lastNodeId(mapping);
        } else {
            mapping = NodeStore.empty();
            currentNodeId = null;
        }

        return new ExportRecord(
                id,
                text(entry, "title"),
                epochSeconds(entry.get("create_time")),
                epochSeconds(entry.get("update_time")),
                text(entry, "default_model_slug"),
                currentNodeId,
                mapping,
                decodeProject(entry)
        );
    }

    private ProjectRef decodeProject(JsonNode entry) {
        String folderId = text(entry, "folder_id");
        if (folderId != null) {
            return new ProjectRef(folderId, textOrDefault(entry, "folder_name", "Project " + prefix(folderId)));
        }
        String gizmoId = text(entry, "gizmo_id");
        if (gizmoId != null) {
            return new ProjectRef(gizmoId, textOrDefault(entry, "gizmo_name", "GPT " + prefix(gizmoId)));
        }
        String templateId = text(entry, "conversation_template_id");
        if (templateId != null) {
            return new ProjectRef(templateId, textOrDefault(entry, "conversation_template_name", "Custom GPT"));
        }
        return null;
    }

    private NodeStore decodeMapping(JsonNode mapping) {
        List<MessageNode> nodes = new ArrayList<>(mapping.size());
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            nodes.add(decodeNode(field.getKey(), field.getValue()));
        }
        return NodeStore.of(nodes);
    }

    private MessageNode decodeNode(String id, JsonNode node) {
        String parentId = text(node, "parent");
        List<String> childrenIds = textList(node.get("children"));
        JsonNode message = node.get("message");
        if (message == null || !message.isObject()) {
            return MessageNode.placeholder(id, parentId, childrenIds);
        }
        JsonNode content = message.get("content");
        return new MessageNode(
                id,
                parentId,
                childrenIds,
                decodeRole(message),
                decodeParts(content),
                epochSeconds(message.get("create_time")),
                isHidden(message, content),
                text(message.path("metadata"), "model_slug")
        );
    }

    private NodeStore decodeMessageList(JsonNode messages) {
        List<MessageNode> nodes = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        usedIds.add(SYNTHETIC_ROOT_ID);
        List<String> ids = new ArrayList<>();
        for (int index = 0; index < messages.size(); index++) {
            String candidate = messages.get(index).isObject() ? text(messages.get(index), "id") : null;
            String id = candidate != null && usedIds.add(candidate) ? candidate : fallbackId(index, usedIds);
            ids.add(id);
        }

        nodes.add(MessageNode.placeholder(SYNTHETIC_ROOT_ID, null,
                ids.isEmpty() ? List.of() : List.of(ids.get(0))));
        for (int index = 0; index < messages.size(); index++) {
            JsonNode message = messages.get(index);
            String parentId = index == 0 ? SYNTHETIC_ROOT_ID : ids.get(index - 1);
            List<String> children = index + 1 < ids.size() ? List.of(ids.get(index + 1)) : List.of();
            if (!message.isObject()) {
                nodes.add(MessageNode.placeholder(ids.get(index), parentId, children));
                continue;
            }
            JsonNode content = message.get("content");
            nodes.add(new MessageNode(
                    ids.get(index),
                    parentId,
                    children,
                    decodeRole(message),
                    decodeParts(content),
                    epochSeconds(message.get("create_time")),
                    isHidden(message, content),
                    text(message, "model")
            ));
        }
        return NodeStore.of(nodes);
    }

    private static String fallbackId(int index, Set<String> usedIds) {
        String id = "message-" + index;
        int attempt = 2;
        while (!usedIds.add(id)) {
            id = "message-" + index + "-" + attempt++;
        }
        return id;
    }

    private String lastNodeId(NodeStore store) {
        String last = null;
        for (MessageNode node : store.nodes()) {
            last = node.id();
        }
        return last;
    }

    private MessageRole decodeRole(JsonNode message) {
        JsonNode author = message.get("author");
        String role;
        if (author != null && author.isTextual()) {
            role = author.asText();
        } else if (author != null && author.isObject()) {
            role = text(author, "role");
        } else {
            role = text(message, "role");
        }
        return MessageRole.fromValue(role).orElse(MessageRole.TOOL);
    }

    private List<String> decodeParts(JsonNode content) {
        List<String> parts = new ArrayList<>();
        if (content == null || content.isNull()) {
            return parts;
        }
        if (content.isTextual()) {
            parts.add(content.asText());
            return parts;
        }
        JsonNode rawParts = content.get("parts");
        if (rawParts != null && rawParts.isArray() && !rawParts.isEmpty()) {
            for (JsonNode part : rawParts) {
                if (part == null || part.isNull()) {
                    continue;
                }
                if (part.isTextual()) {
                    parts.add(part.asText());
                } else if (part.hasNonNull("text")) {
                    parts.add(part.get("text").asText());
                } else if (part.hasNonNull("content")) {
                    JsonNode nested = part.get("content");
                    parts.add(nested.isTextual() ? nested.asText() : nested.toString());
                }
            }
            return parts;
        }
        if (content.hasNonNull("text")) {
            parts.add(content.get("text").asText());
        }
        return parts;
    }

    private boolean isHidden(JsonNode message, JsonNode content) {
        if (message.path("metadata").path("is_visually_hidden_from_conversation").asBoolean(false)) {
            return true;
        }
        String recipient = text(message, "recipient");
        if (recipient != null && !ALL_RECIPIENTS.equals(recipient)) {
            return true;
        }
        return content != null && USER_EDITABLE_CONTEXT.equals(text(content, "content_type"));
    }

    private Instant epochSeconds(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            if (value.isNumber()) {
                return Instant.ofEpochMilli(Math.round(value.asDouble() * 1000d));
            }
            if (value.isTextual() && StringUtils.hasText(value.asText())) {
                String raw = value.asText().trim();
                try {
                    return Instant.ofEpochMilli(Math.round(Double.parseDouble(raw) * 1000d));
                } catch (NumberFormatException notNumeric) {
                    return Instant.parse(raw);
                }
            }
        } catch (DateTimeException | ArithmeticException exception) {
            log.debug("Ignoring unparseable timestamp {}", value, exception);
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return StringUtils.hasText(text) ? text : null;
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value != null ? value.trim() : fallback;
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            if (item != null && item.isValueNode() && !item.isNull() && StringUtils.hasText(item.asText())) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private static String prefix(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
