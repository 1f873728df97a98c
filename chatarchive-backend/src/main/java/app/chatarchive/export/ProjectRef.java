package app.chatarchive.export;

/**
 * Project association found on an exported conversation (folder, custom GPT or template).
 */
public record ProjectRef(String id, String name) {
}
