package app.chatarchive.search;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.util.StringUtils;

import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.Message;

/**
 * Immutable lookup from conversation id to its searchable text: the title followed by every
 * message's display text, one per line, lower-cased.
 * <p>
 * A query matches when its trimmed, lower-cased form occurs anywhere in that text (plain
 * case-insensitive substring, no tokenizing, stemming or ranking). Results keep the order in
 * which conversations were indexed. A blank query matches nothing. The index is a snapshot:
 * build a new one whenever the conversation set changes.
 */
public final class SearchIndex {

    private final Map<String, String> searchableText;

    private SearchIndex(Map<String, String> searchableText) {
        this.searchableText = Collections.unmodifiableMap(searchableText);
    }

    public static SearchIndex build(Collection<Conversation> conversations) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (Conversation conversation : conversations) {
            entries.put(conversation.getId(), searchableText(conversation));
        }
        return new SearchIndex(entries);
    }

    public static SearchIndex empty() {
        return new SearchIndex(new LinkedHashMap<>());
    }

    public Set<String> query(String query) {
        if (!StringUtils.hasText(query)) {
            return Set.of();
        }
        String needle = normalize(query.trim());
        Set<String> matches = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : searchableText.entrySet()) {
            if (entry.getValue().contains(needle)) {
                matches.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSet(matches);
    }

    public int size() {
        return searchableText.size();
    }

    private static String searchableText(Conversation conversation) {
        StringBuilder builder = new StringBuilder();
        if (conversation.getTitle() != null) {
            builder.append(conversation.getTitle());
        }
        for (Message message : conversation.getMessages()) {
            builder.append('\n').append(message.displayText());
        }
        return normalize(builder.toString());
    }

    private static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
