package app.chatarchive.markdown;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;

final class FileNames {

    static final String UNTITLED = "untitled";
    private static final int MAX_SLUG_LENGTH = 80;
    private static final String INVALID_DIRECTORY_CHARS = "<>:\"/\\|?*";

    private FileNames() {
    }

    static String slugify(String value) {
        if (value == null || value.isBlank()) {
            return UNTITLED;
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}+", "");
        String slug = decomposed.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? UNTITLED : slug;
    }

    static String directoryName(String projectName) {
        if (projectName == null || projectName.isBlank()) {
            return UNTITLED;
        }
        StringBuilder sanitized = new StringBuilder(projectName.length());
        for (char c : projectName.toCharArray()) {
            sanitized.append(INVALID_DIRECTORY_CHARS.indexOf(c) >= 0 || Character.isISOControl(c) ? '_' : c);
        }
        String name = sanitized.toString().strip();
        if (name.length() > MAX_SLUG_LENGTH) {
            name = name.substring(0, MAX_SLUG_LENGTH).strip();
        }
        return name.isEmpty() || ".".equals(name) || "..".equals(name) ? UNTITLED : name;
    }

    /**
     * Returns {@code base}, or {@code base-2}, {@code base-3}, ... for the first name not yet in
     * {@code taken}, and records it there.
     */
    static String unique(String base, Set<String> taken) {
        String candidate = base;
        int counter = 2;
        while (!taken.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = base + "-" + counter++;
        }
        return candidate;
    }
}
