package app.chatarchive.config;

import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat-archive")
public record ArchiveProperties(Integer titleMaxLength,
                                Integer previewLength,
                                ZoneId timeZone,
                                Integer parseParallelism) {

    public static final int DEFAULT_TITLE_MAX_LENGTH = 80;
    public static final int MIN_TITLE_MAX_LENGTH = 10;
    public static final int DEFAULT_PREVIEW_LENGTH = 200;

    public ArchiveProperties {
        titleMaxLength = normalizeTitleMaxLength(titleMaxLength);
        previewLength = normalizePreviewLength(previewLength);
        timeZone = timeZone != null ? timeZone : ZoneId.systemDefault();
        parseParallelism = normalizeParallelism(parseParallelism);
    }

    private static Integer normalizeTitleMaxLength(Integer value) {
        if (value == null || value <= 0) {
            return DEFAULT_TITLE_MAX_LENGTH;
        }
        return Math.max(value, MIN_TITLE_MAX_LENGTH);
    }

    private static Integer normalizePreviewLength(Integer value) {
        if (value == null || value <= 0) {
            return DEFAULT_PREVIEW_LENGTH;
        }
        return value;
    }

    private static Integer normalizeParallelism(Integer value) {
        if (value == null || value <= 0) {
            return Runtime.getRuntime().availableProcessors();
        }
        return value;
    }
}
