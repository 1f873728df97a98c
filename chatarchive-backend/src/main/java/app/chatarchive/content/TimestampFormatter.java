package app.chatarchive.content;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Human-readable rendering of export timestamps in a fixed zone. Missing values render as
 * {@link #TIME_UNKNOWN}; nothing is ever defaulted to "now".
 */
public class TimestampFormatter {

    public static final String TIME_UNKNOWN = "time unknown";

    private static final String MESSAGE_PATTERN = "MMM dd, yyyy hh:mm a";
    private static final String DATE_PATTERN = "MMMM dd, yyyy";

    private final DateTimeFormatter messageFormatter;
    private final DateTimeFormatter dateFormatter;

    public TimestampFormatter(ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        this.messageFormatter = DateTimeFormatter.ofPattern(MESSAGE_PATTERN, Locale.ENGLISH).withZone(zone);
        this.dateFormatter = DateTimeFormatter.ofPattern(DATE_PATTERN, Locale.ENGLISH).withZone(zone);
    }

    /** e.g. {@code Jan 05, 2024 03:04 PM} */
    public String formatMessageTime(Instant instant) {
        return instant == null ? TIME_UNKNOWN : messageFormatter.format(instant);
    }

    /** e.g. {@code January 05, 2024} */
    public String formatDate(Instant instant) {
        return instant == null ? TIME_UNKNOWN : dateFormatter.format(instant);
    }
}
