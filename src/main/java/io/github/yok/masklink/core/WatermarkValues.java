package io.github.yok.masklink.core;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

/**
 * Canonical text form and ordering of watermark values.
 *
 * <p>
 * Watermarks are persisted as text and used as SQL literals in the next delta run.
 * </p>
 * <ul>
 * <li>Local timestamps are rendered as {@code yyyy-MM-dd HH:mm:ss[.fraction]}. Fixed-width text
 * comparison follows chronological order.</li>
 * <li>Offset-bearing timestamps are normalized to UTC and rendered with the offset,
 * {@code yyyy-MM-dd HH:mm:ss[.fraction]+00:00}, so the literal means the same instant in any
 * session time zone. They are compared by instant.</li>
 * <li>Numbers are rendered in plain notation and compared numerically.</li>
 * <li>Everything else is compared as text, the way the database compares a character column.</li>
 * </ul>
 *
 * <p>
 * The comparison is chosen from the {@link Kind} of the column value, not from the text, so a
 * character column holding digits orders {@code "9"} after {@code "10"} as the database does. A
 * watermark column must hold values of one type.
 * </p>
 */
public final class WatermarkValues {

    /**
     * How rendered values of a column are ordered.
     */
    public enum Kind {
        NUMBER, OFFSET_TIMESTAMP, TEXT;

        /**
         * Returns the kind of a column value.
         *
         * @param value non-null column value
         * @return kind
         */
        public static Kind of(Object value) {
            if (value instanceof Number) {
                return NUMBER;
            }
            if (value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
                return OFFSET_TIMESTAMP;
            }
            return TEXT;
        }
    }

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE).appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME).toFormatter();

    private static final DateTimeFormatter OFFSET_TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(TIMESTAMP_FORMAT).appendOffset("+HH:MM", "+00:00").toFormatter();

    private WatermarkValues() {}

    /**
     * Renders a column value as watermark text.
     *
     * @param value column value
     * @return text form, or {@code null} for {@code null}
     */
    public static String render(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return TIMESTAMP_FORMAT.format(((Timestamp) value).toLocalDateTime());
        }
        if (value instanceof LocalDateTime) {
            return TIMESTAMP_FORMAT.format((LocalDateTime) value);
        }
        if (value instanceof OffsetDateTime) {
            return OFFSET_TIMESTAMP_FORMAT
                    .format(((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (value instanceof ZonedDateTime) {
            return OFFSET_TIMESTAMP_FORMAT.format(
                    ((ZonedDateTime) value).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (value instanceof Number) {
            BigDecimal number = toDecimal(value.toString());
            return number != null ? number.toPlainString() : value.toString();
        }
        return value.toString();
    }

    /**
     * Compares two rendered watermarks of one column.
     *
     * <p>
     * A value that does not parse as its kind (a state file written by an older run, for example)
     * falls back to text comparison.
     * </p>
     *
     * @param a first value
     * @param b second value
     * @param kind kind of the column values
     * @return negative, zero or positive as {@code a} is less than, equal to or greater than
     *         {@code b}
     */
    public static int compare(String a, String b, Kind kind) {
        switch (kind) {
            case NUMBER:
                BigDecimal left = toDecimal(a);
                BigDecimal right = toDecimal(b);
                if (left != null && right != null) {
                    return left.compareTo(right);
                }
                break;
            case OFFSET_TIMESTAMP:
                OffsetDateTime from = toOffsetTimestamp(a);
                OffsetDateTime to = toOffsetTimestamp(b);
                if (from != null && to != null) {
                    return from.toInstant().compareTo(to.toInstant());
                }
                break;
            default:
                break;
        }
        return a.compareTo(b);
    }

    private static BigDecimal toDecimal(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static OffsetDateTime toOffsetTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text.trim(), OFFSET_TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
