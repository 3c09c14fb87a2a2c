package com.spendings.backend.mappers;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.Optional;

import org.bson.Document;

/**
 * Lenient readers for raw store documents. Documents may have been written by other tools, so
 * fields are read by shape rather than trusted to have the expected Java type.
 */
public final class DocumentValues {

    public static final String ID = "_id";

    /**
     * ISO-8601 date, optionally followed by a time and an offset. A missing time means midnight and
     * a missing offset means UTC.
     */
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.OFFSET_SECONDS, 0)
            .toFormatter();

    private DocumentValues() {}

    public static String idOf(Document doc) {
        Object id = doc.get(ID);
        return id == null ? null : id.toString();
    }

    public static String text(Document doc, String field) {
        Object value = doc.get(field);
        return value == null ? null : value.toString();
    }

    public static Double number(Document doc, String field) {
        Object value = doc.get(field);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    /**
     * Amount used by sums; anything missing or non-numeric contributes 0.
     */
    public static double amountOrZero(Document doc, String field) {
        Double amount = number(doc, field);
        return amount == null ? 0.0 : amount;
    }

    /**
     * Resolves a stored timestamp. Empty when the value is missing or is text that is not an
     * ISO-8601 date or date-time.
     */
    public static Optional<Instant> instant(Object value) {
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof String text) {
            return parseTimestamp(text);
        }
        return Optional.empty();
    }

    public static Optional<Instant> parseTimestamp(String text) {
        try {
            return Optional.of(TIMESTAMP_FORMAT.parse(text.trim(), OffsetDateTime::from).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Text form of a stored timestamp: dates become ISO-8601 in UTC, text is returned verbatim.
     */
    public static String isoText(Object value) {
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        return value == null ? null : value.toString();
    }

    public static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }
}
