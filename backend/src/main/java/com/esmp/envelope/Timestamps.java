package com.esmp.envelope;

import com.esmp.error.EsmpException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Reads protocol timestamps: RFC 3339 strings, or integral epoch seconds.
 *
 * <p>Results are truncated to milliseconds, the precision stored {@code updated_at} columns keep,
 * so ordering checks compare like with like before and after a reload.
 */
public final class Timestamps {

    private Timestamps() {}

    public static Instant parse(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw EsmpException.schema(field, "is required");
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            try {
                return Instant.ofEpochSecond(node.longValue());
            } catch (DateTimeException e) {
                throw EsmpException.schema(field, "is out of range");
            }
        }
        if (node.isTextual()) {
            return parse(node.textValue(), field);
        }
        throw EsmpException.schema(field, "must be an RFC 3339 timestamp");
    }

    public static Instant parse(String text, String field) {
        if (text == null || text.isBlank()) {
            throw EsmpException.schema(field, "is required");
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .toInstant()
                    .truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeException e) {
            throw EsmpException.schema(field, "must be an RFC 3339 timestamp");
        }
    }
}
