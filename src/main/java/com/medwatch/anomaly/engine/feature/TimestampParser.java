package com.medwatch.anomaly.engine.feature;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses the timestamp and date formats accepted on data points:
 * ISO-8601 instants, offset or local date-times, plain dates and epoch milliseconds.
 * Values without an offset are interpreted in the configured zone.
 */
public final class TimestampParser {

    private TimestampParser() {}

    public static Optional<ZonedDateTime> parse(String value, ZoneId zone) {
        if (value == null || value.isBlank()) return Optional.empty();
        String text = value.trim();

        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(text)).atZone(zone));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        try {
            return Optional.of(OffsetDateTime.parse(text).atZoneSameInstant(zone));
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the next format
        }
        try {
            return Optional.of(LocalDateTime.parse(text).atZone(zone));
        } catch (DateTimeParseException ignored) {
            // not a local date-time, try the next format
        }
        try {
            return Optional.of(LocalDate.parse(text).atStartOfDay(zone));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
