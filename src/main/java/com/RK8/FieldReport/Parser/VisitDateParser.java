package com.RK8.FieldReport.Parser;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the visit date columns of the CRM exports. Only a fixed set of
 * unambiguous layouts is accepted; slash-separated numeric dates such as
 * 03/05/2024 could be read either way round and are rejected.
 */
@Component
public class VisitDateParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            formatter("uuuu-MM-dd HH:mm:ss"),
            formatter("uuuu-MM-dd HH:mm"),
            formatter("uuuu-MM-dd'T'HH:mm:ss"),
            formatter("uuuu-MM-dd'T'HH:mm"),
            formatter("d-MM-uuuu HH:mm:ss"),
            formatter("d-MM-uuuu HH:mm"),
            formatter("d-MMM-uuuu HH:mm:ss"),
            formatter("d-MMM-uuuu HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("uuuu-MM-dd"),
            formatter("d-MM-uuuu"),
            formatter("d-MMM-uuuu")
    );

    public Optional<VisitTimestamp> parse(String value) {
        if (value == null) return Optional.empty();
        String text = value.trim();
        if (text.isEmpty() || text.indexOf('/') >= 0) return Optional.empty();

        for (DateTimeFormatter fmt : DATE_TIME_FORMATS) {
            try {
                LocalDateTime parsed = LocalDateTime.parse(text, fmt);
                return Optional.of(new VisitTimestamp(parsed.toLocalDate(), parsed.toLocalTime()));
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        for (DateTimeFormatter fmt : DATE_FORMATS) {
            try {
                return Optional.of(new VisitTimestamp(LocalDate.parse(text, fmt), null));
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    @Value
    public static class VisitTimestamp {
        LocalDate date;
        // null for date-only values
        LocalTime time;
    }
}
