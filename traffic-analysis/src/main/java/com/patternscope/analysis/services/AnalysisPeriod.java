package com.patternscope.analysis.services;

import com.patternscope.analysis.dto.PeriodDto;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Queried time range. Either bound may be {@code null}, meaning unbounded on that side.
 */
@Value
public class AnalysisPeriod {

    Instant start;
    Instant end;

    public static AnalysisPeriod of(Instant start, Instant end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidPeriodException("Period start " + start + " is after end " + end);
        }
        return new AnalysisPeriod(start, end);
    }

    public static AnalysisPeriod parse(String start, String end) {
        return of(parseBound("start", start), parseBound("end", end));
    }

    public PeriodDto toDto() {
        return new PeriodDto(start == null ? null : start.toString(), end == null ? null : end.toString());
    }

    /** Accepts an instant, an offset date-time, a local date-time (UTC) or a date (start of day UTC). */
    static Instant parseBound(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            if (text.indexOf('T') < 0) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidPeriodException("Invalid " + name + " bound '" + value + "': expected ISO-8601 date or date-time", e);
        }
    }
}
