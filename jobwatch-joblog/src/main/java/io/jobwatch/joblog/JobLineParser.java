package io.jobwatch.joblog;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Objects;

/// Parses `TIMESTAMP,JOB,EVENT,PID` lines into {@link JobEvent}s.
///
/// Only the first three commas delimit fields, so the pid absorbs any further commas. Each
/// field is stripped of surrounding whitespace. The time of day is placed on a fixed reference
/// date so that two timestamps of the same run can be subtracted; the date itself carries no
/// meaning, and a log which crosses midnight yields meaningless durations.
public class JobLineParser {

    static final int FIELD_COUNT = 4;

    /// Hours, minutes and seconds of one or two digits each, 24-hour clock
    static final DateTimeFormatter TIME_OF_DAY = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE)
        .appendLiteral(':')
        .appendValue(ChronoField.MINUTE_OF_HOUR, 1, 2, SignStyle.NOT_NEGATIVE)
        .appendLiteral(':')
        .appendValue(ChronoField.SECOND_OF_MINUTE, 1, 2, SignStyle.NOT_NEGATIVE)
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);

    private final LocalDate referenceDate;

    /// @param referenceDate the date every parsed time of day is placed on
    public JobLineParser(LocalDate referenceDate) {
        this.referenceDate = Objects.requireNonNull(referenceDate, "referenceDate");
    }

    /// Parse and validate one non-empty, already trimmed line.
    ///
    /// @param lineNumber 1-based line number, used in error messages
    /// @param line the trimmed line text
    /// @return the validated event
    /// @throws JobLineFormatException if the field count, timestamp or event is invalid
    public JobEvent parse(long lineNumber, String line) {
        String[] parts = line.split(",", FIELD_COUNT);
        if (parts.length != FIELD_COUNT) {
            throw new JobLineFormatException(JobLineFormatException.Reason.FIELD_COUNT, lineNumber,
                "Line " + lineNumber + " malformed (" + parts.length + " fields): " + line);
        }

        String timestampField = parts[0].strip();
        String job = parts[1].strip();
        String eventField = parts[2].strip();
        String pid = parts[3].strip();

        LocalDateTime timestamp = parseTimestamp(lineNumber, timestampField);

        EventKind kind = EventKind.parse(eventField).orElseThrow(
            () -> new JobLineFormatException(JobLineFormatException.Reason.EVENT, lineNumber,
                "Line " + lineNumber + " unknown event '" + eventField.toUpperCase(Locale.ROOT) + "'"));

        return new JobEvent(lineNumber, timestamp, job, kind, pid);
    }

    private LocalDateTime parseTimestamp(long lineNumber, String text) {
        try {
            return LocalDateTime.of(referenceDate, LocalTime.parse(text, TIME_OF_DAY));
        } catch (DateTimeParseException e) {
            throw new JobLineFormatException(JobLineFormatException.Reason.TIMESTAMP, lineNumber,
                "Line " + lineNumber + " bad timestamp '" + text + "'");
        }
    }
}
