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

import io.jobwatch.joblog.events.DiagnosticSink;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Pairs START and END events by pid and reports jobs whose duration reached a threshold.
///
/// The input is read once, line by line. A valid START opens a job under its pid, replacing
/// any job already open under that pid. A valid END closes the open job with the same pid,
/// and if the elapsed time reached the warning or error threshold a {@link ReportRow} is
/// written to the sink straight away. Jobs still open at the end of input are only mentioned
/// in the diagnostics.
///
/// Bad input never stops a run. Blank lines, lines with the wrong number of fields, bad
/// timestamps, unknown events, duplicate STARTs and ENDs without a START each produce a
/// diagnostic and the line is skipped (a duplicate START still replaces the open job).
/// Read and write failures propagate to the caller.
///
/// # Usage
/// ```java
/// JobEventCorrelator correlator = new JobEventCorrelator(Thresholds.DEFAULT, new LoggerDiagnosticSink());
/// try (BufferedReader in = Files.newBufferedReader(log);
///      CsvReportWriter out = CsvReportWriter.open(report)) {
///     CorrelationSummary summary = correlator.process(in, out);
/// }
/// ```
///
/// Instances are not thread safe. Each call to {@link #process} starts with no open jobs.
public class JobEventCorrelator {

    private static final DateTimeFormatter START_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Thresholds thresholds;
    private final DiagnosticSink diagnostics;
    private final JobLineParser parser;

    /// Create a correlator which uses today's date as the reference date.
    ///
    /// @param thresholds the report thresholds
    /// @param diagnostics where diagnostics go
    public JobEventCorrelator(Thresholds thresholds, DiagnosticSink diagnostics) {
        this(thresholds, diagnostics, LocalDate.now());
    }

    /// @param thresholds the report thresholds
    /// @param diagnostics where diagnostics go
    /// @param referenceDate the date every time of day is placed on before subtracting
    public JobEventCorrelator(Thresholds thresholds, DiagnosticSink diagnostics, LocalDate referenceDate) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.parser = new JobLineParser(referenceDate);
    }

    /// Correlate every line of the input, writing flagged jobs to the sink.
    ///
    /// The sink is neither flushed nor closed here.
    ///
    /// @param input the job log
    /// @param sink destination for report rows
    /// @return counters for the run and the jobs left open
    /// @throws IOException if reading the input or writing the sink fails
    public CorrelationSummary process(BufferedReader input, ReportSink sink) throws IOException {
        Run run = new Run(sink);
        String raw;
        while ((raw = input.readLine()) != null) {
            run.accept(raw);
        }
        return run.finish();
    }

    /// State for a single pass over one input.
    private class Run {
        private final ReportSink sink;
        // insertion order is kept so leftovers are listed in first-START order
        private final Map<String, OpenJob> open = new LinkedHashMap<>();

        private long lineNumber;
        private long blankLines;
        private long rejectedLines;
        private long duplicateStarts;
        private long orphanEnds;
        private long completedJobs;
        private long warningsReported;
        private long errorsReported;

        Run(ReportSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
        }

        void accept(String raw) throws IOException {
            lineNumber++;
            String line = raw.strip();
            if (line.isEmpty()) {
                blankLines++;
                diagnostics.trace("Line {}: empty, skipped", lineNumber);
                return;
            }

            JobEvent event;
            try {
                event = parser.parse(lineNumber, line);
            } catch (JobLineFormatException e) {
                rejectedLines++;
                diagnostics.warn("{}", e.getMessage());
                return;
            }

            switch (event.kind()) {
                case START:
                    start(event);
                    break;
                case END:
                    end(event);
                    break;
                default:
                    throw new IllegalStateException("unhandled event kind " + event.kind());
            }
        }

        private void start(JobEvent event) {
            if (open.containsKey(event.pid())) {
                duplicateStarts++;
                diagnostics.warn("Line {} duplicate START for pid {}; overwriting previous start",
                    event.lineNumber(), event.pid());
            }
            open.put(event.pid(), new OpenJob(event.pid(), event.job(), event.timestamp()));
        }

        private void end(JobEvent event) throws IOException {
            OpenJob started = open.remove(event.pid());
            if (started == null) {
                orphanEnds++;
                diagnostics.warn("Line {} END for pid {} with no START", event.lineNumber(), event.pid());
                return;
            }
            completedJobs++;

            double seconds = Duration.between(started.start(), event.timestamp()).toMillis() / 1000.0;
            diagnostics.debug("PID {} ({}) completed in {}s", started.pid(), started.job(), seconds);

            Optional<Flag> flag = Flag.classify(seconds, thresholds);
            if (flag.isEmpty()) {
                return;
            }
            sink.write(new ReportRow(started.pid(), started.job(), Math.round(seconds), flag.get()));
            if (flag.get() == Flag.ERROR) {
                errorsReported++;
            } else {
                warningsReported++;
            }
        }

        CorrelationSummary finish() {
            for (OpenJob job : open.values()) {
                diagnostics.info("PID {} ({}) still running, no END found (started {})",
                    job.pid(), job.job(), START_TIME.format(job.start()));
            }
            CorrelationSummary summary = new CorrelationSummary(
                lineNumber, blankLines, rejectedLines, duplicateStarts, orphanEnds,
                completedJobs, warningsReported, errorsReported, new ArrayList<>(open.values()));
            diagnostics.info(
                "Read {} lines ({} blank, {} rejected): {} jobs completed, {} WARNING and {} ERROR reported, "
                    + "{} duplicate STARTs, {} ENDs without START, {} still running",
                summary.linesRead(), summary.blankLines(), summary.rejectedLines(), summary.completedJobs(),
                summary.warningsReported(), summary.errorsReported(), summary.duplicateStarts(),
                summary.orphanEnds(), summary.unterminated().size());
            return summary;
        }
    }
}
