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

import io.jobwatch.joblog.events.DiagnosticSink.Level;
import io.jobwatch.joblog.events.MemoryDiagnosticSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JobEventCorrelatorTest {
    private static final LocalDate DATE = LocalDate.of(2024, 3, 14);

    private MemoryDiagnosticSink diagnostics;
    private ListSink rows;
    private JobEventCorrelator correlator;

    @BeforeEach
    void setUp() {
        diagnostics = new MemoryDiagnosticSink();
        rows = new ListSink();
        correlator = new JobEventCorrelator(Thresholds.DEFAULT, diagnostics, DATE);
    }

    private CorrelationSummary run(String... lines) throws IOException {
        return correlator.process(new BufferedReader(new StringReader(String.join("\n", lines))), rows);
    }

    @Test
    void testShortJobIsNotReported() throws IOException {
        CorrelationSummary summary = run(
            "09:00:00,Backup,START,101",
            "09:04:00,Backup,END,101");

        assertThat(rows.rows).isEmpty();
        assertEquals(1, summary.completedJobs());
        assertThat(summary.unterminated()).isEmpty();
        assertThat(diagnostics.getDiagnostics())
            .extracting(MemoryDiagnosticSink.Diagnostic::getLevel)
            .doesNotContain(Level.WARN);
    }

    @Test
    void testWarningJob() throws IOException {
        run("09:00:00,Backup,START,101",
            "09:06:00,Backup,END,101");

        assertThat(rows.rows).containsExactly(new ReportRow("101", "Backup", 360, Flag.WARNING));
    }

    @Test
    void testErrorJob() throws IOException {
        CorrelationSummary summary = run(
            "09:00:00,ETL,START,202",
            "09:12:00,ETL,END,202");

        assertThat(rows.rows).containsExactly(new ReportRow("202", "ETL", 720, Flag.ERROR));
        assertEquals(1, summary.errorsReported());
        assertEquals(0, summary.warningsReported());
    }

    @Test
    void testUnterminatedJobIsOnlyDiagnosed() throws IOException {
        CorrelationSummary summary = run("09:00:00,Job,START,303");

        assertThat(rows.rows).isEmpty();
        assertThat(summary.unterminated()).containsExactly(
            new OpenJob("303", "Job", LocalDateTime.of(DATE, LocalTime.of(9, 0))));
        assertThat(diagnostics.messages(Level.INFO))
            .contains("PID 303 (Job) still running, no END found (started 09:00:00)");
    }

    @Test
    void testMalformedLineIsSkipped() throws IOException {
        CorrelationSummary summary = run(
            "09:00:00,ETL,START,202",
            "garbage,missing,fields",
            "09:12:00,ETL,END,202");

        assertThat(rows.rows).containsExactly(new ReportRow("202", "ETL", 720, Flag.ERROR));
        assertThat(diagnostics.messages(Level.WARN))
            .containsExactly("Line 2 malformed (3 fields): garbage,missing,fields");
        assertEquals(1, summary.rejectedLines());
    }

    @Test
    void testThresholdBoundaries() throws IOException {
        run("00:00:00,under,START,a",
            "00:04:59,under,END,a",
            "01:00:00,warn-low,START,b",
            "01:05:00,warn-low,END,b",
            "02:00:00,warn-high,START,c",
            "02:09:59,warn-high,END,c",
            "03:00:00,error-low,START,d",
            "03:10:00,error-low,END,d");

        assertThat(rows.rows).containsExactly(
            new ReportRow("b", "warn-low", 300, Flag.WARNING),
            new ReportRow("c", "warn-high", 599, Flag.WARNING),
            new ReportRow("d", "error-low", 600, Flag.ERROR));
    }

    @Test
    void testRowsFollowEndOrder() throws IOException {
        run("08:00:00,First,START,1",
            "08:01:00,Second,START,2",
            "08:20:00,Second,END,2",
            "08:30:00,First,END,1");

        assertThat(rows.rows).extracting(ReportRow::pid).containsExactly("2", "1");
    }

    @Test
    void testDuplicateStartOverwrites() throws IOException {
        CorrelationSummary summary = run(
            "09:00:00,Old,START,7",
            "09:08:00,New,START,7",
            "09:10:00,New,END,7");

        // measured from the second START, 120s, so nothing is reported
        assertThat(rows.rows).isEmpty();
        assertEquals(1, summary.duplicateStarts());
        assertEquals(1, summary.completedJobs());
        assertThat(summary.unterminated()).isEmpty();
        assertThat(diagnostics.messages(Level.WARN))
            .containsExactly("Line 2 duplicate START for pid 7; overwriting previous start");
    }

    @Test
    void testDuplicateStartReportsSecondJob() throws IOException {
        run("09:00:00,Old,START,7",
            "09:01:00,New,START,7",
            "09:12:00,New,END,7");

        assertThat(rows.rows).containsExactly(new ReportRow("7", "New", 660, Flag.ERROR));
    }

    @Test
    void testOrphanEnd() throws IOException {
        CorrelationSummary summary = run(
            "09:00:00,Job,END,404",
            "09:00:00,Job,START,405");

        assertThat(rows.rows).isEmpty();
        assertEquals(1, summary.orphanEnds());
        assertThat(summary.unterminated()).extracting(OpenJob::pid).containsExactly("405");
        assertThat(diagnostics.messages(Level.WARN)).containsExactly("Line 1 END for pid 404 with no START");
    }

    @Test
    void testEndIsConsumedOnce() throws IOException {
        CorrelationSummary summary = run(
            "09:00:00,Job,START,5",
            "09:10:00,Job,END,5",
            "09:20:00,Job,END,5");

        assertThat(rows.rows).hasSize(1);
        assertEquals(1, summary.orphanEnds());
    }

    @Test
    void testNegativeDurationIsDropped() throws IOException {
        CorrelationSummary summary = run(
            "23:50:00,Overnight,START,9",
            "00:30:00,Overnight,END,9");

        assertThat(rows.rows).isEmpty();
        assertEquals(1, summary.completedJobs());
        assertThat(diagnostics.messages(Level.WARN)).isEmpty();
    }

    @Test
    void testBlankLinesAreTraced() throws IOException {
        CorrelationSummary summary = run(
            "",
            "   ",
            "09:00:00,ETL,START,202",
            "\t",
            "09:12:00,ETL,END,202");

        assertThat(rows.rows).hasSize(1);
        assertEquals(5, summary.linesRead());
        assertEquals(3, summary.blankLines());
        assertThat(diagnostics.messages(Level.TRACE))
            .containsExactly("Line 1: empty, skipped", "Line 2: empty, skipped", "Line 4: empty, skipped");
    }

    @Test
    void testBadTimestampAndUnknownEventAreSkipped() throws IOException {
        CorrelationSummary summary = run(
            "9am,Job,START,1",
            "09:00:00,Job,PAUSE,1",
            "09:00:00,Job,start,1",
            "09:06:00,Job,End,1");

        assertThat(rows.rows).containsExactly(new ReportRow("1", "Job", 360, Flag.WARNING));
        assertEquals(2, summary.rejectedLines());
        assertThat(diagnostics.messages(Level.WARN)).containsExactly(
            "Line 1 bad timestamp '9am'",
            "Line 2 unknown event 'PAUSE'");
    }

    @Test
    void testPidsAreOpaqueStrings() throws IOException {
        run("09:00:00,Job,START,007",
            "09:10:00,Job,END,7");

        assertThat(rows.rows).isEmpty();
        assertThat(diagnostics.messages(Level.WARN)).containsExactly("Line 2 END for pid 7 with no START");
    }

    @Test
    void testUnterminatedJobsKeepFirstStartOrder() throws IOException {
        CorrelationSummary summary = run(
            "09:00:00,A,START,a",
            "09:01:00,B,START,b",
            "09:02:00,A2,START,a");

        assertThat(summary.unterminated()).extracting(OpenJob::pid).containsExactly("a", "b");
        assertThat(summary.unterminated().get(0).job()).isEqualTo("A2");
    }

    @Test
    void testCustomThresholds() throws IOException {
        correlator = new JobEventCorrelator(new Thresholds(60, 120), diagnostics, DATE);
        run("09:00:00,Quick,START,1",
            "09:01:30,Quick,END,1");

        assertThat(rows.rows).containsExactly(new ReportRow("1", "Quick", 90, Flag.WARNING));
    }

    @Test
    void testEachRunStartsEmpty() throws IOException {
        run("09:00:00,Job,START,1");
        CorrelationSummary second = run("09:20:00,Job,END,1");

        assertThat(rows.rows).isEmpty();
        assertEquals(1, second.orphanEnds());
    }

    @Test
    void testSummaryIsLogged() throws IOException {
        run("09:00:00,ETL,START,202",
            "09:12:00,ETL,END,202");

        List<String> infos = diagnostics.messages(Level.INFO);
        assertThat(infos.get(infos.size() - 1))
            .startsWith("Read 2 lines (0 blank, 0 rejected): 1 jobs completed, 0 WARNING and 1 ERROR reported");
        assertThat(diagnostics.messages(Level.DEBUG)).containsExactly("PID 202 (ETL) completed in 720.0s");
    }

    @Test
    void testReadFailurePropagates() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public void close() {
            }
        };

        assertThatThrownBy(() -> correlator.process(new BufferedReader(failing), rows))
            .isInstanceOf(IOException.class)
            .hasMessage("disk gone");
    }

    @Test
    void testWriteFailurePropagates() {
        ReportSink broken = new ReportSink() {
            @Override
            public void write(ReportRow row) throws IOException {
                throw new IOException("report full");
            }

            @Override
            public void close() {
            }
        };

        assertThatThrownBy(() -> correlator.process(new BufferedReader(new StringReader(
            "09:00:00,ETL,START,202\n09:12:00,ETL,END,202\n")), broken))
            .isInstanceOf(IOException.class)
            .hasMessage("report full");
    }

    private static class ListSink implements ReportSink {
        private final List<ReportRow> rows = new ArrayList<>();

        @Override
        public void write(ReportRow row) {
            rows.add(row);
        }

        @Override
        public void close() {
        }
    }
}
