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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Writes report rows as comma separated values.
///
/// The header `pid,job,duration_sec,flag` is written as soon as the writer is opened, so a
/// run with no flagged jobs still produces a valid report. Fields containing a comma, double
/// quote, CR or LF are quoted, with inner quotes doubled. Records end with CRLF.
public class CsvReportWriter implements ReportSink {

    /// Column names, in output order
    public static final List<String> HEADER = List.of("pid", "job", "duration_sec", "flag");

    static final String RECORD_SEPARATOR = "\r\n";

    private final Writer writer;
    private long rowsWritten;

    /// Wrap a writer and write the header.
    ///
    /// @param writer the destination; closed when this writer is closed
    /// @throws IOException if the header cannot be written
    public CsvReportWriter(Writer writer) throws IOException {
        this.writer = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
        writeRecord(HEADER);
    }

    /// Create (or truncate) a report file and write the header.
    ///
    /// The parent directory must already exist.
    ///
    /// @param path the report file
    /// @return an open report writer
    /// @throws IOException if the file cannot be created or written
    public static CsvReportWriter open(Path path) throws IOException {
        return new CsvReportWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8));
    }

    @Override
    public void write(ReportRow row) throws IOException {
        writeRecord(List.of(
            row.pid(),
            row.job(),
            Long.toString(row.durationSeconds()),
            row.flag().name()));
        rowsWritten++;
    }

    private void writeRecord(List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(quote(fields.get(i)));
        }
        writer.write(RECORD_SEPARATOR);
    }

    static String quote(String field) {
        boolean needsQuotes = false;
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == ',' || c == '"' || c == '\r' || c == '\n') {
                needsQuotes = true;
                break;
            }
        }
        if (!needsQuotes) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    /// @return the number of data rows written, not counting the header
    public long getRowsWritten() {
        return rowsWritten;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
