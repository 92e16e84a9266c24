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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// Runs a {@link JobEventCorrelator} from a job log file to a CSV report file.
///
/// The report's parent directories are created as needed, and an existing report is
/// replaced. Failing to open, read or write either file aborts the run with the
/// {@link IOException}; rows written before the failure stay in the report.
public class JobLogReport {
    private static final Logger logger = LogManager.getLogger(JobLogReport.class);

    private final JobEventCorrelator correlator;

    /// @param correlator the correlator to run
    public JobLogReport(JobEventCorrelator correlator) {
        this.correlator = Objects.requireNonNull(correlator, "correlator");
    }

    /// Correlate a job log into a report file.
    ///
    /// @param input the job log to read
    /// @param output the report to create
    /// @return the correlation summary
    /// @throws IOException if either file cannot be opened, read or written
    public CorrelationSummary run(Path input, Path output) throws IOException {
        logger.info("Processing started for file {}", input);

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        CorrelationSummary summary;
        try (BufferedReader in = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             CsvReportWriter out = CsvReportWriter.open(output)) {
            summary = correlator.process(in, out);
        }

        logger.info("Processing finished. Report saved to {}", output);
        return summary;
    }
}
