package io.jobwatch.command.joblog;

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

import io.jobwatch.api.services.BundledCommand;
import io.jobwatch.api.services.Selector;
import io.jobwatch.joblog.CorrelationSummary;
import io.jobwatch.joblog.JobEventCorrelator;
import io.jobwatch.joblog.JobLogReport;
import io.jobwatch.joblog.Thresholds;
import io.jobwatch.joblog.events.LoggerDiagnosticSink;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/// Analyse a CSV job log and report jobs which ran too long
///
/// Each line of the job log is `TIMESTAMP,JOB,EVENT,PID`. START and END events are paired by
/// pid, and every job whose run time reached the warning or error threshold is written to the
/// report as `pid,job,duration_sec,flag`. Problems with individual lines are logged and the
/// line is skipped; only a failure to read the log or write the report fails the command.
///
/// # Usage
/// ```
/// joblog jobs.log
/// joblog jobs.log -o reports/today.csv
/// joblog jobs.log --warning-threshold 120 --error-threshold 900
/// ```
@Selector("joblog")
@CommandLine.Command(name = "joblog",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    header = "Analyse a CSV job log and report jobs which exceed run time thresholds",
    description = "Calculates the run time of every job from its START and END events and writes "
        + "the jobs at or above the warning or error threshold to a CSV report.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:error reading the log or writing the report", "2:invalid usage"})
public class CMD_joblog implements BundledCommand, Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_joblog.class);

    @CommandLine.Parameters(index = "0", paramLabel = "LOGFILE",
        description = "Full path to the CSV log file to analyse")
    private Path logfile;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "REPORT",
        description = "Full path (including filename) for the generated report CSV "
            + "(default: out/report_<yyyy-MM-dd-HH-mm-ss>.csv)")
    private Path outfile;

    @CommandLine.Option(names = {"-w", "--warning-threshold"}, paramLabel = "SECONDS",
        defaultValue = "" + Thresholds.DEFAULT_WARNING_SECONDS,
        description = "Report jobs running at least this many seconds as WARNING (default: ${DEFAULT-VALUE})")
    private long warningThreshold = Thresholds.DEFAULT_WARNING_SECONDS;

    @CommandLine.Option(names = {"-e", "--error-threshold"}, paramLabel = "SECONDS",
        defaultValue = "" + Thresholds.DEFAULT_ERROR_SECONDS,
        description = "Report jobs running at least this many seconds as ERROR (default: ${DEFAULT-VALUE})")
    private long errorThreshold = Thresholds.DEFAULT_ERROR_SECONDS;

    @CommandLine.Option(names = {"-v", "--verbose"},
        description = "Log debug diagnostics, including every completed job")
    private boolean verbose = false;

    @CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean helpRequested = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Clock clock;

    /// Create a joblog command using the system clock for the default report name
    public CMD_joblog() {
        this(Clock.systemDefaultZone());
    }

    /// @param clock clock used to name the default report
    CMD_joblog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setLevel("io.jobwatch", Level.DEBUG);
        }
        logger.info("Program started.");

        Thresholds thresholds;
        try {
            thresholds = new Thresholds(warningThreshold, errorThreshold);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        Path output = outfile != null ? outfile : ReportPaths.defaultReportPath(clock);

        logger.debug("Log file to analyze: {}", logfile);
        logger.debug("Report file: {}", output);
        logger.debug("Thresholds: warning={}s error={}s", thresholds.warningSeconds(), thresholds.errorSeconds());

        JobEventCorrelator correlator = new JobEventCorrelator(thresholds, new LoggerDiagnosticSink());
        try {
            CorrelationSummary summary = new JobLogReport(correlator).run(logfile, output);
            logger.debug("Wrote {} report rows", summary.rowsReported());
        } catch (IOException e) {
            logger.error("Unable to produce report from {}: {}", logfile, e.toString(), e);
            return 1;
        }

        logger.info("Program ended.");
        return 0;
    }

    /// Run CMD_joblog
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        int exitCode = new CommandLine(new CMD_joblog())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true)
            .execute(args);
        System.exit(exitCode);
    }
}
