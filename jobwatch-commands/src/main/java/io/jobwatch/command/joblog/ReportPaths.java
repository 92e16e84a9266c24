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

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/// Default locations for joblog reports.
public final class ReportPaths {

    /// Directory reports go to when no output is given
    public static final Path DEFAULT_REPORT_DIR = Path.of("out");

    static final DateTimeFormatter REPORT_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");

    private ReportPaths() {
    }

    /// Build `out/report_<yyyy-MM-dd-HH-mm-ss>.csv` from the current time.
    ///
    /// @param clock the clock to read the current time from
    /// @return the relative report path
    public static Path defaultReportPath(Clock clock) {
        String stamp = REPORT_STAMP.format(LocalDateTime.now(clock));
        return DEFAULT_REPORT_DIR.resolve("report_" + stamp + ".csv");
    }
}
