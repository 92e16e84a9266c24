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

import java.util.List;

/// Outcome of one correlation run.
///
/// @param linesRead every line read, blank or not
/// @param blankLines lines which were empty after trimming
/// @param rejectedLines lines skipped for a bad field count, timestamp or event
/// @param duplicateStarts STARTs which replaced an open job with the same pid
/// @param orphanEnds ENDs whose pid had no open job
/// @param completedJobs START/END pairs matched, reported or not
/// @param warningsReported rows written with {@link Flag#WARNING}
/// @param errorsReported rows written with {@link Flag#ERROR}
/// @param unterminated jobs still open when the input ended, in first-START order
public record CorrelationSummary(
    long linesRead,
    long blankLines,
    long rejectedLines,
    long duplicateStarts,
    long orphanEnds,
    long completedJobs,
    long warningsReported,
    long errorsReported,
    List<OpenJob> unterminated
) {
    public CorrelationSummary {
        unterminated = List.copyOf(unterminated);
    }

    /// @return total rows written to the report
    public long rowsReported() {
        return warningsReported + errorsReported;
    }
}
