/// Correlation of job START/END events into a duration report.
///
/// A job log is a text file of `TIMESTAMP,JOB,EVENT,PID` lines. The
/// {@link io.jobwatch.joblog.JobEventCorrelator} pairs each END with the open START of the same
/// pid, and writes a {@link io.jobwatch.joblog.ReportRow} for every job whose duration reached
/// the {@link io.jobwatch.joblog.Thresholds}. {@link io.jobwatch.joblog.JobLogReport} runs it
/// from file to file.
///
/// ## Known limitations
///
/// - Only the time of day is read from a line. A log which crosses midnight gives wrong
///   durations, and an END stamped before its START gives a negative duration which is
///   never reported.
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
