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

/// One row of the duration report.
///
/// @param pid identifier of the completed job
/// @param job job description from its START line
/// @param durationSeconds elapsed time, rounded to the nearest second
/// @param flag the threshold the duration reached
public record ReportRow(String pid, String job, long durationSeconds, Flag flag) {
}
