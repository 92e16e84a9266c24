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

import java.time.LocalDateTime;

/// One validated line of a job log.
///
/// @param lineNumber 1-based line number in the input
/// @param timestamp time of day from the line, placed on the run's reference date
/// @param job free text job description
/// @param kind START or END
/// @param pid opaque identifier pairing a START with its END
public record JobEvent(long lineNumber, LocalDateTime timestamp, String job, EventKind kind, String pid) {
}
