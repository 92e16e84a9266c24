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

/// Duration limits, in seconds, at which a completed job is reported.
///
/// @param warningSeconds durations at or above this are reported as {@link Flag#WARNING}
/// @param errorSeconds durations at or above this are reported as {@link Flag#ERROR}
public record Thresholds(long warningSeconds, long errorSeconds) {

    /// Default warning threshold, 5 minutes
    public static final long DEFAULT_WARNING_SECONDS = 300;
    /// Default error threshold, 10 minutes
    public static final long DEFAULT_ERROR_SECONDS = 600;

    /// The thresholds used when none are configured
    public static final Thresholds DEFAULT = new Thresholds(DEFAULT_WARNING_SECONDS, DEFAULT_ERROR_SECONDS);

    public Thresholds {
        if (warningSeconds < 0 || errorSeconds < 0) {
            throw new IllegalArgumentException(
                "thresholds must not be negative, got warning=" + warningSeconds + " error=" + errorSeconds);
        }
        if (warningSeconds >= errorSeconds) {
            throw new IllegalArgumentException(
                "warning threshold (" + warningSeconds + "s) must be below error threshold (" + errorSeconds + "s)");
        }
    }
}
