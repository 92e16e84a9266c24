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

import java.util.Optional;

/// Classification of a completed job whose duration reached a threshold.
public enum Flag {
    WARNING,
    ERROR;

    /// Classify an unrounded duration.
    ///
    /// Negative durations, which only occur when an END is stamped earlier than its START,
    /// never reach a threshold.
    ///
    /// @param seconds elapsed time between START and END
    /// @param thresholds the limits to compare against
    /// @return ERROR or WARNING, or empty when the duration is below the warning threshold
    public static Optional<Flag> classify(double seconds, Thresholds thresholds) {
        if (seconds >= thresholds.errorSeconds()) {
            return Optional.of(ERROR);
        }
        if (seconds >= thresholds.warningSeconds()) {
            return Optional.of(WARNING);
        }
        return Optional.empty();
    }
}
