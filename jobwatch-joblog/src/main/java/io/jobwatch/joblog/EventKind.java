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

import java.util.Locale;
import java.util.Optional;

/// The two lifecycle events a job log records for each job execution.
public enum EventKind {
    START,
    END;

    /// Match an event field, ignoring case.
    ///
    /// @param text the event field, already trimmed
    /// @return the matching kind, or empty if the text names neither event
    public static Optional<EventKind> parse(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        for (EventKind kind : values()) {
            if (kind.name().equals(upper)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
