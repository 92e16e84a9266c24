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

/// Thrown when a job log line fails validation.
///
/// The message is worded for the diagnostic log and already names the line number.
public class JobLineFormatException extends RuntimeException {

    /// What was wrong with the line
    public enum Reason {
        /// the line did not split into exactly four fields
        FIELD_COUNT,
        /// the first field is not a valid HH:MM:SS time of day
        TIMESTAMP,
        /// the third field is neither START nor END
        EVENT
    }

    private final Reason reason;
    private final long lineNumber;

    public JobLineFormatException(Reason reason, long lineNumber, String message) {
        super(message);
        this.reason = reason;
        this.lineNumber = lineNumber;
    }

    public Reason getReason() {
        return reason;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
