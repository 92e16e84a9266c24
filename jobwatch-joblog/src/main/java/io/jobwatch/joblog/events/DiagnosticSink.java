package io.jobwatch.joblog.events;

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

/// Destination for the diagnostics produced while correlating a job log.
///
/// Messages use Log4j style `{}` placeholders. Diagnostics are a side channel only: nothing
/// written here ever reaches the report, and the correlator never reads back what it emitted.
public interface DiagnosticSink {
    /// Log a trace message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void trace(String format, Object... args);

    /// Log a debug message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void debug(String format, Object... args);

    /// Log an info message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void info(String format, Object... args);

    /// Log a warning message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void warn(String format, Object... args);

    /// Severity of a diagnostic, lowest first.
    enum Level {
        TRACE,
        DEBUG,
        INFO,
        WARN
    }
}
