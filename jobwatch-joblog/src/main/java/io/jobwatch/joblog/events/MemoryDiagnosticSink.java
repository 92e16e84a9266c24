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

import org.apache.logging.log4j.message.ParameterizedMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/// An in-memory implementation of {@link DiagnosticSink}.
///
/// Diagnostics are kept in emission order with their level and formatted text. This sink is
/// meant for a single run on a single thread and does no locking.
public class MemoryDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /// A diagnostic stored in memory
    public static class Diagnostic {
        private final Level level;
        private final String message;

        /// Creates a new Diagnostic.
        /// @param level The severity of the diagnostic
        /// @param message The formatted message
        public Diagnostic(Level level, String message) {
            this.level = level;
            this.message = message;
        }

        /// @return The severity of the diagnostic
        public Level getLevel() {
            return level;
        }

        /// @return The formatted message
        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return level + " " + message;
        }
    }

    @Override
    public void trace(String format, Object... args) {
        append(Level.TRACE, format, args);
    }

    @Override
    public void debug(String format, Object... args) {
        append(Level.DEBUG, format, args);
    }

    @Override
    public void info(String format, Object... args) {
        append(Level.INFO, format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        append(Level.WARN, format, args);
    }

    private void append(Level level, String format, Object... args) {
        diagnostics.add(new Diagnostic(level, ParameterizedMessage.format(format, args)));
    }

    /// @return all diagnostics in the order they were emitted
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /// Get the messages logged at exactly the given level.
    ///
    /// @param level The level to select
    /// @return the formatted messages, in emission order
    public List<String> messages(Level level) {
        return diagnostics.stream()
            .filter(d -> d.getLevel() == level)
            .map(Diagnostic::getMessage)
            .collect(Collectors.toList());
    }
}
