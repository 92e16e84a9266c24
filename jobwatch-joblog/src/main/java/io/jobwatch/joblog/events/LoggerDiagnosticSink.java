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

import io.jobwatch.joblog.JobEventCorrelator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// A {@link DiagnosticSink} which forwards every diagnostic to a Log4j 2 logger.
///
/// Appenders, layout and level filtering are whatever the Log4j configuration says.
public class LoggerDiagnosticSink implements DiagnosticSink {

    /// Logger name used when none is given.
    public static final String DEFAULT_LOGGER_NAME = JobEventCorrelator.class.getName();

    private final Logger logger;

    /// Create a sink on the default correlator logger.
    public LoggerDiagnosticSink() {
        this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
    }

    /// Create a sink on an existing logger.
    /// @param logger the logger to forward to
    public LoggerDiagnosticSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void trace(String format, Object... args) {
        logger.trace(format, args);
    }

    @Override
    public void debug(String format, Object... args) {
        logger.debug(format, args);
    }

    @Override
    public void info(String format, Object... args) {
        logger.info(format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        logger.warn(format, args);
    }
}
