package io.jobwatch.api.services;

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

/// Marker for command line commands which are discovered at runtime.
///
/// Implementations must also carry a picocli `@CommandLine.Command` annotation, since the
/// command name is taken from there when the command is attached to the launcher. They are
/// registered in `META-INF/services/io.jobwatch.api.services.BundledCommand`.
public interface BundledCommand {
}
