package io.jobwatch.commands;

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

import picocli.CommandLine;

/// Tools for auditing batch job logs
///
/// This is the top level command which serves as an entry point for all sub-commands. Commands
/// are found on the classpath as {@link io.jobwatch.api.services.BundledCommand} services.
@CommandLine.Command(name = "jobwatch",
    header = "Tools for auditing batch job logs",
    subcommands = {CommandLine.HelpCommand.class},
    modelTransformer = AddBundledCommands.class)
public class CMD_jobwatch implements Runnable {

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  /// run a jobwatch command
  /// @param args
  ///     command line args
  public static void main(String[] args) {
    System.exit(newCommandLine().execute(args));
  }

  /// @return a command line for the launcher with all bundled commands attached
  public static CommandLine newCommandLine() {
    return new CommandLine(new CMD_jobwatch())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
  }

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }
}
