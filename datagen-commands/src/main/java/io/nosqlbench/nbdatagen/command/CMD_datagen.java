package io.nosqlbench.nbdatagen.command;

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


import io.nosqlbench.nbdatagen.command.subcommands.CMD_datagen_generate;
import io.nosqlbench.nbdatagen.command.subcommands.CMD_datagen_verify;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Generate and check synthetic customer, product, transaction and interaction data
///
/// - `generate`: write the four tables as batched Parquet under the output directory
/// - `verify`: read them back and check row counts and referential integrity
///
/// The same seed and settings always produce byte-identical artifacts.
@CommandLine.Command(name = "datagen",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    optionListHeading = "%nOptions:%n",
    header = "Deterministic, pattern-seeded relational test data",
    description = "Generates customers, products, transactions and interactions with\n" +
        "planted behavioral patterns (brand loyalty, recommendation chains, churn\n" +
        "risk and others) for exercising analytical queries, and verifies the\n" +
        "written artifacts.",
    mixinStandardHelpOptions = true,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:warning", "2:error"},
    subcommands = {CMD_datagen_generate.class, CMD_datagen_verify.class, CommandLine.HelpCommand.class})
public class CMD_datagen {

  /// Create the top level command
  public CMD_datagen() {
  }

  /// @return a command line for this command with the usual parser settings
  public static CommandLine commandLine() {
    return new CommandLine(new CMD_datagen())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
  }

  /// Run a datagen command
  /// @param args command line arguments
  public static void main(String[] args) {
    Logger logger = LogManager.getLogger(CMD_datagen.class);
    int exitCode = commandLine().execute(args);
    logger.debug("Exiting main with code: {}", exitCode);
    System.exit(exitCode);
  }
}
