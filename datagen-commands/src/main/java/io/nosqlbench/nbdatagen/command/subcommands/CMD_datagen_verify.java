package io.nosqlbench.nbdatagen.command.subcommands;

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


import io.nosqlbench.nbdatagen.command.common.VerbosityOption;
import io.nosqlbench.nbdatagen.command.verify.ArtifactVerifier;
import io.nosqlbench.nbdatagen.command.verify.VerificationReport;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodec;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodecs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/// Read a generated dataset back and check row counts and references.
@CommandLine.Command(name = "verify",
    description = "Read all artifacts back and report row counts and dangling references",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:valid", "1:problems found", "2:error"})
public class CMD_datagen_verify implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_datagen_verify.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_INVALID = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-o", "--output-dir"}, description = "Directory holding the table directories",
        defaultValue = "data")
    private Path outputDirectory;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        verbosity.apply();
        if (!Files.isDirectory(outputDirectory)) {
            System.err.println("Error: Output directory does not exist: " + outputDirectory);
            return EXIT_ERROR;
        }
        try {
            VerificationReport report = new ArtifactVerifier(outputDirectory).verify();
            if (verbosity.showNormalOutput()) {
                List<String> tables = TableCodecs.all().stream().map(TableCodec::table).collect(Collectors.toList());
                spec.commandLine().getOut().print(report.summary(tables));
                spec.commandLine().getOut().flush();
            }
            return report.isValid() ? EXIT_SUCCESS : EXIT_INVALID;
        } catch (RuntimeException e) {
            logger.error("Verification failed: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
