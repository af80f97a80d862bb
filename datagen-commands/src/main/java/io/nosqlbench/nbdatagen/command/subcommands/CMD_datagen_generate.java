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


import io.nosqlbench.nbdatagen.api.config.ConfigurationException;
import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.command.common.BatchProcessingOption;
import io.nosqlbench.nbdatagen.command.common.RandomSeedOption;
import io.nosqlbench.nbdatagen.command.common.VerbosityOption;
import io.nosqlbench.nbdatagen.command.config.GenerationConfigLoader;
import io.nosqlbench.nbdatagen.command.run.GenerationRun;
import io.nosqlbench.nbdatagen.command.run.RunReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;

/// Generate the customers, products, transactions and interactions tables.
///
/// Settings are layered: defaults, then `--config`, then environment variables, then the
/// options given here.
@CommandLine.Command(name = "generate",
    description = "Generate a deterministic, pattern-seeded relational dataset as batched Parquet",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:some batches failed", "2:error"})
public class CMD_datagen_generate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_datagen_generate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_PARTIAL = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-c", "--config"}, description = "YAML file with generation settings")
    private Path configFile;

    @CommandLine.Option(names = {"-n", "--customers"},
        description = "Bulk customer count, or a scale tier (small, medium, large)")
    private String customers;

    @CommandLine.Option(names = {"-p", "--products"}, description = "Bulk product count (default: per scale tier)")
    private Integer products;

    @CommandLine.Option(names = {"-o", "--output-dir"}, description = "Output directory (default: data)")
    private Path outputDirectory;

    @CommandLine.Option(names = {"--compression"},
        description = "Parquet codec: snappy, gzip, lz4, zstd or uncompressed (default: snappy)")
    private String compression;

    @CommandLine.Option(names = {"--overwrite"}, negatable = true,
        description = "Replace tables that already have completed artifacts (default: false)")
    private Boolean overwrite;

    @CommandLine.Option(names = {"--seed-patterns"}, negatable = true,
        description = "Place the seed customers, products and patterns (default: true)")
    private Boolean seedPatterns;

    @CommandLine.Option(names = {"--as-of"},
        description = "Reference instant all timestamps lie before, ISO-8601 (default: 2025-01-01T00:00:00Z)")
    private Instant asOf;

    @CommandLine.Option(names = {"--interactions-per-customer"},
        description = "Interactions per bulk customer (default: 25)")
    private Integer interactionsPerCustomer;

    @CommandLine.Option(names = {"--retry-attempts"}, description = "Attempts per batch write (default: 3)")
    private Integer retryAttempts;

    @CommandLine.Option(names = {"--retry-delay"},
        description = "Pause between attempts as an ISO-8601 duration (default: PT5S)")
    private Duration retryDelay;

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private BatchProcessingOption batchOption = new BatchProcessingOption();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Map<String, String> environment;

    public CMD_datagen_generate() {
        this(System.getenv());
    }

    /// @param environment the environment variables to read settings from
    public CMD_datagen_generate(Map<String, String> environment) {
        this.environment = environment;
    }

    /// Build the configuration from every layer.
    /// @return the validated configuration
    /// @throws ConfigurationException for any invalid setting
    GenerationConfig configuration() {
        GenerationConfig.Builder builder = new GenerationConfigLoader(environment).load(configFile);
        if (customers != null) {
            GenerationConfigLoader.applyCustomerScale(builder, customers);
        }
        if (products != null) {
            builder.products(products);
        }
        if (seedOption.isSeedSpecified()) {
            builder.seed(seedOption.getSeedRecord().orElse(RandomSeedOption.DEFAULT_SEED));
        }
        if (outputDirectory != null) {
            builder.outputDirectory(outputDirectory.normalize());
        }
        if (compression != null) {
            builder.compression(compression);
        }
        if (overwrite != null) {
            builder.overwrite(overwrite);
        }
        if (seedPatterns != null) {
            builder.includeSeedPatterns(seedPatterns);
        }
        if (asOf != null) {
            builder.asOf(asOf);
        }
        if (interactionsPerCustomer != null) {
            builder.interactionsPerCustomer(interactionsPerCustomer);
        }
        if (retryAttempts != null) {
            builder.retryAttempts(retryAttempts);
        }
        if (retryDelay != null) {
            builder.retryDelay(retryDelay);
        }
        try {
            batchOption.getBatchConfig().applyTo(builder);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return builder.build();
    }

    @Override
    public Integer call() {
        try {
            verbosity.validate();
        } catch (IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        verbosity.apply();

        GenerationConfig config;
        try {
            config = configuration();
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        try {
            RunReport report = new GenerationRun(config).execute();
            if (verbosity.showNormalOutput()) {
                spec.commandLine().getOut().print(report.summary());
                spec.commandLine().getOut().flush();
            }
            if (report.hasFailures()) {
                logger.warn("Some batches could not be written; rerun with --overwrite to fill the gaps");
                return EXIT_PARTIAL;
            }
            return EXIT_SUCCESS;
        } catch (RuntimeException e) {
            logger.error("Generation failed: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
