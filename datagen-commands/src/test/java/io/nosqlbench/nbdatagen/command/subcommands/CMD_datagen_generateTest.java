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

import io.nosqlbench.nbdatagen.api.config.Compression;
import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.command.CMD_datagen;
import io.nosqlbench.nbdatagen.command.config.GenerationConfigLoader;
import io.nosqlbench.nbdatagen.parquet.ArtifactNames;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodec;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodecs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_datagen_generateTest {

    @TempDir
    Path tempDir;

    @Test
    public void testGenerateWritesAllTables() throws IOException {
        Path out = tempDir.resolve("data");
        Result result = run(Map.of(), "-o", out.toString(), "-n", "200", "-p", "50",
            "--batch-size", "1000", "--interactions-per-customer", "10");

        assertThat(result.exitCode).as(result.err).isEqualTo(0);
        for (TableCodec<?> codec : TableCodecs.all()) {
            assertThat(ArtifactNames.completed(codec.table(), out.resolve(codec.table())))
                .as(codec.table()).isNotEmpty();
        }
        assertThat(result.out).containsPattern("customers\\s+single")
            .containsPattern("interactions\\s+batched")
            .contains("patterns")
            .contains("total rows");
    }

    @Test
    public void testUnwritableTableIsPartialSuccess() throws IOException {
        Path out = tempDir.resolve("partial");
        Files.createDirectories(out);
        Files.writeString(out.resolve("transactions"), "in the way");

        Result result = run(Map.of(), "-o", out.toString(), "-n", "100", "-p", "30",
            "--interactions-per-customer", "1");

        assertThat(result.exitCode).isEqualTo(1);
        assertThat(result.out).containsPattern("transactions\\s+failed")
            .containsPattern("customers\\s+single");
    }

    @Test
    public void testSameSeedProducesIdenticalFiles() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        String[] common = {"-n", "150", "-p", "40", "--batch-size", "500", "--seed", "11",
            "--interactions-per-customer", "2", "--compression", "gzip"};

        assertThat(run(Map.of(), concat(common, "-o", first.toString())).exitCode).isEqualTo(0);
        assertThat(run(Map.of(), concat(common, "-o", second.toString(), "--threads", "4")).exitCode).isEqualTo(0);

        List<Path> firstFiles = listFiles(first);
        assertThat(firstFiles).isEqualTo(listFiles(second));
        for (Path relative : firstFiles) {
            assertThat(Files.mismatch(first.resolve(relative), second.resolve(relative)))
                .as(relative.toString()).isEqualTo(-1L);
        }
    }

    @Test
    public void testRerunSkipsExistingTablesUnlessOverwriting() throws IOException {
        Path out = tempDir.resolve("rerun");
        String[] args = {"-o", out.toString(), "-n", "100", "-p", "30", "--interactions-per-customer", "1"};
        assertThat(run(Map.of(), args).exitCode).isEqualTo(0);

        Path customers = ArtifactNames.completed("customers", out.resolve("customers")).get(0);
        FileTime marker = FileTime.from(Instant.parse("2020-01-01T00:00:00Z"));
        Files.setLastModifiedTime(customers, marker);

        Result skipped = run(Map.of(), args);
        assertThat(skipped.exitCode).isEqualTo(0);
        assertThat(skipped.out).containsPattern("customers\\s+skipped")
            .containsPattern("transactions\\s+skipped");
        assertThat(Files.getLastModifiedTime(customers)).isEqualTo(marker);

        Result overwritten = run(Map.of(), concat(args, "--overwrite"));
        assertThat(overwritten.exitCode).isEqualTo(0);
        assertThat(overwritten.out).containsPattern("customers\\s+single");
        assertThat(Files.getLastModifiedTime(customers)).isNotEqualTo(marker);
    }

    @Test
    public void testOverwriteFromEnvironmentCanBeNegated() throws IOException {
        Path out = tempDir.resolve("negated");
        Map<String, String> env = Map.of(GenerationConfigLoader.OVERWRITE_EXISTING_DATA, "true");
        String[] args = {"-o", out.toString(), "-n", "100", "-p", "30", "--interactions-per-customer", "1"};
        assertThat(run(env, args).exitCode).isEqualTo(0);

        Result rerun = run(env, concat(args, "--no-overwrite"));
        assertThat(rerun.exitCode).isEqualTo(0);
        assertThat(rerun.out).containsPattern("products\\s+skipped");
    }

    @Test
    public void testCommandLineOverridesEnvironment() {
        Map<String, String> env = Map.of(
            GenerationConfigLoader.RANDOM_SEED, "7",
            GenerationConfigLoader.PARQUET_COMPRESSION, "gzip",
            GenerationConfigLoader.DATA_OUTPUT_DIR, "env-dir");

        CMD_datagen_generate fromEnv = new CMD_datagen_generate(env);
        new CommandLine(fromEnv).parseArgs("-n", "small");
        GenerationConfig envConfig = fromEnv.configuration();
        assertThat(envConfig.seed()).isEqualTo(7L);
        assertThat(envConfig.compression()).isEqualTo(Compression.GZIP);
        assertThat(envConfig.outputDirectory()).isEqualTo(Path.of("env-dir"));

        CMD_datagen_generate overridden = new CMD_datagen_generate(env);
        new CommandLine(overridden).parseArgs("-n", "1000", "--seed", "9", "--compression", "zstd",
            "-o", "cli-dir", "--retry-delay", "PT0.5S", "--as-of", "2024-01-01T00:00:00Z");
        GenerationConfig config = overridden.configuration();
        assertThat(config.customerCount()).isEqualTo(1000L);
        assertThat(config.seed()).isEqualTo(9L);
        assertThat(config.compression()).isEqualTo(Compression.ZSTD);
        assertThat(config.outputDirectory()).isEqualTo(Path.of("cli-dir"));
        assertThat(config.retry().delay()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.asOf()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    public void testConfigurationErrorsExitWithError() {
        Path out = tempDir.resolve("errors");
        assertThat(run(Map.of(), "-o", out.toString(), "--compression", "brotli").exitCode).isEqualTo(2);
        assertThat(run(Map.of(), "-o", out.toString(), "-n", "huge").exitCode).isEqualTo(2);
        assertThat(run(Map.of(), "-o", out.toString(), "-n", "100", "--batch-size", "0").exitCode).isEqualTo(2);
        assertThat(run(Map.of(), "-o", out.toString(), "-n", "100", "-v", "-q").exitCode).isEqualTo(2);
        assertThat(run(Map.of(GenerationConfigLoader.RANDOM_SEED, "abc"), "-o", out.toString()).exitCode)
            .isEqualTo(2);
        assertThat(out).doesNotExist();
    }

    @Test
    public void testConfigFileIsRead() throws IOException {
        Path out = tempDir.resolve("from-yaml");
        Path yaml = tempDir.resolve("datagen.yaml");
        Files.writeString(yaml, "customers: 80\nproducts: 20\ninteractionsPerCustomer: 1\n"
            + "outputDirectory: " + out + "\nincludeSeedPatterns: false\n");

        Result result = run(Map.of(), "-c", yaml.toString());
        assertThat(result.exitCode).as(result.err).isEqualTo(0);
        assertThat(out.resolve("customers")).isDirectory();
    }

    @Test
    public void testTopLevelCommandDispatchesToGenerate() {
        Path out = tempDir.resolve("top");
        StringWriter sw = new StringWriter();
        CommandLine cli = CMD_datagen.commandLine();
        cli.setOut(new PrintWriter(sw));
        int exitCode = cli.execute("generate", "-o", out.toString(), "-n", "60", "-p", "20",
            "--interactions-per-customer", "1");
        assertThat(exitCode).isEqualTo(0);
        assertThat(out.resolve("interactions")).isDirectory();
        assertThat(sw.toString()).contains("customers");
    }

    private static String[] concat(String[] head, String... tail) {
        return Stream.concat(Stream.of(head), Stream.of(tail)).toArray(String[]::new);
    }

    private static List<Path> listFiles(Path root) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).map(root::relativize).sorted().collect(Collectors.toList());
        }
    }

    private static Result run(Map<String, String> env, String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cli = new CommandLine(new CMD_datagen_generate(env))
            .setCaseInsensitiveEnumValuesAllowed(true);
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        int exitCode = cli.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    private record Result(int exitCode, String out, String err) {
    }
}
