package io.nosqlbench.nbdatagen.command.verify;

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

import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Channel;
import io.nosqlbench.nbdatagen.api.model.Customer;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.model.Transaction;
import io.nosqlbench.nbdatagen.api.model.TransactionStatus;
import io.nosqlbench.nbdatagen.parquet.BatchWriter;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodecs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ArtifactVerifierTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T00:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    public void testFactIdsAreCheckedPerArtifactAndDimensionIdsPerTable() {
        GenerationConfig config = GenerationConfig.builder()
            .customers(100).products(1).batchSize(2).outputDirectory(tempDir).build();

        // three customers over two artifacts, c-1 repeated across them
        BatchWriter.of(config, TableCodecs.CUSTOMERS).write(List.of(customer("c-1"), customer("c-2"), customer("c-1")));
        BatchWriter.of(config, TableCodecs.PRODUCTS).write(List.of(new Product("p-1", "Lamp", Category.HOME,
            "IKEA", new BigDecimal("49.99"), LocalDate.of(2022, 1, 1), CREATED)));
        // artifact 0 holds t-1 and t-2, artifact 1 holds t-1 twice
        BatchWriter.of(config, TableCodecs.TRANSACTIONS).write(List.of(
            transaction("t-1"), transaction("t-2"), transaction("t-1"), transaction("t-1")));
        BatchWriter.of(config, TableCodecs.INTERACTIONS).write(List.<Interaction>of());

        VerificationReport report = new ArtifactVerifier(tempDir).verify();

        assertThat(report.artifactCounts()).containsEntry("customers", 2).containsEntry("transactions", 2);
        assertThat(report.rowCounts()).containsEntry("transactions", 4L);
        assertThat(report.duplicateIds()).isEqualTo(2L);
        assertThat(report.danglingCustomers()).isZero();
        assertThat(report.isValid()).isFalse();
    }

    @Test
    public void testRepeatedFactIdsInSeparateArtifactsPass() {
        GenerationConfig config = GenerationConfig.builder()
            .customers(100).products(1).batchSize(1).outputDirectory(tempDir).build();

        BatchWriter.of(config, TableCodecs.CUSTOMERS).write(List.of(customer("c-1")));
        BatchWriter.of(config, TableCodecs.PRODUCTS).write(List.of(new Product("p-1", "Lamp", Category.HOME,
            "IKEA", new BigDecimal("49.99"), LocalDate.of(2022, 1, 1), CREATED)));
        BatchWriter.of(config, TableCodecs.TRANSACTIONS).write(List.of(transaction("t-1"), transaction("t-1")));
        BatchWriter.of(config, TableCodecs.INTERACTIONS).write(List.<Interaction>of());

        VerificationReport report = new ArtifactVerifier(tempDir).verify();

        assertThat(report.artifactCounts()).containsEntry("transactions", 2);
        assertThat(report.duplicateIds()).isZero();
        assertThat(report.isValid()).isTrue();
    }

    private static Customer customer(String id) {
        return new Customer(id, id + "@example.com", "Casey " + id, Segment.STANDARD, new BigDecimal("1500.00"),
            LocalDate.of(2023, 5, 1), CREATED);
    }

    private static Transaction transaction(String id) {
        return new Transaction(id, "c-1", "p-1", new BigDecimal("49.99"), 1, CREATED, Channel.WEB,
            TransactionStatus.COMPLETED);
    }
}
