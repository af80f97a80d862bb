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


import io.nosqlbench.nbdatagen.api.model.Customer;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Transaction;
import io.nosqlbench.nbdatagen.parquet.BatchArtifactReader;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodec;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodecs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/// Reads a generated dataset back and checks it: every table present, identifiers unique,
/// and every transaction and interaction referring to an existing customer and product.
///
/// Customer and product identifiers are held in memory while the fact tables stream past,
/// and are checked for uniqueness over the whole table. Transaction and interaction
/// identifiers are only checked within each artifact, so memory stays bounded by the batch
/// size however large those tables grow. Each instance verifies once.
public class ArtifactVerifier {

  private static final Logger logger = LogManager.getLogger(ArtifactVerifier.class);

  private final Path outputRoot;
  private final Map<String, Long> rowCounts = new LinkedHashMap<>();
  private final Map<String, Integer> artifactCounts = new LinkedHashMap<>();
  private final List<String> missing = new ArrayList<>();
  private long duplicates;
  private long danglingCustomers;
  private long danglingProducts;

  /// @param outputRoot the directory holding the table directories
  public ArtifactVerifier(Path outputRoot) {
    this.outputRoot = outputRoot;
  }

  /// @return the findings
  /// @throws java.io.UncheckedIOException if an artifact cannot be read
  public VerificationReport verify() {
    Set<String> customers = ids(TableCodecs.CUSTOMERS, Customer::customerId);
    Set<String> products = ids(TableCodecs.PRODUCTS, Product::productId);

    scan(TableCodecs.TRANSACTIONS, HashSet::new, Transaction::transactionId,
        t -> references(customers, products, t.customerId(), t.productId()));
    scan(TableCodecs.INTERACTIONS, HashSet::new, Interaction::interactionId,
        i -> references(customers, products, i.customerId(), i.productId()));

    VerificationReport report = new VerificationReport(rowCounts, artifactCounts, missing, duplicates,
        danglingCustomers, danglingProducts);
    if (report.isValid()) {
      logger.info("Verified {}: {}", outputRoot, rowCounts);
    } else {
      logger.warn("Verification of {} found problems: missing={}, duplicates={}, dangling customers={}, "
          + "dangling products={}", outputRoot, missing, duplicates, danglingCustomers, danglingProducts);
    }
    return report;
  }

  private <T> Set<String> ids(TableCodec<T> codec, Function<T, String> id) {
    Set<String> all = new HashSet<>();
    scan(codec, () -> all, id, row -> { });
    return all;
  }

  // uniqueness is checked against the set supplied for each artifact
  private <T> void scan(TableCodec<T> codec, Supplier<Set<String>> idsPerArtifact, Function<T, String> id,
                        Consumer<T> visitor) {
    BatchArtifactReader<T> reader = new BatchArtifactReader<>(codec, outputRoot);
    if (reader.artifacts().isEmpty()) {
      missing.add(codec.table());
      return;
    }
    long rows = 0L;
    for (Path artifact : reader.artifacts()) {
      Set<String> seen = idsPerArtifact.get();
      for (T row : reader.rows(artifact)) {
        check(seen, id.apply(row));
        visitor.accept(row);
        rows++;
      }
    }
    rowCounts.put(codec.table(), rows);
    artifactCounts.put(codec.table(), reader.artifacts().size());
    logger.debug("Read {} rows from {} artifacts of {}", rows, reader.artifacts().size(), codec.table());
  }

  private void check(Set<String> seen, String id) {
    if (!seen.add(id)) {
      duplicates++;
    }
  }

  private void references(Set<String> customers, Set<String> products, String customerId, String productId) {
    if (!customers.contains(customerId)) {
      danglingCustomers++;
    }
    if (!products.contains(productId)) {
      danglingProducts++;
    }
  }
}
