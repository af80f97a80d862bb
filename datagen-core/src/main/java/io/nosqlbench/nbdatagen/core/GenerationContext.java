package io.nosqlbench.nbdatagen.core;

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
import io.nosqlbench.nbdatagen.api.iteration.FlatteningIterable;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.random.RandomStreams;
import io.nosqlbench.nbdatagen.api.random.StreamKind;
import io.nosqlbench.nbdatagen.core.entities.EntityGenerator;
import io.nosqlbench.nbdatagen.core.patterns.PatternInjector;
import io.nosqlbench.nbdatagen.core.seed.SeedCatalog;
import io.nosqlbench.nbdatagen.core.seed.SeedProductSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Immutable state shared by the generation stages of one run: the configuration, the seed
/// catalog, the bulk entity generator, the product index and the customers reserved by
/// patterns. Stages read it and never modify it.
public final class GenerationContext {
  private static final Logger logger = LogManager.getLogger(GenerationContext.class);

  private final GenerationConfig config;
  private final RandomStreams streams;
  private final SeedCatalog seedCatalog;
  private final EntityGenerator entities;
  private final CatalogIndex catalog;
  private final Set<String> reservedCustomerIds;

  private GenerationContext(GenerationConfig config, RandomStreams streams, SeedCatalog seedCatalog,
                            EntityGenerator entities, CatalogIndex catalog,
                            Set<String> reservedCustomerIds) {
    this.config = config;
    this.streams = streams;
    this.seedCatalog = seedCatalog;
    this.entities = entities;
    this.catalog = catalog;
    this.reservedCustomerIds = reservedCustomerIds;
  }

  /// Build the seed catalog and the product catalog for a configuration. Customers stay lazy.
  /// @param config the validated configuration
  /// @return the context
  public static GenerationContext prepare(GenerationConfig config) {
    RandomStreams streams = config.randomStreams();
    SeedCatalog seeds = config.includeSeedPatterns()
        ? SeedCatalog.build(config.seedCustomersPerSegment(), SeedProductSpec.defaults(),
        streams.stream(StreamKind.SEED_CATALOG), config.asOf())
        : SeedCatalog.empty();

    EntityGenerator entities = new EntityGenerator(config, streams);
    List<Product> bulkProducts = List.copyOf(entities.products());

    List<Product> allProducts = new ArrayList<>(seeds.allProducts().size() + bulkProducts.size());
    allProducts.addAll(seeds.allProducts());
    allProducts.addAll(bulkProducts);
    CatalogIndex catalog = CatalogIndex.of(allProducts);

    Set<String> reserved = PatternInjector.reservedCustomerIds(seeds);
    logger.debug("Prepared context: {} catalog products, {} reserved customers", catalog.size(), reserved.size());
    return new GenerationContext(config, streams, seeds, entities, catalog, reserved);
  }

  public GenerationConfig config() {
    return config;
  }

  public RandomStreams streams() {
    return streams;
  }

  public SeedCatalog seedCatalog() {
    return seedCatalog;
  }

  public EntityGenerator entities() {
    return entities;
  }

  /// @return the index over seed and bulk products
  public CatalogIndex catalog() {
    return catalog;
  }

  /// @return customers that bulk synthesis must leave without transactions
  public Set<String> reservedCustomerIds() {
    return reservedCustomerIds;
  }

  /// @return seed customers followed by the bulk population, restartable
  public Iterable<CustomerProfile> population() {
    return FlatteningIterable.concat(seedCatalog.allCustomers(), entities.customers());
  }

  /// @return total number of customer rows, seed and bulk
  public long populationSize() {
    return seedCatalog.allCustomers().size() + entities.customerCount();
  }
}
