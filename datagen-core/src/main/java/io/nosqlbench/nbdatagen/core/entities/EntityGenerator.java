package io.nosqlbench.nbdatagen.core.entities;

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


import io.nosqlbench.nbdatagen.api.config.CategoricalWeights;
import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Customer;
import io.nosqlbench.nbdatagen.api.model.Money;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.random.DeterministicIds;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.api.random.RandomStreams;
import io.nosqlbench.nbdatagen.api.random.StreamKind;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import net.datafaker.Faker;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.DiscreteSampler;
import org.apache.commons.rng.sampling.distribution.GuideTableDiscreteSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Set;

/// Bulk customers and products.
///
/// # Customers
///
/// The customer population is never materialized. [#customers()] is a restartable lazy
/// sequence: every iterator re-creates the customer stream and the name faker from the
/// stream seed, so each pass yields the same rows in the same order. The id of the customer
/// at any index is available from [#customerId(long)] without iterating.
///
/// Per customer, in order, the stream supplies the segment, ltv, brand affinity and the
/// category exclusion. Names and emails come from datafaker seeded with the same stream seed.
///
/// # Products
///
/// The catalog is small enough to materialize; [#products()] returns it as a list.
public class EntityGenerator {
  private static final Logger logger = LogManager.getLogger(EntityGenerator.class);

  /// Probability that a bulk customer prefers a brand
  public static final double AFFINITY_PROBABILITY = 0.30d;
  /// Probability that a VIP or Premium bulk customer never buys Electronics
  public static final double EXCLUSION_PROBABILITY = 0.20d;
  /// Brands preferred by VIP and Premium customers
  public static final List<String> HIGH_VALUE_BRANDS = List.of("Apple", "Sony", "Nike", "Samsung");
  /// Brands preferred by everyone else
  public static final List<String> VALUE_BRANDS = List.of("HP", "Dell", "Gap", "Adidas");

  private static final long CUSTOMER_SALT = 1L;
  private static final long PRODUCT_SALT = 2L;
  private static final int COHORTS = 12;
  private static final int LAUNCH_WINDOW_DAYS = 3 * 365;

  private final long customerCount;
  private final int productCount;
  private final CategoricalWeights<Segment> segmentWeights;
  private final CategoricalWeights<Category> categoryWeights;
  private final RandomStreams streams;
  private final Instant asOf;

  /// @param config the run configuration
  public EntityGenerator(GenerationConfig config) {
    this(config, config.randomStreams());
  }

  /// @param config the run configuration
  /// @param streams the random streams of the run
  public EntityGenerator(GenerationConfig config, RandomStreams streams) {
    this.customerCount = config.bulkCustomerCount();
    this.productCount = config.productCount();
    this.segmentWeights = config.segmentWeights();
    this.categoryWeights = config.categoryWeights();
    this.streams = streams;
    this.asOf = config.asOf();
  }

  /// @return the number of bulk customers
  public long customerCount() {
    return customerCount;
  }

  /// @param index a bulk customer index in `[0, customerCount)`
  /// @return the id of that customer
  public String customerId(long index) {
    if (index < 0 || index >= customerCount) {
      throw new IndexOutOfBoundsException("Customer index " + index + " outside [0," + customerCount + ")");
    }
    return DeterministicIds.indexed(streams.seedOf(StreamKind.CUSTOMERS), CUSTOMER_SALT, index);
  }

  /// @return the lazy, restartable bulk customer population
  public Iterable<CustomerProfile> customers() {
    return CustomerIterator::new;
  }

  /// Generate the bulk product catalog.
  /// @return the products in generation order
  public List<Product> products() {
    UniformRandomProvider rng = streams.stream(StreamKind.PRODUCTS);
    DiscreteSampler categories = GuideTableDiscreteSampler.of(rng, categoryWeights.probabilities());
    long seed = streams.seedOf(StreamKind.PRODUCTS);
    LocalDate today = asOf.atZone(ZoneOffset.UTC).toLocalDate();

    List<Product> products = new ArrayList<>(productCount);
    for (int i = 0; i < productCount; i++) {
      Category category = categoryWeights.constant(categories.sample());
      String brand = RandomGenerators.pick(category.brands(), rng);
      products.add(new Product(
          DeterministicIds.indexed(seed, PRODUCT_SALT, i),
          brand + " " + category.label() + " Product " + (i + 1),
          category,
          brand,
          Money.of(RandomGenerators.nextDoubleBetween(rng, category.minPrice(), category.maxPrice())),
          today.minusDays(rng.nextInt(LAUNCH_WINDOW_DAYS + 1)),
          asOf));
    }
    logger.info("Generated {} bulk products", products.size());
    return products;
  }

  /// Customers are spread over twelve monthly registration cohorts.
  /// @param index the bulk customer index
  /// @return the registration date of that customer
  LocalDate registrationDate(long index) {
    int cohort = (int) (index % COHORTS);
    return asOf.atZone(ZoneOffset.UTC).toLocalDate().minusDays(365L - 30L * cohort);
  }

  private final class CustomerIterator implements Iterator<CustomerProfile> {
    private final UniformRandomProvider rng = streams.stream(StreamKind.CUSTOMERS);
    private final DiscreteSampler segments = GuideTableDiscreteSampler.of(rng, segmentWeights.probabilities());
    private final Faker faker = new Faker(Locale.ENGLISH, new Random(streams.seedOf(StreamKind.CUSTOMERS)));
    private final long seed = streams.seedOf(StreamKind.CUSTOMERS);
    private long index = 0L;

    @Override
    public boolean hasNext() {
      return index < customerCount;
    }

    @Override
    public CustomerProfile next() {
      if (!hasNext()) {
        throw new NoSuchElementException("All " + customerCount + " customers generated");
      }
      Segment segment = segmentWeights.constant(segments.sample());
      double ltv = RandomGenerators.nextDoubleBetween(rng, segment.minLtv(), segment.maxLtv());

      String affinity = null;
      if (rng.nextDouble() < AFFINITY_PROBABILITY) {
        affinity = RandomGenerators.pick(segment.isHighValue() ? HIGH_VALUE_BRANDS : VALUE_BRANDS, rng);
      }
      Set<Category> exclusions = Set.of();
      if (segment.isHighValue() && rng.nextDouble() < EXCLUSION_PROBABILITY) {
        exclusions = EnumSet.of(Category.ELECTRONICS);
      }

      Customer customer = new Customer(
          DeterministicIds.indexed(seed, CUSTOMER_SALT, index),
          faker.internet().emailAddress(),
          faker.name().fullName(),
          segment,
          Money.of(ltv),
          registrationDate(index),
          asOf);
      index++;
      return new CustomerProfile(customer, affinity, exclusions);
    }
  }
}
