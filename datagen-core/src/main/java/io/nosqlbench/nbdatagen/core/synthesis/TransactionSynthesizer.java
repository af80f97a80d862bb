package io.nosqlbench.nbdatagen.core.synthesis;

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


import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Channel;
import io.nosqlbench.nbdatagen.api.model.Money;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.model.Transaction;
import io.nosqlbench.nbdatagen.api.model.TransactionStatus;
import io.nosqlbench.nbdatagen.api.random.DeterministicIds;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.api.random.StreamKind;
import io.nosqlbench.nbdatagen.core.CatalogIndex;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import io.nosqlbench.nbdatagen.core.GenerationContext;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.DiscreteSampler;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/// Bulk purchase history for the whole customer population.
///
/// # Per customer
///
/// 1. The purchase count is Poisson distributed around the segment's purchase frequency. A
///    VIP or Premium customer is instead a low engagement customer with the configured
///    probability and makes 1 or 2 purchases. Reserved customers make none.
/// 2. Each purchase picks a product through [ProductSelector], a recency biased timestamp,
///    an amount of price times segment multiplier times a jitter in `[0.7, 1.3)`, a quantity
///    of 1 to 3, a channel and a status (90% completed).
/// 3. With 30% probability a purchase gets a basket companion: another product of the same
///    category, same brand preferred, 0 to 7 days later.
/// 4. With 40% probability a purchase gets a cross category companion from an affinity
///    linked category the customer does not exclude, 5 to 120 minutes later on the same
///    channel.
///
/// Companions follow their purchase directly in the output. At most one customer's rows are
/// buffered at a time.
public class TransactionSynthesizer {

  /// Probability that a purchase gets a basket companion
  public static final double BASKET_PROBABILITY = 0.30d;
  /// Probability that a purchase gets a cross category companion
  public static final double CROSS_CATEGORY_PROBABILITY = 0.40d;
  /// Probability that a bulk purchase is completed rather than cancelled
  public static final double COMPLETED_PROBABILITY = 0.90d;

  private final GenerationContext context;

  /// @param context the run context
  public TransactionSynthesizer(GenerationContext context) {
    this.context = context;
  }

  /// @return the restartable transaction sequence over the full population
  public Iterable<Transaction> transactions() {
    return transactions(context.population());
  }

  /// @param customers the customers to synthesize purchases for, in output order
  /// @return a restartable transaction sequence
  public Iterable<Transaction> transactions(Iterable<CustomerProfile> customers) {
    return () -> new TransactionIterator(customers.iterator());
  }

  private final class TransactionIterator implements Iterator<Transaction> {
    private final UniformRandomProvider rng = context.streams().stream(StreamKind.TRANSACTIONS);
    private final ProductSelector selector = new ProductSelector(context.catalog());
    private final RecencyTimestampSampler recency = new RecencyTimestampSampler(rng, context.config().asOf());
    private final EnumMap<Segment, DiscreteSampler> counts = new EnumMap<>(Segment.class);
    private final ArrayDeque<Transaction> buffer = new ArrayDeque<>();
    private final Iterator<CustomerProfile> customers;
    private final CatalogIndex catalog = context.catalog();
    private final Set<String> reserved = context.reservedCustomerIds();
    private final Instant asOf = context.config().asOf();
    private final double lowEngagement = context.config().lowEngagementProbability();

    private TransactionIterator(Iterator<CustomerProfile> customers) {
      this.customers = customers;
      for (Segment segment : Segment.values()) {
        counts.put(segment, PoissonSampler.of(rng, segment.purchaseFrequency()));
      }
    }

    @Override
    public boolean hasNext() {
      while (buffer.isEmpty() && customers.hasNext()) {
        synthesize(customers.next());
      }
      return !buffer.isEmpty();
    }

    @Override
    public Transaction next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return buffer.removeFirst();
    }

    private void synthesize(CustomerProfile profile) {
      if (reserved.contains(profile.customerId())) {
        return;
      }
      Segment segment = profile.customer().segment();
      int count;
      if (segment.isHighValue() && rng.nextDouble() < lowEngagement) {
        count = RandomGenerators.nextIntBetween(rng, 1, 2);
      } else {
        count = counts.get(segment).sample();
      }
      for (int i = 0; i < count; i++) {
        purchase(profile, segment);
      }
    }

    private void purchase(CustomerProfile profile, Segment segment) {
      String id = DeterministicIds.next(rng);
      Product product = selector.select(profile, rng);
      Instant timestamp = recency.sample();
      double jitter = RandomGenerators.nextDoubleBetween(rng, 0.7d, 1.3d);
      BigDecimal amount = Money.times(product.price(), segment.amountMultiplier() * jitter);
      int quantity = RandomGenerators.nextIntBetween(rng, 1, 3);
      Channel channel = RandomGenerators.pick(Channel.values(), rng);
      TransactionStatus status = rng.nextDouble() < COMPLETED_PROBABILITY
          ? TransactionStatus.COMPLETED : TransactionStatus.CANCELLED;
      buffer.addLast(new Transaction(id, profile.customerId(), product.productId(), amount, quantity,
          timestamp, channel, status));

      if (rng.nextDouble() < BASKET_PROBABILITY) {
        basket(profile, segment, product, timestamp);
      }
      if (rng.nextDouble() < CROSS_CATEGORY_PROBABILITY) {
        crossCategory(profile, segment, product, timestamp, channel);
      }
    }

    private void basket(CustomerProfile profile, Segment segment, Product product, Instant timestamp) {
      Product companion = selector.basketCompanion(profile, product, rng);
      if (companion == null) {
        return;
      }
      Instant when = RecencyTimestampSampler.clamp(
          timestamp.plus(rng.nextInt(8), ChronoUnit.DAYS), asOf);
      buffer.addLast(new Transaction(DeterministicIds.next(rng), profile.customerId(), companion.productId(),
          Money.times(companion.price(), segment.amountMultiplier()), 1, when,
          RandomGenerators.pick(Channel.values(), rng), TransactionStatus.COMPLETED));
    }

    private void crossCategory(CustomerProfile profile, Segment segment, Product product, Instant timestamp,
                               Channel channel) {
      List<Category> linked = product.category().affinityCategories();
      if (linked.isEmpty()) {
        return;
      }
      Category category = RandomGenerators.pick(linked, rng);
      List<Product> pool = catalog.byCategory(category);
      if (profile.excludes(category) || pool.isEmpty()) {
        return;
      }
      Product companion = RandomGenerators.pick(pool, rng);
      Instant when = RecencyTimestampSampler.clamp(
          timestamp.plus(RandomGenerators.nextIntBetween(rng, 5, 120), ChronoUnit.MINUTES), asOf);
      buffer.addLast(new Transaction(DeterministicIds.next(rng), profile.customerId(), companion.productId(),
          Money.times(companion.price(), segment.amountMultiplier()), 1, when, channel,
          TransactionStatus.COMPLETED));
    }
  }
}
