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


import io.nosqlbench.nbdatagen.api.model.Device;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.InteractionType;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.random.DeterministicIds;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.api.random.StreamKind;
import io.nosqlbench.nbdatagen.core.GenerationContext;
import io.nosqlbench.nbdatagen.core.entities.EntityGenerator;
import org.apache.commons.rng.UniformRandomProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/// Behavioral interactions of bulk customers: `interactionsPerCustomer` times the bulk
/// customer count, each for a uniformly chosen customer and product within the last six
/// months. Customer ids are computed from the sampled index, so the population is never
/// iterated.
public class InteractionSynthesizer {

  /// How far back interactions reach
  public static final Duration WINDOW = Duration.ofDays(182);
  public static final int MIN_DURATION_SECONDS = 10;
  public static final int MAX_DURATION_SECONDS = 300;

  private final GenerationContext context;

  /// @param context the run context
  public InteractionSynthesizer(GenerationContext context) {
    this.context = context;
  }

  /// @return the number of interactions the sequence yields
  public long count() {
    return context.config().interactionsPerCustomer() * context.entities().customerCount();
  }

  /// @return the restartable interaction sequence
  public Iterable<Interaction> interactions() {
    return InteractionIterator::new;
  }

  /// Draw one interaction of a known customer.
  /// @param rng the stream to draw from
  /// @param customerId the customer
  /// @param products the products to choose from
  /// @param asOf the reference instant
  /// @return the interaction
  public static Interaction draw(UniformRandomProvider rng, String customerId, List<Product> products,
                                 Instant asOf) {
    String id = DeterministicIds.next(rng);
    Product product = RandomGenerators.pick(products, rng);
    InteractionType type = RandomGenerators.pick(InteractionType.values(), rng);
    Instant timestamp = RecencyTimestampSampler.within(rng, asOf, WINDOW);
    int duration = RandomGenerators.nextIntBetween(rng, MIN_DURATION_SECONDS, MAX_DURATION_SECONDS);
    Device device = RandomGenerators.pick(Device.values(), rng);
    return new Interaction(id, customerId, product.productId(), type, timestamp, duration, device,
        DeterministicIds.next(rng));
  }

  private final class InteractionIterator implements Iterator<Interaction> {
    private final UniformRandomProvider rng = context.streams().stream(StreamKind.INTERACTIONS);
    private final EntityGenerator entities = context.entities();
    private final List<Product> products = context.catalog().all();
    private final Instant asOf = context.config().asOf();
    private final long total = count();
    private long emitted = 0L;

    @Override
    public boolean hasNext() {
      return emitted < total;
    }

    @Override
    public Interaction next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      long index = rng.nextLong(entities.customerCount());
      emitted++;
      return draw(rng, entities.customerId(index), products, asOf);
    }
  }
}
