package io.nosqlbench.nbdatagen.api.config;

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
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.api.random.RandomStreams;
import io.nosqlbench.nbdatagen.api.random.StreamKind;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// Everything that determines the content and layout of a generated dataset.
///
/// # Overview
///
/// Two runs with equal configurations produce byte-identical artifacts. For that reason the
/// configuration carries a reference instant ([#asOf()]) that stands in for the wall clock:
/// every generated timestamp lies at or before it.
///
/// # Usage
///
/// ```java
/// GenerationConfig defaults = GenerationConfig.defaults();
///
/// GenerationConfig config = GenerationConfig.builder()
///     .customers(250_000)
///     .seed(7)
///     .batchSize(50_000)
///     .compression(Compression.ZSTD)
///     .outputDirectory(Path.of("out"))
///     .build();
/// ```
///
/// All validation happens in [Builder#build()], which throws [ConfigurationException].
public final class GenerationConfig {

  /// Default master seed
  public static final long DEFAULT_SEED = 42L;
  /// Default rows per chunk
  public static final int DEFAULT_BATCH_SIZE = 100_000;
  /// Default reference instant
  public static final Instant DEFAULT_AS_OF = Instant.parse("2025-01-01T00:00:00Z");
  /// Default probability that a high value customer is a low engagement customer
  public static final double DEFAULT_LOW_ENGAGEMENT_PROBABILITY = 0.10d;
  /// Default interactions generated per bulk customer
  public static final int DEFAULT_INTERACTIONS_PER_CUSTOMER = 25;
  /// Default number of recommendation chains
  public static final int DEFAULT_CHAIN_COUNT = 5;
  /// Default seed customers per segment
  public static final int DEFAULT_SEED_CUSTOMERS_PER_SEGMENT = 10;

  private final long customerCount;
  private final ScaleTier scaleTier;
  private final int productCount;
  private final long seed;
  private final Map<StreamKind, Long> seedOffsets;
  private final int batchSize;
  private final int singleFileThreshold;
  private final Compression compression;
  private final boolean overwrite;
  private final boolean includeSeedPatterns;
  private final Instant asOf;
  private final CategoricalWeights<Segment> segmentWeights;
  private final CategoricalWeights<Category> categoryWeights;
  private final double lowEngagementProbability;
  private final int interactionsPerCustomer;
  private final int chainCount;
  private final int seedCustomersPerSegment;
  private final RetrySettings retry;
  private final int threads;
  private final Path outputDirectory;

  private GenerationConfig(Builder builder, ScaleTier scaleTier, int productCount, int singleFileThreshold) {
    this.customerCount = builder.customerCount;
    this.scaleTier = scaleTier;
    this.productCount = productCount;
    this.seed = builder.seed;
    this.seedOffsets = Collections.unmodifiableMap(new EnumMap<>(builder.seedOffsets));
    this.batchSize = builder.batchSize;
    this.singleFileThreshold = singleFileThreshold;
    this.compression = builder.compression;
    this.overwrite = builder.overwrite;
    this.includeSeedPatterns = builder.includeSeedPatterns;
    this.asOf = builder.asOf;
    this.segmentWeights = builder.segmentWeights;
    this.categoryWeights = builder.categoryWeights;
    this.lowEngagementProbability = builder.lowEngagementProbability;
    this.interactionsPerCustomer = builder.interactionsPerCustomer;
    this.chainCount = builder.chainCount;
    this.seedCustomersPerSegment = builder.seedCustomersPerSegment;
    this.retry = new RetrySettings(builder.retryAttempts, builder.retryDelay);
    this.threads = builder.threads;
    this.outputDirectory = builder.outputDirectory;
  }

  /// Number of customer rows in the run, seed customers included.
  /// @return the total customer count
  public long customerCount() {
    return customerCount;
  }

  /// @return the number of seed customers, zero when seed patterns are off
  public long seedCustomerCount() {
    return includeSeedPatterns ? (long) seedCustomersPerSegment * Segment.values().length : 0L;
  }

  /// Customers generated in bulk: the total count less the seed customers.
  /// @return the bulk customer count
  public long bulkCustomerCount() {
    return customerCount - seedCustomerCount();
  }

  /// @return the tier derived from the customer count
  public ScaleTier scaleTier() {
    return scaleTier;
  }

  /// Number of bulk products, not counting seed products. Defaults to the tier's catalog size.
  /// @return the bulk product count
  public int productCount() {
    return productCount;
  }

  public long seed() {
    return seed;
  }

  /// @return configured stream offsets; streams not present use [StreamKind#defaultOffset()]
  public Map<StreamKind, Long> seedOffsets() {
    return seedOffsets;
  }

  public int batchSize() {
    return batchSize;
  }

  /// Tables with fewer rows than this are written as one unpartitioned artifact.
  /// @return the threshold, which defaults to the batch size
  public int singleFileThreshold() {
    return singleFileThreshold;
  }

  public Compression compression() {
    return compression;
  }

  public boolean overwrite() {
    return overwrite;
  }

  /// @return whether seed entities and pattern transactions are generated
  public boolean includeSeedPatterns() {
    return includeSeedPatterns;
  }

  /// @return the reference instant standing in for the current time
  public Instant asOf() {
    return asOf;
  }

  public CategoricalWeights<Segment> segmentWeights() {
    return segmentWeights;
  }

  public CategoricalWeights<Category> categoryWeights() {
    return categoryWeights;
  }

  public double lowEngagementProbability() {
    return lowEngagementProbability;
  }

  public int interactionsPerCustomer() {
    return interactionsPerCustomer;
  }

  public int chainCount() {
    return chainCount;
  }

  public int seedCustomersPerSegment() {
    return seedCustomersPerSegment;
  }

  public RetrySettings retry() {
    return retry;
  }

  public int threads() {
    return threads;
  }

  public Path outputDirectory() {
    return outputDirectory;
  }

  /// @return the random stream factory for this configuration
  public RandomStreams randomStreams() {
    return new RandomStreams(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed, seedOffsets);
  }

  /// Returns the default configuration.
  ///
  /// Defaults:
  /// - customers: 1,000,000 (small tier), products: 10,000
  /// - seed: 42, batch size: 100,000, compression: snappy
  /// - overwrite: false, seed patterns: included
  /// - reference instant: 2025-01-01T00:00:00Z
  /// - output directory: `data`
  ///
  /// @return the default configuration
  public static GenerationConfig defaults() {
    return new Builder().build();
  }

  /// @return a new builder
  public static Builder builder() {
    return new Builder();
  }

  /// @return a builder initialized with this configuration's values
  public Builder toBuilder() {
    Builder builder = new Builder()
        .customers(customerCount)
        .products(productCount)
        .seed(seed)
        .batchSize(batchSize)
        .singleFileThreshold(singleFileThreshold)
        .compression(compression)
        .overwrite(overwrite)
        .includeSeedPatterns(includeSeedPatterns)
        .asOf(asOf)
        .segmentWeights(segmentWeights)
        .categoryWeights(categoryWeights)
        .lowEngagementProbability(lowEngagementProbability)
        .interactionsPerCustomer(interactionsPerCustomer)
        .chainCount(chainCount)
        .seedCustomersPerSegment(seedCustomersPerSegment)
        .retryAttempts(retry.maxAttempts())
        .retryDelay(retry.delay())
        .threads(threads)
        .outputDirectory(outputDirectory);
    seedOffsets.forEach(builder::seedOffset);
    return builder;
  }

  @Override
  public String toString() {
    return "GenerationConfig{" +
        "customers=" + customerCount +
        ", tier=" + scaleTier +
        ", products=" + productCount +
        ", seed=" + seed +
        ", batchSize=" + batchSize +
        ", singleFileThreshold=" + singleFileThreshold +
        ", compression=" + compression.label() +
        ", overwrite=" + overwrite +
        ", seedPatterns=" + includeSeedPatterns +
        ", asOf=" + asOf +
        ", threads=" + threads +
        ", output=" + outputDirectory +
        '}';
  }

  /// Builder for GenerationConfig.
  public static final class Builder {
    private long customerCount = ScaleTier.SMALL.customers();
    private Integer productCount;
    private long seed = DEFAULT_SEED;
    private final EnumMap<StreamKind, Long> seedOffsets = new EnumMap<>(StreamKind.class);
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Integer singleFileThreshold;
    private Compression compression = Compression.SNAPPY;
    private boolean overwrite = false;
    private boolean includeSeedPatterns = true;
    private Instant asOf = DEFAULT_AS_OF;
    private CategoricalWeights<Segment> segmentWeights = defaultSegmentWeights();
    private CategoricalWeights<Category> categoryWeights = CategoricalWeights.uniform(Category.class);
    private double lowEngagementProbability = DEFAULT_LOW_ENGAGEMENT_PROBABILITY;
    private int interactionsPerCustomer = DEFAULT_INTERACTIONS_PER_CUSTOMER;
    private int chainCount = DEFAULT_CHAIN_COUNT;
    private int seedCustomersPerSegment = DEFAULT_SEED_CUSTOMERS_PER_SEGMENT;
    private int retryAttempts = RetrySettings.DEFAULT_ATTEMPTS;
    private Duration retryDelay = RetrySettings.DEFAULT_DELAY;
    private int threads = 1;
    private Path outputDirectory = Path.of("data");

    Builder() {
    }

    /// @param customerCount the number of bulk customers
    /// @return this builder
    public Builder customers(long customerCount) {
      this.customerCount = customerCount;
      return this;
    }

    /// Use the customer count of a tier. The product count follows the tier unless set.
    /// @param tier the scale tier
    /// @return this builder
    public Builder scaleTier(ScaleTier tier) {
      this.customerCount = tier.customers();
      return this;
    }

    /// @param productCount the number of bulk products
    /// @return this builder
    public Builder products(int productCount) {
      this.productCount = productCount;
      return this;
    }

    public Builder seed(long seed) {
      this.seed = seed;
      return this;
    }

    /// @param kind the stream
    /// @param offset the offset added to the master seed for that stream
    /// @return this builder
    public Builder seedOffset(StreamKind kind, long offset) {
      this.seedOffsets.put(kind, offset);
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder singleFileThreshold(int threshold) {
      this.singleFileThreshold = threshold;
      return this;
    }

    public Builder compression(Compression compression) {
      this.compression = Objects.requireNonNull(compression, "compression");
      return this;
    }

    /// @param name codec name
    /// @return this builder
    /// @throws ConfigurationException for an unknown codec
    public Builder compression(String name) {
      this.compression = Compression.of(name);
      return this;
    }

    public Builder overwrite(boolean overwrite) {
      this.overwrite = overwrite;
      return this;
    }

    public Builder includeSeedPatterns(boolean includeSeedPatterns) {
      this.includeSeedPatterns = includeSeedPatterns;
      return this;
    }

    public Builder asOf(Instant asOf) {
      this.asOf = Objects.requireNonNull(asOf, "asOf");
      return this;
    }

    public Builder segmentWeights(CategoricalWeights<Segment> weights) {
      this.segmentWeights = Objects.requireNonNull(weights, "segmentWeights");
      return this;
    }

    /// @param weights probability per segment
    /// @return this builder
    /// @throws ConfigurationException if the weights do not sum to one
    public Builder segmentWeights(Map<Segment, Double> weights) {
      return segmentWeights(CategoricalWeights.of(Segment.class, weights));
    }

    public Builder categoryWeights(CategoricalWeights<Category> weights) {
      this.categoryWeights = Objects.requireNonNull(weights, "categoryWeights");
      return this;
    }

    /// @param weights probability per category
    /// @return this builder
    /// @throws ConfigurationException if the weights do not sum to one
    public Builder categoryWeights(Map<Category, Double> weights) {
      return categoryWeights(CategoricalWeights.of(Category.class, weights));
    }

    public Builder lowEngagementProbability(double probability) {
      this.lowEngagementProbability = probability;
      return this;
    }

    public Builder interactionsPerCustomer(int interactionsPerCustomer) {
      this.interactionsPerCustomer = interactionsPerCustomer;
      return this;
    }

    public Builder chainCount(int chainCount) {
      this.chainCount = chainCount;
      return this;
    }

    public Builder seedCustomersPerSegment(int count) {
      this.seedCustomersPerSegment = count;
      return this;
    }

    public Builder retryAttempts(int attempts) {
      this.retryAttempts = attempts;
      return this;
    }

    public Builder retryDelay(Duration delay) {
      this.retryDelay = Objects.requireNonNull(delay, "retryDelay");
      return this;
    }

    public Builder threads(int threads) {
      this.threads = threads;
      return this;
    }

    public Builder outputDirectory(Path outputDirectory) {
      this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
      return this;
    }

    /// Validate and build the configuration.
    /// @return the configuration
    /// @throws ConfigurationException if any value is out of range
    public GenerationConfig build() {
      if (customerCount < 1) {
        throw new ConfigurationException("Customer count must be positive, got: " + customerCount);
      }
      ScaleTier tier = ScaleTier.forCustomerCount(customerCount);
      int products = productCount != null ? productCount : tier.products();
      if (products < 1) {
        throw new ConfigurationException("Product count must be positive, got: " + products);
      }
      if (batchSize < 1) {
        throw new ConfigurationException("Batch size must be positive, got: " + batchSize);
      }
      int threshold = singleFileThreshold != null ? singleFileThreshold : batchSize;
      if (threshold < 0) {
        throw new ConfigurationException("Single file threshold cannot be negative, got: " + threshold);
      }
      if (!(lowEngagementProbability >= 0.0d && lowEngagementProbability <= 1.0d)) {
        throw new ConfigurationException(
            "Low engagement probability must be within [0,1], got: " + lowEngagementProbability);
      }
      if (interactionsPerCustomer < 0) {
        throw new ConfigurationException(
            "Interactions per customer cannot be negative, got: " + interactionsPerCustomer);
      }
      if (chainCount < 0) {
        throw new ConfigurationException("Chain count cannot be negative, got: " + chainCount);
      }
      if (seedCustomersPerSegment < 0) {
        throw new ConfigurationException(
            "Seed customers per segment cannot be negative, got: " + seedCustomersPerSegment);
      }
      if (threads < 1) {
        throw new ConfigurationException("Thread count must be at least 1, got: " + threads);
      }
      long seedCustomers = includeSeedPatterns ? (long) seedCustomersPerSegment * Segment.values().length : 0L;
      if (customerCount < seedCustomers) {
        throw new ConfigurationException("Customer count " + customerCount + " cannot hold the " + seedCustomers
            + " seed customers; raise it or turn seed patterns off");
      }
      return new GenerationConfig(this, tier, products, threshold);
    }

    private static CategoricalWeights<Segment> defaultSegmentWeights() {
      EnumMap<Segment, Double> weights = new EnumMap<>(Segment.class);
      weights.put(Segment.TOP_TIER, 0.10d);
      weights.put(Segment.PREMIUM, 0.20d);
      weights.put(Segment.STANDARD, 0.30d);
      weights.put(Segment.BASIC, 0.25d);
      weights.put(Segment.NEW, 0.15d);
      return CategoricalWeights.of(Segment.class, weights);
    }
  }
}
