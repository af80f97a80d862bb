package io.nosqlbench.nbdatagen.command.config;

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
import io.nosqlbench.nbdatagen.api.config.ScaleTier;
import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.random.StreamKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/// Layers generation settings: built-in defaults, then an optional YAML file, then
/// environment variables. Command line options are applied by the caller on the returned
/// builder, so they win over everything else.
///
/// # YAML keys
///
/// ```yaml
/// customers: 250000          # a count, or one of small, medium, large
/// products: 5000
/// seed: 7
/// seedOffsets: {transactions: 4100}
/// batchSize: 50000
/// singleFileThreshold: 50000
/// compression: zstd
/// overwrite: true
/// includeSeedPatterns: true
/// asOf: 2025-01-01T00:00:00Z
/// segmentWeights: {VIP: 0.1, Premium: 0.2, Regular: 0.3, Basic: 0.25, New: 0.15}
/// categoryWeights: {Electronics: 0.5, Clothing: 0.1, Home: 0.1, Books: 0.1, Sports: 0.1, Beauty: 0.1}
/// lowEngagementProbability: 0.05
/// interactionsPerCustomer: 25
/// chainCount: 5
/// seedCustomersPerSegment: 10
/// retryAttempts: 3
/// retryDelaySeconds: 5
/// threads: 4
/// outputDirectory: data
/// ```
///
/// Unknown keys and values of the wrong type are configuration errors.
public class GenerationConfigLoader {

  private static final Logger logger = LogManager.getLogger(GenerationConfigLoader.class);

  public static final String CUSTOMER_SCALE = "CUSTOMER_SCALE";
  public static final String RANDOM_SEED = "RANDOM_SEED";
  public static final String BATCH_FILE_SIZE = "BATCH_FILE_SIZE";
  public static final String DATA_OUTPUT_DIR = "DATA_OUTPUT_DIR";
  public static final String PARQUET_COMPRESSION = "PARQUET_COMPRESSION";
  public static final String OVERWRITE_EXISTING_DATA = "OVERWRITE_EXISTING_DATA";

  private final Map<String, String> environment;

  /// @param environment the environment variables to read
  public GenerationConfigLoader(Map<String, String> environment) {
    this.environment = environment;
  }

  /// @return a loader over the process environment
  public static GenerationConfigLoader fromSystemEnvironment() {
    return new GenerationConfigLoader(System.getenv());
  }

  /// @param configFile a YAML file, or null for none
  /// @return a builder holding defaults overlaid with the file and the environment
  /// @throws ConfigurationException if the file or a variable holds an invalid setting
  public GenerationConfig.Builder load(Path configFile) {
    GenerationConfig.Builder builder = GenerationConfig.builder();
    if (configFile != null) {
      applyYaml(builder, configFile);
    }
    applyEnvironment(builder);
    return builder;
  }

  /// Customer scale as either a count or a tier name.
  /// @param builder the builder to update
  /// @param value the scale
  /// @throws ConfigurationException if the value is neither
  public static void applyCustomerScale(GenerationConfig.Builder builder, String value) {
    String trimmed = value.trim().replace("_", "");
    try {
      builder.customers(Long.parseLong(trimmed));
    } catch (NumberFormatException e) {
      builder.scaleTier(ScaleTier.of(value));
    }
  }

  private void applyEnvironment(GenerationConfig.Builder builder) {
    env(CUSTOMER_SCALE, v -> {
      applyCustomerScale(builder, v);
      return null;
    });
    env(RANDOM_SEED, v -> builder.seed(parseLong(RANDOM_SEED, v)));
    env(BATCH_FILE_SIZE, v -> builder.batchSize(asInt(BATCH_FILE_SIZE, v)));
    env(DATA_OUTPUT_DIR, v -> builder.outputDirectory(Path.of(v)));
    env(PARQUET_COMPRESSION, builder::compression);
    env(OVERWRITE_EXISTING_DATA, v -> builder.overwrite(parseBoolean(OVERWRITE_EXISTING_DATA, v)));
  }

  private void env(String name, Function<String, ?> setter) {
    String value = environment.get(name);
    if (value != null && !value.isBlank()) {
      logger.debug("Applying {} from the environment", name);
      setter.apply(value.trim());
    }
  }

  private void applyYaml(GenerationConfig.Builder builder, Path configFile) {
    Object document;
    try {
      Load yaml = new Load(LoadSettings.builder().build());
      document = yaml.loadFromString(Files.readString(configFile));
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration file: " + configFile, e);
    } catch (YamlEngineException e) {
      throw new ConfigurationException("Invalid YAML in " + configFile + ": " + e.getMessage(), e);
    }
    if (document == null) {
      return;
    }
    if (!(document instanceof Map<?, ?> settings)) {
      throw new ConfigurationException("Configuration file must contain a mapping: " + configFile);
    }
    logger.info("Loading generation settings from {}", configFile);
    for (Map.Entry<?, ?> entry : settings.entrySet()) {
      apply(builder, String.valueOf(entry.getKey()), entry.getValue());
    }
  }

  private static void apply(GenerationConfig.Builder builder, String key, Object value) {
    switch (key) {
      case "customers":
        if (value instanceof Number) {
          builder.customers(asLong(key, value));
        } else {
          applyCustomerScale(builder, asString(key, value));
        }
        break;
      case "scaleTier":
        builder.scaleTier(ScaleTier.of(asString(key, value)));
        break;
      case "products":
        builder.products(asInt(key, value));
        break;
      case "seed":
        builder.seed(asLong(key, value));
        break;
      case "seedOffsets":
        asMap(key, value).forEach((k, v) -> builder.seedOffset(streamKind(k), asLong(key + "." + k, v)));
        break;
      case "batchSize":
        builder.batchSize(asInt(key, value));
        break;
      case "singleFileThreshold":
        builder.singleFileThreshold(asInt(key, value));
        break;
      case "compression":
        builder.compression(asString(key, value));
        break;
      case "overwrite":
        builder.overwrite(asBoolean(key, value));
        break;
      case "includeSeedPatterns":
        builder.includeSeedPatterns(asBoolean(key, value));
        break;
      case "asOf":
        builder.asOf(asInstant(key, value));
        break;
      case "segmentWeights": {
        Map<Segment, Double> weights = new EnumMap<>(Segment.class);
        asMap(key, value).forEach((k, v) -> weights.put(enumKey(key, k, Segment::of), asDouble(key + "." + k, v)));
        builder.segmentWeights(weights);
        break;
      }
      case "categoryWeights": {
        Map<Category, Double> weights = new EnumMap<>(Category.class);
        asMap(key, value).forEach((k, v) -> weights.put(enumKey(key, k, Category::of), asDouble(key + "." + k, v)));
        builder.categoryWeights(weights);
        break;
      }
      case "lowEngagementProbability":
        builder.lowEngagementProbability(asDouble(key, value));
        break;
      case "interactionsPerCustomer":
        builder.interactionsPerCustomer(asInt(key, value));
        break;
      case "chainCount":
        builder.chainCount(asInt(key, value));
        break;
      case "seedCustomersPerSegment":
        builder.seedCustomersPerSegment(asInt(key, value));
        break;
      case "retryAttempts":
        builder.retryAttempts(asInt(key, value));
        break;
      case "retryDelaySeconds":
        builder.retryDelay(Duration.ofSeconds(asLong(key, value)));
        break;
      case "threads":
        builder.threads(asInt(key, value));
        break;
      case "outputDirectory":
        builder.outputDirectory(Path.of(asString(key, value)));
        break;
      default:
        throw new ConfigurationException("Unknown configuration key: " + key);
    }
  }

  private static StreamKind streamKind(String name) {
    try {
      return StreamKind.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown random stream in seedOffsets: " + name, e);
    }
  }

  private static <E> E enumKey(String key, String name, Function<String, E> lookup) {
    try {
      return lookup.apply(name);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown entry '" + name + "' in " + key, e);
    }
  }

  private static Map<String, Object> asMap(String key, Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      throw new ConfigurationException(key + " must be a mapping, got: " + value);
    }
    Map<String, Object> result = new LinkedHashMap<>();
    map.forEach((k, v) -> result.put(String.valueOf(k), v));
    return result;
  }

  private static String asString(String key, Object value) {
    if (value == null) {
      throw new ConfigurationException(key + " must not be empty");
    }
    return String.valueOf(value);
  }

  private static long asLong(String key, Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
      try {
        return value instanceof BigInteger big ? big.longValueExact() : ((Number) value).longValue();
      } catch (ArithmeticException e) {
        throw new ConfigurationException(key + " is out of range: " + value, e);
      }
    }
    if (value instanceof String text) {
      return parseLong(key, text);
    }
    throw new ConfigurationException(key + " must be an integer, got: " + value);
  }

  private static int asInt(String key, Object value) {
    long result = asLong(key, value);
    if (result < Integer.MIN_VALUE || result > Integer.MAX_VALUE) {
      throw new ConfigurationException(key + " is out of range: " + value);
    }
    return (int) result;
  }

  private static double asDouble(String key, Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new ConfigurationException(key + " must be a number, got: " + value);
  }

  private static boolean asBoolean(String key, Object value) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof String text) {
      return parseBoolean(key, text);
    }
    throw new ConfigurationException(key + " must be true or false, got: " + value);
  }

  private static Instant asInstant(String key, Object value) {
    try {
      return Instant.parse(asString(key, value));
    } catch (DateTimeParseException e) {
      throw new ConfigurationException(key + " must be an ISO-8601 instant, got: " + value, e);
    }
  }

  private static long parseLong(String key, String text) {
    try {
      return Long.parseLong(text.trim().replace("_", ""));
    } catch (NumberFormatException e) {
      throw new ConfigurationException(key + " must be an integer, got: " + text, e);
    }
  }

  private static boolean parseBoolean(String key, String text) {
    switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "true":
      case "yes":
      case "1":
        return true;
      case "false":
      case "no":
      case "0":
        return false;
      default:
        throw new ConfigurationException(key + " must be true or false, got: " + text);
    }
  }
}
