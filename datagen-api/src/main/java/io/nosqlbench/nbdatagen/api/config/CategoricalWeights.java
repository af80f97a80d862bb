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


import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/// A probability for each constant of an enum. Constants that are not mentioned have
/// probability zero. The probabilities must be finite, non-negative and sum to one within
/// [#TOLERANCE].
///
/// ```java
/// CategoricalWeights<Segment> weights = CategoricalWeights.of(Segment.class, Map.of(
///     Segment.TOP_TIER, 0.5, Segment.NEW, 0.5));
/// double[] p = weights.probabilities(); // indexed by ordinal
/// ```
/// @param <E> the enum whose constants are weighted
public final class CategoricalWeights<E extends Enum<E>> {

  /// Allowed deviation of the weight sum from 1.0
  public static final double TOLERANCE = 1e-6;

  private final Class<E> type;
  private final EnumMap<E, Double> weights;

  private CategoricalWeights(Class<E> type, EnumMap<E, Double> weights) {
    this.type = type;
    this.weights = weights;
  }

  /// Create validated weights.
  /// @param type the enum class
  /// @param weights probability per constant
  /// @param <E> the enum type
  /// @return the weights
  /// @throws ConfigurationException if any weight is negative or not finite, or the sum is not 1
  public static <E extends Enum<E>> CategoricalWeights<E> of(Class<E> type, Map<E, Double> weights) {
    EnumMap<E, Double> copy = new EnumMap<>(type);
    double sum = 0.0d;
    for (Map.Entry<E, Double> entry : weights.entrySet()) {
      Double value = entry.getValue();
      if (value == null || !Double.isFinite(value) || value < 0.0d) {
        throw new ConfigurationException(
            "Weight for " + entry.getKey() + " must be a non-negative number, got: " + value);
      }
      copy.put(entry.getKey(), value);
      sum += value;
    }
    if (Math.abs(sum - 1.0d) > TOLERANCE) {
      throw new ConfigurationException(
          "Weights for " + type.getSimpleName() + " must sum to 1.0, got: " + sum + " " + weights);
    }
    return new CategoricalWeights<>(type, copy);
  }

  /// Equal probability for every constant.
  /// @param type the enum class
  /// @param <E> the enum type
  /// @return uniform weights
  public static <E extends Enum<E>> CategoricalWeights<E> uniform(Class<E> type) {
    E[] constants = type.getEnumConstants();
    EnumMap<E, Double> map = new EnumMap<>(type);
    for (E constant : constants) {
      map.put(constant, 1.0d / constants.length);
    }
    return new CategoricalWeights<>(type, map);
  }

  /// @param constant an enum constant
  /// @return its probability, zero if not mentioned
  public double weight(E constant) {
    return weights.getOrDefault(constant, 0.0d);
  }

  /// @return the probabilities indexed by ordinal
  public double[] probabilities() {
    E[] constants = type.getEnumConstants();
    double[] probabilities = new double[constants.length];
    for (E constant : constants) {
      probabilities[constant.ordinal()] = weight(constant);
    }
    return probabilities;
  }

  /// @return the constant with the given ordinal
  /// @param ordinal an index into the enum constants
  public E constant(int ordinal) {
    return type.getEnumConstants()[ordinal];
  }

  /// @return a read-only view of the configured weights
  public Map<E, Double> asMap() {
    return Collections.unmodifiableMap(weights);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CategoricalWeights<?> that)) {
      return false;
    }
    return type.equals(that.type) && weights.equals(that.weights);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + weights.hashCode();
  }

  @Override
  public String toString() {
    return weights.toString();
  }
}
