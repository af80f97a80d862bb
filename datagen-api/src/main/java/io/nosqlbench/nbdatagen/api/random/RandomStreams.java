package io.nosqlbench.nbdatagen.api.random;

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


import org.apache.commons.rng.UniformRandomProvider;

import java.util.EnumMap;
import java.util.Map;

/// Factory for the per-stage random streams of one run. Every call to [#stream(StreamKind)]
/// returns a fresh generator positioned at the start of that stream, which is what makes
/// the lazy sequences built on top of it restartable.
public final class RandomStreams {

  private final RandomGenerators.Algorithm algorithm;
  private final long masterSeed;
  private final EnumMap<StreamKind, Long> offsets;

  /// @param algorithm the PRNG algorithm for every stream
  /// @param masterSeed the run seed
  /// @param offsets per stream offsets, missing streams use their default offset
  public RandomStreams(RandomGenerators.Algorithm algorithm, long masterSeed, Map<StreamKind, Long> offsets) {
    this.algorithm = algorithm;
    this.masterSeed = masterSeed;
    this.offsets = new EnumMap<>(StreamKind.class);
    for (StreamKind kind : StreamKind.values()) {
      this.offsets.put(kind, offsets.getOrDefault(kind, kind.defaultOffset()));
    }
  }

  /// @param masterSeed the run seed
  /// @return streams with default offsets and the default algorithm
  public static RandomStreams of(long masterSeed) {
    return new RandomStreams(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, masterSeed, Map.of());
  }

  /// @param kind the stream
  /// @return the seed of that stream
  public long seedOf(StreamKind kind) {
    return masterSeed + offsets.get(kind);
  }

  /// @param kind the stream
  /// @return a new generator at the start of that stream
  public UniformRandomProvider stream(StreamKind kind) {
    return RandomGenerators.create(algorithm, seedOf(kind));
  }
}
