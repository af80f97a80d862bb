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

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/// Identifier construction. No identifier is ever taken from a process-wide random source.
public final class DeterministicIds {

  private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

  private DeterministicIds() {
  }

  /// @param name a stable name, such as `seed-customer:VIP:3`
  /// @return the version 3 UUID of the name
  public static String nameBased(String name) {
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
  }

  /// @param rng the stream to draw from
  /// @return a version 4 shaped UUID built from the next two longs of the stream
  public static String next(UniformRandomProvider rng) {
    return fromBits(rng.nextLong(), rng.nextLong());
  }

  /// An identifier that is a pure function of a seed, a salt and a row index. This lets any
  /// row id be recomputed from its index without materializing the rows.
  /// @param seed the stream seed
  /// @param salt distinguishes entity types sharing one seed
  /// @param index the row index
  /// @return a version 4 shaped UUID
  public static String indexed(long seed, long salt, long index) {
    long base = seed ^ (salt * GOLDEN_GAMMA);
    long z = base + (2 * index + 1) * GOLDEN_GAMMA;
    long msb = mix64(z);
    long lsb = mix64(z + GOLDEN_GAMMA);
    return fromBits(msb, lsb);
  }

  static String fromBits(long msb, long lsb) {
    long versioned = (msb & 0xFFFFFFFFFFFF0FFFL) | 0x0000000000004000L;
    long variant = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
    return new UUID(versioned, variant).toString();
  }

  // SplitMix64 finalizer
  private static long mix64(long z) {
    z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
    z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
    return z ^ (z >>> 31);
  }
}
