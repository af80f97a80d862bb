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


import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.DiscreteSampler;
import org.apache.commons.rng.sampling.distribution.GuideTableDiscreteSampler;

import java.time.Duration;
import java.time.Instant;

/// Purchase timestamps biased towards the recent past: 60% fall within the last 90 days,
/// 30% between 90 and 180 days back and 10% between 180 and 365 days back, uniform to the
/// second within each range. Nothing is ever later than the reference instant.
public final class RecencyTimestampSampler {

  private static final double[] BUCKET_WEIGHTS = {0.60d, 0.30d, 0.10d};
  private static final int[][] BUCKET_DAYS = {{0, 90}, {90, 180}, {180, 365}};
  private static final int SECONDS_PER_DAY = 86_400;

  private final UniformRandomProvider rng;
  private final DiscreteSampler buckets;
  private final Instant asOf;

  /// @param rng the stream to draw from
  /// @param asOf the reference instant
  public RecencyTimestampSampler(UniformRandomProvider rng, Instant asOf) {
    this.rng = rng;
    this.buckets = GuideTableDiscreteSampler.of(rng, BUCKET_WEIGHTS);
    this.asOf = asOf;
  }

  /// @return a timestamp at or before the reference instant
  public Instant sample() {
    int[] days = BUCKET_DAYS[buckets.sample()];
    return daysBefore(rng, asOf, days[0], days[1]);
  }

  /// A uniform instant between `maxDays` and `minDays` days before `asOf`, both ends included.
  /// @param rng the stream to draw from
  /// @param asOf the reference instant
  /// @param minDays fewest days back
  /// @param maxDays most days back
  /// @return the timestamp
  public static Instant daysBefore(UniformRandomProvider rng, Instant asOf, int minDays, int maxDays) {
    long span = (long) (maxDays - minDays) * SECONDS_PER_DAY;
    return asOf.minusSeconds((long) minDays * SECONDS_PER_DAY + rng.nextLong(span + 1));
  }

  /// @param rng the stream to draw from
  /// @param asOf the reference instant
  /// @param window how far back to reach
  /// @return a uniform timestamp in `(asOf - window, asOf]`
  public static Instant within(UniformRandomProvider rng, Instant asOf, Duration window) {
    return asOf.minusSeconds(rng.nextLong(window.getSeconds()));
  }

  /// @param timestamp a derived timestamp
  /// @param asOf the reference instant
  /// @return the earlier of the two
  public static Instant clamp(Instant timestamp, Instant asOf) {
    return timestamp.isAfter(asOf) ? asOf : timestamp;
  }
}
