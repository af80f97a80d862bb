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


import java.time.Duration;
import java.util.Objects;

/// Bounded retry settings for persisting a chunk.
///
/// @param maxAttempts total number of attempts, at least one
/// @param delay fixed pause between attempts, never negative
public record RetrySettings(int maxAttempts, Duration delay) {

  /// Default attempt count
  public static final int DEFAULT_ATTEMPTS = 3;
  /// Default pause between attempts
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

  public RetrySettings {
    Objects.requireNonNull(delay, "delay");
    if (maxAttempts < 1) {
      throw new ConfigurationException("Retry attempts must be at least 1, got: " + maxAttempts);
    }
    if (delay.isNegative()) {
      throw new ConfigurationException("Retry delay cannot be negative: " + delay);
    }
  }

  /// @return three attempts, five seconds apart
  public static RetrySettings defaults() {
    return new RetrySettings(DEFAULT_ATTEMPTS, DEFAULT_DELAY);
  }

  /// @param maxAttempts total number of attempts
  /// @return settings that retry without pausing
  public static RetrySettings immediate(int maxAttempts) {
    return new RetrySettings(maxAttempts, Duration.ZERO);
  }
}
