package io.nosqlbench.nbdatagen.parquet;

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


import io.nosqlbench.nbdatagen.api.config.RetrySettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;

/// Bounded retry with a fixed pause between attempts.
///
/// Each failed attempt but the last is logged at WARN; after the last one the final
/// [IOException] is rethrown with the earlier failures attached as suppressed exceptions.
/// The pause is taken through a [Sleeper] so tests can run without waiting.
public class RetryPolicy {

  private static final Logger logger = LogManager.getLogger(RetryPolicy.class);

  /// Pauses between attempts
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  /// An I/O action that may be attempted more than once
  @FunctionalInterface
  public interface Attempt {
    void run() throws IOException;
  }

  private final int maxAttempts;
  private final Duration delay;
  private final Sleeper sleeper;

  /// @param settings attempt count and pause
  /// @param sleeper how to pause
  public RetryPolicy(RetrySettings settings, Sleeper sleeper) {
    this.maxAttempts = settings.maxAttempts();
    this.delay = settings.delay();
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /// @param settings attempt count and pause
  /// @return a policy that pauses on the calling thread
  public static RetryPolicy of(RetrySettings settings) {
    return new RetryPolicy(settings, d -> Thread.sleep(d.toMillis()));
  }

  /// @param maxAttempts total attempts
  /// @return a policy that retries without pausing
  public static RetryPolicy immediate(int maxAttempts) {
    return new RetryPolicy(RetrySettings.immediate(maxAttempts), d -> { });
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /// Run an action until it succeeds or the attempts are used up.
  /// @param description what the action does, for log messages
  /// @param attempt the action
  /// @return the number of attempts used
  /// @throws IOException the failure of the last attempt
  public int run(String description, Attempt attempt) throws IOException {
    IOException failure = null;
    for (int attemptCount = 1; attemptCount <= maxAttempts; attemptCount++) {
      try {
        attempt.run();
        return attemptCount;
      } catch (IOException e) {
        if (failure != null) {
          e.addSuppressed(failure);
        }
        failure = e;
        if (attemptCount < maxAttempts) {
          logger.warn("Failed to {} (attempt {}/{}): {}", description, attemptCount, maxAttempts, e.getMessage());
          pause();
        }
      }
    }
    throw failure;
  }

  private void pause() throws InterruptedIOException {
    if (delay.isZero()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("Interrupted during retry delay");
      interrupted.initCause(ie);
      throw interrupted;
    }
  }
}
