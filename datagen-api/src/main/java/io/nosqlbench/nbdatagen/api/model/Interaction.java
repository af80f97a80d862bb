package io.nosqlbench.nbdatagen.api.model;

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


import java.time.Instant;
import java.util.Objects;

/// A behavioral event such as a product view or a cart addition.
///
/// @param interactionId unique identifier
/// @param customerId reference to an existing customer
/// @param productId reference to an existing product
/// @param type interaction kind
/// @param timestamp event time
/// @param durationSeconds dwell time in seconds, never negative
/// @param device device class
/// @param sessionId session identifier
public record Interaction(
    String interactionId,
    String customerId,
    String productId,
    InteractionType type,
    Instant timestamp,
    int durationSeconds,
    Device device,
    String sessionId
) {
  public Interaction {
    Objects.requireNonNull(interactionId, "interactionId");
    Objects.requireNonNull(customerId, "customerId");
    Objects.requireNonNull(productId, "productId");
    if (durationSeconds < 0) {
      throw new IllegalArgumentException("Duration cannot be negative: " + durationSeconds);
    }
  }
}
