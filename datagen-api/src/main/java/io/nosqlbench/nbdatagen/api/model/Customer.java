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


import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/// A customer row.
///
/// @param customerId unique identifier
/// @param email contact address
/// @param name display name
/// @param segment customer tier
/// @param ltv lifetime value, two decimal places, within the segment range
/// @param registrationDate the day the customer registered
/// @param createdAt row creation time
public record Customer(
    String customerId,
    String email,
    String name,
    Segment segment,
    BigDecimal ltv,
    LocalDate registrationDate,
    Instant createdAt
) {
  public Customer {
    Objects.requireNonNull(customerId, "customerId");
    Objects.requireNonNull(segment, "segment");
    Objects.requireNonNull(ltv, "ltv");
    if (ltv.signum() <= 0) {
      throw new IllegalArgumentException("Lifetime value must be positive: " + ltv);
    }
  }
}
