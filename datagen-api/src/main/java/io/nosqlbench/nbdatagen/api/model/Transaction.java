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
import java.util.Objects;

/// A purchase of one product by one customer. Append-only; never updated once created.
///
/// @param transactionId unique identifier
/// @param customerId reference to an existing customer
/// @param productId reference to an existing product
/// @param amount charged amount, two decimal places
/// @param quantity number of units, at least one
/// @param timestamp purchase time
/// @param channel sales channel
/// @param status final status
public record Transaction(
    String transactionId,
    String customerId,
    String productId,
    BigDecimal amount,
    int quantity,
    Instant timestamp,
    Channel channel,
    TransactionStatus status
) {
  public Transaction {
    Objects.requireNonNull(transactionId, "transactionId");
    Objects.requireNonNull(customerId, "customerId");
    Objects.requireNonNull(productId, "productId");
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(timestamp, "timestamp");
    if (amount.signum() <= 0) {
      throw new IllegalArgumentException("Amount must be positive: " + amount);
    }
    if (quantity <= 0) {
      throw new IllegalArgumentException("Quantity must be positive: " + quantity);
    }
  }
}
