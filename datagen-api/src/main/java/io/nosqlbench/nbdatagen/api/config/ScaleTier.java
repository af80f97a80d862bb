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


/// Named dataset sizes. A tier fixes the customer count, the product catalog size and the
/// nominal average number of transactions per customer.
public enum ScaleTier {
  SMALL(1_000_000L, 10_000, 8),
  MEDIUM(10_000_000L, 25_000, 10),
  LARGE(100_000_000L, 50_000, 12);

  private final long customers;
  private final int products;
  private final int averageTransactions;

  ScaleTier(long customers, int products, int averageTransactions) {
    this.customers = customers;
    this.products = products;
    this.averageTransactions = averageTransactions;
  }

  public long customers() {
    return customers;
  }

  public int products() {
    return products;
  }

  public int averageTransactions() {
    return averageTransactions;
  }

  /// A sizing estimate for the transactions table, logged when a run starts.
  /// @param customerCount the customers in the run
  /// @return the customer count times this tier's average transactions per customer
  public long expectedTransactions(long customerCount) {
    return customerCount * averageTransactions;
  }

  /// Derive the tier for an explicit customer count.
  /// @param customerCount the requested number of customers
  /// @return [#SMALL] up to one million, [#MEDIUM] up to ten million, [#LARGE] beyond
  public static ScaleTier forCustomerCount(long customerCount) {
    if (customerCount <= SMALL.customers) {
      return SMALL;
    }
    if (customerCount <= MEDIUM.customers) {
      return MEDIUM;
    }
    return LARGE;
  }

  /// Resolve a tier by name, ignoring case.
  /// @param name the tier name
  /// @return the tier
  /// @throws ConfigurationException if the name is not a tier
  public static ScaleTier of(String name) {
    for (ScaleTier tier : values()) {
      if (tier.name().equalsIgnoreCase(name.trim())) {
        return tier;
      }
    }
    throw new ConfigurationException("Unknown scale tier '" + name + "', expected one of small, medium, large");
  }
}
