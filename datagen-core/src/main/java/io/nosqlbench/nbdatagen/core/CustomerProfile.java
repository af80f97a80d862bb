package io.nosqlbench.nbdatagen.core;

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


import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Customer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// A customer together with the purchase preferences assigned when it was created.
/// Preferences are never changed afterwards.
///
/// @param customer the customer row
/// @param brandAffinity the preferred brand, or null when the customer has none
/// @param exclusions categories the customer never buys from
public record CustomerProfile(Customer customer, String brandAffinity, Set<Category> exclusions) {

  public CustomerProfile {
    Objects.requireNonNull(customer, "customer");
    exclusions = exclusions.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(exclusions));
  }

  /// @param customer the customer row
  /// @return a profile with no brand preference and no exclusions
  public static CustomerProfile plain(Customer customer) {
    return new CustomerProfile(customer, null, Set.of());
  }

  public String customerId() {
    return customer.customerId();
  }

  public Optional<String> affinity() {
    return Optional.ofNullable(brandAffinity);
  }

  /// @param category a product category
  /// @return true if this customer never buys from the category
  public boolean excludes(Category category) {
    return exclusions.contains(category);
  }
}
