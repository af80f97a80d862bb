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


import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.core.CatalogIndex;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Chooses products for a customer, honoring brand affinity and category exclusions.
///
/// Candidate pools are computed once per distinct exclusion set (and per brand for
/// affinity pools) and cached. Not thread safe; each synthesizer pass owns one.
public final class ProductSelector {

  /// Probability that a customer with a brand affinity buys the preferred brand
  public static final double AFFINITY_PREFERENCE = 0.60d;

  private final CatalogIndex catalog;
  private final Map<Set<Category>, List<Product>> eligible = new HashMap<>();
  private final Map<String, Map<Set<Category>, List<Product>>> affinity = new HashMap<>();

  /// @param catalog the product index
  public ProductSelector(CatalogIndex catalog) {
    this.catalog = catalog;
  }

  /// Choose a product for one purchase.
  ///
  /// With probability [#AFFINITY_PREFERENCE] a customer with an affinity buys from the preferred
  /// brand outside excluded categories. Otherwise, or when that pool is empty, any product
  /// outside excluded categories. Only if every category is excluded is the whole catalog used.
  /// @param profile the customer
  /// @param rng the stream to draw from
  /// @return the product
  public Product select(CustomerProfile profile, UniformRandomProvider rng) {
    if (profile.brandAffinity() != null && rng.nextDouble() < AFFINITY_PREFERENCE) {
      List<Product> preferred = affinityPool(profile.brandAffinity(), profile.exclusions());
      if (!preferred.isEmpty()) {
        return RandomGenerators.pick(preferred, rng);
      }
    }
    List<Product> pool = eligible(profile.exclusions());
    if (!pool.isEmpty()) {
      return RandomGenerators.pick(pool, rng);
    }
    return RandomGenerators.pick(catalog.all(), rng);
  }

  /// Choose another product of the same category, preferring the same brand.
  /// @param profile the customer
  /// @param product the product already bought
  /// @param rng the stream to draw from
  /// @return a different product, or null if the category offers none or is excluded
  public Product basketCompanion(CustomerProfile profile, Product product, UniformRandomProvider rng) {
    if (profile.excludes(product.category())) {
      return null;
    }
    Product sameBrand = other(catalog.byCategoryAndBrand(product.category(), product.brand()), product, rng);
    if (sameBrand != null) {
      return sameBrand;
    }
    return other(catalog.byCategory(product.category()), product, rng);
  }

  /// @param exclusions excluded categories
  /// @return products outside the excluded categories
  public List<Product> eligible(Set<Category> exclusions) {
    if (exclusions.isEmpty()) {
      return catalog.all();
    }
    return eligible.computeIfAbsent(exclusions, ex -> {
      List<Product> pool = new ArrayList<>();
      for (Category category : Category.values()) {
        if (!ex.contains(category)) {
          pool.addAll(catalog.byCategory(category));
        }
      }
      return List.copyOf(pool);
    });
  }

  /// @param brand the preferred brand
  /// @param exclusions excluded categories
  /// @return products of the brand outside the excluded categories
  public List<Product> affinityPool(String brand, Set<Category> exclusions) {
    return affinity.computeIfAbsent(brand, b -> new HashMap<>())
        .computeIfAbsent(exclusions, ex -> {
          List<Product> pool = new ArrayList<>();
          for (Product candidate : catalog.byBrand(brand)) {
            if (!ex.contains(candidate.category())) {
              pool.add(candidate);
            }
          }
          return List.copyOf(pool);
        });
  }

  // uniform over the pool without the given product
  private static Product other(List<Product> pool, Product product, UniformRandomProvider rng) {
    int size = pool.size();
    if (size < 2) {
      return null;
    }
    Product candidate = pool.get(rng.nextInt(size - 1));
    return candidate.equals(product) ? pool.get(size - 1) : candidate;
  }
}
