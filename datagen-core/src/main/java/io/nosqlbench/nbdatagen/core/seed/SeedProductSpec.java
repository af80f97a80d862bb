package io.nosqlbench.nbdatagen.core.seed;

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

import java.util.List;
import java.util.Objects;

/// How many seed products of one brand to place in one category, and their price range.
///
/// @param category the category
/// @param brand the brand
/// @param count number of products
/// @param minPrice lowest price, inclusive
/// @param maxPrice highest price, exclusive
public record SeedProductSpec(Category category, String brand, int count, double minPrice, double maxPrice) {

  public SeedProductSpec {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(brand, "brand");
    if (count < 0) {
      throw new IllegalArgumentException("Seed product count cannot be negative: " + count);
    }
    if (!(minPrice > 0.0d && maxPrice >= minPrice)) {
      throw new IllegalArgumentException("Invalid price range [" + minPrice + ", " + maxPrice + ")");
    }
  }

  /// The products the built-in patterns draw from: 45 products over all six categories.
  /// @return the default specs, in placement order
  public static List<SeedProductSpec> defaults() {
    return List.of(
        new SeedProductSpec(Category.ELECTRONICS, "Apple", 5, 500, 2000),
        new SeedProductSpec(Category.ELECTRONICS, "Samsung", 5, 400, 1500),
        new SeedProductSpec(Category.ELECTRONICS, "Sony", 5, 300, 1200),
        new SeedProductSpec(Category.CLOTHING, "Nike", 5, 50, 300),
        new SeedProductSpec(Category.CLOTHING, "Adidas", 5, 40, 250),
        new SeedProductSpec(Category.HOME, "IKEA", 5, 50, 500),
        new SeedProductSpec(Category.HOME, "Wayfair", 5, 60, 600),
        new SeedProductSpec(Category.BOOKS, "Penguin", 3, 15, 50),
        new SeedProductSpec(Category.SPORTS, "Nike", 4, 30, 200),
        new SeedProductSpec(Category.BEAUTY, "Loreal", 3, 20, 100)
    );
  }
}
