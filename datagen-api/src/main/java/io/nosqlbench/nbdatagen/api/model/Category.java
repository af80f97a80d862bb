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


import java.util.List;

/// Product categories with their configured price range and brand roster.
public enum Category {
  ELECTRONICS("Electronics", 50, 2000, List.of("Apple", "Samsung", "Sony", "Dell", "HP")),
  CLOTHING("Clothing", 20, 500, List.of("Nike", "Adidas", "Zara", "Gap", "Levi")),
  HOME("Home", 25, 800, List.of("IKEA", "Wayfair", "Target", "HomeDepot")),
  BOOKS("Books", 10, 100, List.of("Penguin", "Harper", "Simon", "Random")),
  SPORTS("Sports", 30, 600, List.of("Nike", "Adidas", "Wilson", "Spalding")),
  BEAUTY("Beauty", 15, 200, List.of("Loreal", "Maybelline", "MAC", "Sephora"));

  private final String label;
  private final double minPrice;
  private final double maxPrice;
  private final List<String> brands;

  Category(String label, double minPrice, double maxPrice, List<String> brands) {
    this.label = label;
    this.minPrice = minPrice;
    this.maxPrice = maxPrice;
    this.brands = brands;
  }

  public String label() {
    return label;
  }

  public double minPrice() {
    return minPrice;
  }

  public double maxPrice() {
    return maxPrice;
  }

  public List<String> brands() {
    return brands;
  }

  /// Categories that customers of this category tend to buy from in the same session.
  /// @return the affinity-linked categories, possibly empty
  public List<Category> affinityCategories() {
    switch (this) {
      case ELECTRONICS:
        return List.of(HOME, CLOTHING);
      case CLOTHING:
        return List.of(BEAUTY);
      case HOME:
        return List.of(ELECTRONICS);
      case SPORTS:
        return List.of(CLOTHING);
      case BEAUTY:
        return List.of(CLOTHING);
      case BOOKS:
      default:
        return List.of();
    }
  }

  /// Resolve a category by enum name or label, ignoring case.
  /// @param name the name or label
  /// @return the matching category
  /// @throws IllegalArgumentException if nothing matches
  public static Category of(String name) {
    for (Category category : values()) {
      if (category.name().equalsIgnoreCase(name) || category.label.equalsIgnoreCase(name)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown category: " + name);
  }
}
