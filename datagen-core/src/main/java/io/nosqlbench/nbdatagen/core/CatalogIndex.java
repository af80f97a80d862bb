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
import io.nosqlbench.nbdatagen.api.model.Product;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Read-only two level lookup of the product catalog: category to brand to products.
/// Built once from seed and bulk products; iteration order follows insertion order, so every
/// lookup result is deterministic.
public final class CatalogIndex {

  private final List<Product> all;
  private final EnumMap<Category, Map<String, List<Product>>> byCategoryAndBrand;
  private final EnumMap<Category, List<Product>> byCategory;
  private final Map<String, List<Product>> byBrand;
  private final Set<String> productIds;

  private CatalogIndex(List<Product> products) {
    this.all = List.copyOf(products);
    EnumMap<Category, Map<String, List<Product>>> twoLevel = new EnumMap<>(Category.class);
    EnumMap<Category, List<Product>> categories = new EnumMap<>(Category.class);
    Map<String, List<Product>> brands = new LinkedHashMap<>();
    Set<String> ids = new HashSet<>(products.size() * 2);
    for (Product product : products) {
      if (!ids.add(product.productId())) {
        throw new IllegalArgumentException("Duplicate product id " + product.productId());
      }
      twoLevel.computeIfAbsent(product.category(), c -> new LinkedHashMap<>())
          .computeIfAbsent(product.brand(), b -> new ArrayList<>())
          .add(product);
      categories.computeIfAbsent(product.category(), c -> new ArrayList<>()).add(product);
      brands.computeIfAbsent(product.brand(), b -> new ArrayList<>()).add(product);
    }
    twoLevel.replaceAll((category, map) -> {
      map.replaceAll((brand, list) -> List.copyOf(list));
      return Collections.unmodifiableMap(map);
    });
    categories.replaceAll((category, list) -> List.copyOf(list));
    brands.replaceAll((brand, list) -> List.copyOf(list));
    this.byCategoryAndBrand = twoLevel;
    this.byCategory = categories;
    this.byBrand = brands;
    this.productIds = Collections.unmodifiableSet(ids);
  }

  /// @param products every product of the run, seed products first
  /// @return the index
  /// @throws IllegalArgumentException if two products share an id
  public static CatalogIndex of(List<Product> products) {
    return new CatalogIndex(products);
  }

  /// @return all products in insertion order
  public List<Product> all() {
    return all;
  }

  public int size() {
    return all.size();
  }

  public List<Product> byCategory(Category category) {
    return byCategory.getOrDefault(category, List.of());
  }

  public List<Product> byBrand(String brand) {
    return byBrand.getOrDefault(brand, List.of());
  }

  /// @param category the category
  /// @param brand the brand
  /// @return products of that brand in that category, possibly empty
  public List<Product> byCategoryAndBrand(Category category, String brand) {
    Map<String, List<Product>> brands = byCategoryAndBrand.get(category);
    if (brands == null) {
      return List.of();
    }
    return brands.getOrDefault(brand, List.of());
  }

  /// @param category the category
  /// @return the brands present in the category, in insertion order
  public Set<String> brands(Category category) {
    Map<String, List<Product>> brands = byCategoryAndBrand.get(category);
    return brands == null ? Set.of() : Collections.unmodifiableSet(brands.keySet());
  }

  /// @param productId a product id
  /// @return true if the product is part of the catalog
  public boolean contains(String productId) {
    return productIds.contains(productId);
  }
}
