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
import io.nosqlbench.nbdatagen.api.model.Customer;
import io.nosqlbench.nbdatagen.api.model.Money;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.random.DeterministicIds;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Hand placed customers and products that the pattern transactions are built on.
///
/// Seed identifiers are derived from names such as `seed-customer:VIP:3`, so they are the
/// same for every master seed. Only ltv, price, registration and launch dates are drawn
/// from the seed catalog stream.
///
/// Preferences are fixed: VIP and Premium customers 0-4 prefer Apple, 5 and up prefer
/// Samsung, and VIP and Premium customers 8 and up exclude Electronics.
public final class SeedCatalog {
  private static final Logger logger = LogManager.getLogger(SeedCatalog.class);

  /// First seed index of a high value segment that prefers Samsung
  static final int SAMSUNG_FROM = 5;
  /// First seed index of a high value segment that excludes Electronics
  static final int EXCLUDE_FROM = 8;

  private final EnumMap<Segment, List<CustomerProfile>> customers;
  private final EnumMap<Category, Map<String, List<Product>>> products;
  private final List<CustomerProfile> allCustomers;
  private final List<Product> allProducts;

  private SeedCatalog(EnumMap<Segment, List<CustomerProfile>> customers,
                      EnumMap<Category, Map<String, List<Product>>> products,
                      List<CustomerProfile> allCustomers,
                      List<Product> allProducts) {
    this.customers = customers;
    this.products = products;
    this.allCustomers = allCustomers;
    this.allProducts = allProducts;
  }

  /// @return a catalog without any seed entities
  public static SeedCatalog empty() {
    return new SeedCatalog(new EnumMap<>(Segment.class), new EnumMap<>(Category.class), List.of(), List.of());
  }

  /// Build the seed catalog.
  /// @param perSegment customers per segment
  /// @param specs product placement, in order
  /// @param rng the seed catalog stream
  /// @param asOf the reference instant
  /// @return the catalog
  public static SeedCatalog build(int perSegment, List<SeedProductSpec> specs, UniformRandomProvider rng,
                                  Instant asOf) {
    LocalDate today = asOf.atZone(ZoneOffset.UTC).toLocalDate();

    EnumMap<Segment, List<CustomerProfile>> customers = new EnumMap<>(Segment.class);
    List<CustomerProfile> allCustomers = new ArrayList<>();
    for (Segment segment : Segment.values()) {
      List<CustomerProfile> profiles = new ArrayList<>(perSegment);
      for (int i = 0; i < perSegment; i++) {
        Customer customer = new Customer(
            seedCustomerId(segment, i),
            "seed_" + segment.label().toLowerCase(Locale.ROOT) + "_" + i + "@example.com",
            "Seed " + segment.label() + " Customer " + i,
            segment,
            Money.of(RandomGenerators.nextDoubleBetween(rng, segment.minLtv(), segment.maxLtv())),
            today.minusDays(RandomGenerators.nextIntBetween(rng, 30, 365)),
            asOf);
        CustomerProfile profile = new CustomerProfile(customer, seedAffinity(segment, i), seedExclusions(segment, i));
        profiles.add(profile);
        allCustomers.add(profile);
      }
      customers.put(segment, Collections.unmodifiableList(profiles));
    }

    EnumMap<Category, Map<String, List<Product>>> products = new EnumMap<>(Category.class);
    List<Product> allProducts = new ArrayList<>();
    for (SeedProductSpec spec : specs) {
      List<Product> placed = products.computeIfAbsent(spec.category(), c -> new LinkedHashMap<>())
          .computeIfAbsent(spec.brand(), b -> new ArrayList<>());
      for (int i = 0; i < spec.count(); i++) {
        int ordinal = placed.size() + 1;
        Product product = new Product(
            seedProductId(spec.category(), spec.brand(), ordinal),
            spec.brand() + " " + spec.category().label() + " Seed " + ordinal,
            spec.category(),
            spec.brand(),
            Money.of(RandomGenerators.nextDoubleBetween(rng, spec.minPrice(), spec.maxPrice())),
            today.minusDays(rng.nextInt(730)),
            asOf);
        placed.add(product);
        allProducts.add(product);
      }
    }

    logger.info("Placed {} seed customers and {} seed products", allCustomers.size(), allProducts.size());
    return new SeedCatalog(customers, products, Collections.unmodifiableList(allCustomers),
        Collections.unmodifiableList(allProducts));
  }

  /// @param segment the segment
  /// @param index the seed index within the segment
  /// @return the identifier the seed customer has in every run
  public static String seedCustomerId(Segment segment, int index) {
    return DeterministicIds.nameBased("seed-customer:" + segment.label() + ":" + index);
  }

  /// @param category the category
  /// @param brand the brand
  /// @param ordinal one based position among the brand's seed products in the category
  /// @return the identifier the seed product has in every run
  public static String seedProductId(Category category, String brand, int ordinal) {
    return DeterministicIds.nameBased("seed-product:" + category.label() + ":" + brand + ":" + ordinal);
  }

  private static String seedAffinity(Segment segment, int index) {
    if (!segment.isHighValue()) {
      return null;
    }
    return index < SAMSUNG_FROM ? "Apple" : "Samsung";
  }

  private static Set<Category> seedExclusions(Segment segment, int index) {
    if (segment.isHighValue() && index >= EXCLUDE_FROM) {
      return EnumSet.of(Category.ELECTRONICS);
    }
    return Set.of();
  }

  /// @param segment the segment
  /// @return the seed customers of the segment in seed index order, possibly empty
  public List<CustomerProfile> customers(Segment segment) {
    return customers.getOrDefault(segment, List.of());
  }

  /// @param segment the segment
  /// @param from first index, inclusive
  /// @param to last index, exclusive
  /// @return the seed customers in that index range that exist
  public List<CustomerProfile> customers(Segment segment, int from, int to) {
    List<CustomerProfile> list = customers(segment);
    int end = Math.min(to, list.size());
    return from >= end ? List.of() : list.subList(from, end);
  }

  /// @param category the category
  /// @param brand the brand
  /// @return the seed products of the brand in the category, possibly empty
  public List<Product> products(Category category, String brand) {
    Map<String, List<Product>> brands = products.get(category);
    if (brands == null) {
      return List.of();
    }
    return Collections.unmodifiableList(brands.getOrDefault(brand, List.of()));
  }

  /// @return all seed customers, segment by segment
  public List<CustomerProfile> allCustomers() {
    return allCustomers;
  }

  /// @return all seed products in placement order
  public List<Product> allProducts() {
    return allProducts;
  }

  public boolean isEmpty() {
    return allCustomers.isEmpty() && allProducts.isEmpty();
  }
}
