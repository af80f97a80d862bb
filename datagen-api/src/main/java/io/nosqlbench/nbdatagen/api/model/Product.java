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

/// A product row.
///
/// @param productId unique identifier
/// @param name display name
/// @param category product category
/// @param brand brand name
/// @param price unit price, two decimal places
/// @param launchDate the day the product launched
/// @param createdAt row creation time
public record Product(
    String productId,
    String name,
    Category category,
    String brand,
    BigDecimal price,
    LocalDate launchDate,
    Instant createdAt
) {
  public Product {
    Objects.requireNonNull(productId, "productId");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(brand, "brand");
    Objects.requireNonNull(price, "price");
    if (price.signum() <= 0) {
      throw new IllegalArgumentException("Price must be positive: " + price);
    }
  }
}
