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

package io.nosqlbench.nbdatagen.core.seed;

import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SeedCatalog")
class SeedCatalogTest {

    private static final Instant AS_OF = Instant.parse("2025-01-01T00:00:00Z");

    private static SeedCatalog build(long seed) {
        return SeedCatalog.build(10, SeedProductSpec.defaults(), RandomGenerators.create(seed), AS_OF);
    }

    @Test
    @DisplayName("should place 10 customers per segment and 45 products")
    void shouldPlaceDefaultCounts() {
        SeedCatalog seeds = build(42L);

        assertThat(seeds.allCustomers()).hasSize(50);
        for (Segment segment : Segment.values()) {
            assertThat(seeds.customers(segment)).hasSize(10)
                .allSatisfy(p -> assertThat(p.customer().segment()).isEqualTo(segment));
        }
        assertThat(seeds.allProducts()).hasSize(45);
        assertThat(seeds.products(Category.ELECTRONICS, "Apple")).hasSize(5);
        assertThat(seeds.products(Category.SPORTS, "Nike")).hasSize(4);
        assertThat(seeds.products(Category.BOOKS, "Harper")).isEmpty();
    }

    @Test
    @DisplayName("should derive identifiers from names only")
    void shouldUseStableIdentifiers() {
        SeedCatalog a = build(42L);
        SeedCatalog b = build(7L);

        List<String> idsA = a.allCustomers().stream().map(CustomerProfile::customerId).collect(Collectors.toList());
        List<String> idsB = b.allCustomers().stream().map(CustomerProfile::customerId).collect(Collectors.toList());
        assertThat(idsA).isEqualTo(idsB).doesNotHaveDuplicates();
        assertThat(a.customers(Segment.TOP_TIER).get(3).customerId())
            .isEqualTo(SeedCatalog.seedCustomerId(Segment.TOP_TIER, 3));
        assertThat(a.allProducts().get(0).productId())
            .isEqualTo(SeedCatalog.seedProductId(Category.ELECTRONICS, "Apple", 1));
        Set<String> productIds = new HashSet<>();
        a.allProducts().forEach(p -> productIds.add(p.productId()));
        assertThat(productIds).hasSize(45);
    }

    @Test
    @DisplayName("should name seed rows after their segment and brand")
    void shouldNameSeedRows() {
        SeedCatalog seeds = build(42L);

        CustomerProfile vip = seeds.customers(Segment.TOP_TIER).get(2);
        assertThat(vip.customer().email()).isEqualTo("seed_vip_2@example.com");
        assertThat(vip.customer().name()).isEqualTo("Seed VIP Customer 2");
        assertThat(seeds.products(Category.CLOTHING, "Adidas").get(0).name()).isEqualTo("Adidas Clothing Seed 1");
    }

    @Test
    @DisplayName("should assign fixed affinities and exclusions")
    void shouldAssignPreferences() {
        SeedCatalog seeds = build(42L);

        for (Segment segment : List.of(Segment.TOP_TIER, Segment.PREMIUM)) {
            List<CustomerProfile> profiles = seeds.customers(segment);
            for (int i = 0; i < 10; i++) {
                assertThat(profiles.get(i).brandAffinity()).isEqualTo(i < 5 ? "Apple" : "Samsung");
                assertThat(profiles.get(i).excludes(Category.ELECTRONICS)).isEqualTo(i >= 8);
            }
        }
        assertThat(seeds.customers(Segment.STANDARD))
            .allSatisfy(p -> {
                assertThat(p.brandAffinity()).isNull();
                assertThat(p.exclusions()).isEmpty();
            });
    }

    @Test
    @DisplayName("should keep values within their ranges and before the reference instant")
    void shouldRespectRanges() {
        SeedCatalog seeds = build(42L);
        LocalDate today = LocalDate.of(2025, 1, 1);

        for (CustomerProfile profile : seeds.allCustomers()) {
            Segment segment = profile.customer().segment();
            assertThat(profile.customer().ltv().doubleValue()).isBetween(segment.minLtv(), segment.maxLtv());
            assertThat(profile.customer().registrationDate()).isBetween(today.minusDays(365), today.minusDays(30));
            assertThat(profile.customer().createdAt()).isEqualTo(AS_OF);
        }
        for (Product product : seeds.products(Category.ELECTRONICS, "Apple")) {
            assertThat(product.price().doubleValue()).isBetween(500.0, 2000.0);
            assertThat(product.launchDate()).isBeforeOrEqualTo(today);
        }
    }

    @Test
    @DisplayName("should be empty when seed patterns are disabled")
    void shouldBuildEmptyCatalog() {
        SeedCatalog empty = SeedCatalog.empty();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.customers(Segment.TOP_TIER, 0, 5)).isEmpty();
    }
}
