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

package io.nosqlbench.nbdatagen.core;

import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CatalogIndex and GenerationContext")
class GenerationContextTest {

    private static Product product(String id, Category category, String brand) {
        return new Product(id, id, category, brand, new BigDecimal("10.00"), LocalDate.of(2024, 1, 1),
            Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("should look up products by category and brand")
    void shouldIndexProducts() {
        CatalogIndex index = CatalogIndex.of(List.of(
            product("a", Category.ELECTRONICS, "Apple"),
            product("b", Category.ELECTRONICS, "Sony"),
            product("c", Category.SPORTS, "Nike"),
            product("d", Category.CLOTHING, "Nike")));

        assertThat(index.size()).isEqualTo(4);
        assertThat(index.byCategory(Category.ELECTRONICS)).extracting(Product::productId).containsExactly("a", "b");
        assertThat(index.byBrand("Nike")).extracting(Product::productId).containsExactly("c", "d");
        assertThat(index.byCategoryAndBrand(Category.CLOTHING, "Nike")).extracting(Product::productId)
            .containsExactly("d");
        assertThat(index.byCategoryAndBrand(Category.BOOKS, "Nike")).isEmpty();
        assertThat(index.brands(Category.ELECTRONICS)).containsExactly("Apple", "Sony");
        assertThat(index.contains("c")).isTrue();
        assertThat(index.contains("z")).isFalse();
    }

    @Test
    @DisplayName("should reject duplicate product ids")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> CatalogIndex.of(List.of(
            product("a", Category.HOME, "IKEA"),
            product("a", Category.HOME, "Wayfair"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("context should index seed and bulk products and put seeds first")
    void shouldPrepareContext() {
        GenerationConfig config = GenerationConfig.builder().customers(100).products(50).build();
        GenerationContext context = GenerationContext.prepare(config);

        assertThat(context.catalog().size()).isEqualTo(45 + 50);
        assertThat(context.catalog().all().subList(0, 45)).isEqualTo(context.seedCatalog().allProducts());
        assertThat(context.populationSize()).isEqualTo(100);
        assertThat(context.reservedCustomerIds()).hasSize(3);

        List<CustomerProfile> population = new ArrayList<>();
        context.population().forEach(population::add);
        assertThat(population).hasSize(100);
        assertThat(population.get(0).customer().segment()).isEqualTo(Segment.TOP_TIER);
        assertThat(population.get(0).customer().email()).startsWith("seed_");
    }

    @Test
    @DisplayName("context without seed patterns should have no seed rows")
    void shouldPrepareWithoutSeeds() {
        GenerationConfig config = GenerationConfig.builder().customers(100).products(50)
            .includeSeedPatterns(false).build();
        GenerationContext context = GenerationContext.prepare(config);

        assertThat(context.catalog().size()).isEqualTo(50);
        assertThat(context.populationSize()).isEqualTo(100);
        assertThat(context.reservedCustomerIds()).isEmpty();
    }

    @Test
    @DisplayName("customer count should include the seed customers")
    void shouldHoldExactlyTheConfiguredCustomers() {
        GenerationContext context = GenerationContext.prepare(
            GenerationConfig.builder().customers(1_000).products(50).build());

        assertThat(context.seedCatalog().allCustomers()).hasSize(50);
        assertThat(context.entities().customerCount()).isEqualTo(950L);
        assertThat(context.populationSize()).isEqualTo(1_000L);

        long counted = 0;
        for (CustomerProfile ignored : context.population()) {
            counted++;
        }
        assertThat(counted).isEqualTo(1_000L);
    }
}
