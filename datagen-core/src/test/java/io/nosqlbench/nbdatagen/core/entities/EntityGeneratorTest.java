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

package io.nosqlbench.nbdatagen.core.entities;

import io.nosqlbench.nbdatagen.api.config.ConfigurationException;
import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EntityGenerator")
class EntityGeneratorTest {

    private static GenerationConfig config(long customers) {
        return GenerationConfig.builder().customers(customers).products(600).seed(42L)
            .includeSeedPatterns(false).build();
    }

    @Nested
    @DisplayName("Customers")
    class CustomersTest {

        @Test
        @DisplayName("segment frequencies should converge to the weights")
        void shouldMatchSegmentWeights() {
            GenerationConfig config = config(100_000);
            EnumMap<Segment, Integer> counts = new EnumMap<>(Segment.class);
            for (CustomerProfile profile : new EntityGenerator(config).customers()) {
                counts.merge(profile.customer().segment(), 1, Integer::sum);
            }

            for (Segment segment : Segment.values()) {
                double observed = counts.getOrDefault(segment, 0) / 100_000.0d;
                assertThat(observed)
                    .as("frequency of %s", segment)
                    .isCloseTo(config.segmentWeights().weight(segment), within(0.01d));
            }
        }

        @Test
        @DisplayName("should yield the same customers on every pass")
        void shouldRestart() {
            EntityGenerator generator = new EntityGenerator(config(500));

            assertThat(collect(generator.customers())).isEqualTo(collect(generator.customers()));
        }

        @Test
        @DisplayName("should yield the same customers for the same seed")
        void shouldBeDeterministic() {
            List<CustomerProfile> first = collect(new EntityGenerator(config(300)).customers());
            List<CustomerProfile> second = collect(new EntityGenerator(config(300)).customers());
            List<CustomerProfile> other = collect(new EntityGenerator(
                config(300).toBuilder().seed(43L).build()).customers());

            assertThat(first).hasSize(300).isEqualTo(second).isNotEqualTo(other);
        }

        @Test
        @DisplayName("ids should be computable from the index")
        void shouldComputeIdsByIndex() {
            EntityGenerator generator = new EntityGenerator(config(200));
            List<CustomerProfile> customers = collect(generator.customers());

            for (int i = 0; i < customers.size(); i += 17) {
                assertThat(generator.customerId(i)).isEqualTo(customers.get(i).customerId());
            }
            assertThat(customers).extracting(CustomerProfile::customerId).doesNotHaveDuplicates();
            assertThatThrownBy(() -> generator.customerId(200)).isInstanceOf(IndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("ltv and registration cohorts should stay in range")
        void shouldRespectRanges() {
            List<CustomerProfile> customers = collect(new EntityGenerator(config(2_000)).customers());
            LocalDate asOf = LocalDate.of(2025, 1, 1);

            for (int i = 0; i < customers.size(); i++) {
                CustomerProfile profile = customers.get(i);
                Segment segment = profile.customer().segment();
                assertThat(profile.customer().ltv().doubleValue()).isBetween(segment.minLtv(), segment.maxLtv());
                assertThat(profile.customer().registrationDate()).isEqualTo(asOf.minusDays(365 - 30L * (i % 12)));
                if (!segment.isHighValue()) {
                    assertThat(profile.exclusions()).isEmpty();
                }
                profile.affinity().ifPresent(brand -> assertThat(
                    segment.isHighValue() ? EntityGenerator.HIGH_VALUE_BRANDS : EntityGenerator.VALUE_BRANDS)
                    .contains(brand));
            }
            long withAffinity = customers.stream().filter(p -> p.brandAffinity() != null).count();
            assertThat(withAffinity / 2_000.0d).isCloseTo(0.30d, within(0.05d));
        }

        @Test
        @DisplayName("iterating past the end should fail")
        void shouldEndIteration() {
            Iterator<CustomerProfile> iter = new EntityGenerator(config(1)).customers().iterator();
            iter.next();

            assertThat(iter.hasNext()).isFalse();
            assertThatThrownBy(iter::next).isInstanceOf(java.util.NoSuchElementException.class);
        }
    }

    @Nested
    @DisplayName("Products")
    class ProductsTest {

        @Test
        @DisplayName("prices and brands should follow the category")
        void shouldRespectCategories() {
            List<Product> products = new EntityGenerator(config(10)).products();

            assertThat(products).hasSize(600);
            for (Product product : products) {
                Category category = product.category();
                assertThat(product.price().doubleValue()).isBetween(category.minPrice(), category.maxPrice());
                assertThat(category.brands()).contains(product.brand());
                assertThat(product.launchDate()).isBeforeOrEqualTo(LocalDate.of(2025, 1, 1));
            }
            assertThat(products.get(0).name()).endsWith("Product 1");
            assertThat(products).extracting(Product::productId).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("should honor category weights")
        void shouldHonorCategoryWeights() {
            Map<Category, Double> onlyBooks = new EnumMap<>(Category.class);
            onlyBooks.put(Category.BOOKS, 1.0d);
            GenerationConfig config = config(10).toBuilder().categoryWeights(onlyBooks).build();

            assertThat(new EntityGenerator(config).products())
                .allSatisfy(p -> assertThat(p.category()).isEqualTo(Category.BOOKS));
        }

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic() {
            assertThat(new EntityGenerator(config(10)).products())
                .isEqualTo(new EntityGenerator(config(10)).products());
        }
    }

    @Test
    @DisplayName("weights that do not sum to one fail before generation")
    void shouldRejectBadWeights() {
        Map<Segment, Double> weights = new EnumMap<>(Segment.class);
        weights.put(Segment.TOP_TIER, 0.9d);

        assertThatThrownBy(() -> config(10).toBuilder().segmentWeights(weights).build())
            .isInstanceOf(ConfigurationException.class);
    }

    private static <T> List<T> collect(Iterable<T> iterable) {
        List<T> list = new ArrayList<>();
        iterable.forEach(list::add);
        return list;
    }
}
