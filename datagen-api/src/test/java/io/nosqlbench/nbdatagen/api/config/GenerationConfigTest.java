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

package io.nosqlbench.nbdatagen.api.config;

import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Segment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GenerationConfig")
class GenerationConfigTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultsTest {

        @Test
        @DisplayName("should use the small tier, seed 42 and snappy")
        void shouldUseDocumentedDefaults() {
            GenerationConfig config = GenerationConfig.defaults();

            assertThat(config.customerCount()).isEqualTo(1_000_000L);
            assertThat(config.scaleTier()).isEqualTo(ScaleTier.SMALL);
            assertThat(config.productCount()).isEqualTo(10_000);
            assertThat(config.seed()).isEqualTo(42L);
            assertThat(config.batchSize()).isEqualTo(100_000);
            assertThat(config.singleFileThreshold()).isEqualTo(100_000);
            assertThat(config.compression()).isEqualTo(Compression.SNAPPY);
            assertThat(config.overwrite()).isFalse();
            assertThat(config.includeSeedPatterns()).isTrue();
            assertThat(config.asOf()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
            assertThat(config.outputDirectory()).isEqualTo(Path.of("data"));
            assertThat(config.retry()).isEqualTo(new RetrySettings(3, Duration.ofSeconds(5)));
            assertThat(config.threads()).isEqualTo(1);
        }

        @Test
        @DisplayName("should size the transaction estimate by tier")
        void shouldEstimateTransactionsPerTier() {
            assertThat(ScaleTier.SMALL.averageTransactions()).isEqualTo(8);
            assertThat(ScaleTier.MEDIUM.averageTransactions()).isEqualTo(10);
            assertThat(ScaleTier.LARGE.averageTransactions()).isEqualTo(12);
            assertThat(ScaleTier.SMALL.expectedTransactions(GenerationConfig.defaults().customerCount()))
                .isEqualTo(8_000_000L);
            assertThat(ScaleTier.LARGE.expectedTransactions(100_000_000L)).isEqualTo(1_200_000_000L);
        }

        @Test
        @DisplayName("should weight segments 0.10/0.20/0.30/0.25/0.15")
        void shouldUseDefaultSegmentWeights() {
            CategoricalWeights<Segment> weights = GenerationConfig.defaults().segmentWeights();

            assertThat(weights.weight(Segment.TOP_TIER)).isEqualTo(0.10d);
            assertThat(weights.weight(Segment.PREMIUM)).isEqualTo(0.20d);
            assertThat(weights.weight(Segment.STANDARD)).isEqualTo(0.30d);
            assertThat(weights.weight(Segment.BASIC)).isEqualTo(0.25d);
            assertThat(weights.weight(Segment.NEW)).isEqualTo(0.15d);
        }

        @Test
        @DisplayName("should weight categories uniformly")
        void shouldUseUniformCategoryWeights() {
            double[] p = GenerationConfig.defaults().categoryWeights().probabilities();

            assertThat(p).hasSize(Category.values().length);
            for (double v : p) {
                assertThat(v).isCloseTo(1.0d / 6, within(1e-12));
            }
        }
    }

    @Nested
    @DisplayName("Scale tiers")
    class ScaleTierTest {

        @ParameterizedTest
        @CsvSource({
            "1, SMALL",
            "1000000, SMALL",
            "1000001, MEDIUM",
            "10000000, MEDIUM",
            "10000001, LARGE",
            "100000000, LARGE"
        })
        @DisplayName("should derive the tier from the customer count")
        void shouldDeriveTier(long customers, ScaleTier expected) {
            assertThat(ScaleTier.forCustomerCount(customers)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should take the catalog size from the tier unless set")
        void shouldTakeProductCountFromTier() {
            GenerationConfig medium = GenerationConfig.builder().scaleTier(ScaleTier.MEDIUM).build();
            assertThat(medium.customerCount()).isEqualTo(10_000_000L);
            assertThat(medium.productCount()).isEqualTo(25_000);

            GenerationConfig explicit = GenerationConfig.builder().customers(500).products(40).build();
            assertThat(explicit.productCount()).isEqualTo(40);
        }

        @Test
        @DisplayName("should count seed customers as part of the customer count")
        void shouldSplitSeedAndBulkCustomers() {
            GenerationConfig tenMillion = GenerationConfig.builder().customers(10_000_000L).build();
            assertThat(tenMillion.seedCustomerCount()).isEqualTo(50L);
            assertThat(tenMillion.bulkCustomerCount()).isEqualTo(9_950_000L);

            GenerationConfig withoutSeeds = GenerationConfig.builder().customers(10_000_000L)
                .includeSeedPatterns(false).build();
            assertThat(withoutSeeds.seedCustomerCount()).isZero();
            assertThat(withoutSeeds.bulkCustomerCount()).isEqualTo(10_000_000L);

            GenerationConfig fewerSeeds = GenerationConfig.builder().customers(100).seedCustomersPerSegment(3).build();
            assertThat(fewerSeeds.bulkCustomerCount()).isEqualTo(85L);
        }

        @Test
        @DisplayName("should reject an unknown tier name")
        void shouldRejectUnknownTier() {
            assertThatThrownBy(() -> ScaleTier.of("huge"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("huge");
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTest {

        @Test
        @DisplayName("should reject segment weights that do not sum to one")
        void shouldRejectBadSegmentWeights() {
            Map<Segment, Double> weights = new EnumMap<>(Segment.class);
            weights.put(Segment.TOP_TIER, 0.5d);
            weights.put(Segment.NEW, 0.4d);

            assertThatThrownBy(() -> GenerationConfig.builder().segmentWeights(weights))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sum to 1.0");
        }

        @Test
        @DisplayName("should accept weights that sum to one within tolerance")
        void shouldAcceptWeightsWithinTolerance() {
            Map<Segment, Double> weights = new EnumMap<>(Segment.class);
            weights.put(Segment.TOP_TIER, 0.3333333d);
            weights.put(Segment.PREMIUM, 0.3333333d);
            weights.put(Segment.STANDARD, 0.3333334d);

            GenerationConfig config = GenerationConfig.builder().segmentWeights(weights).build();
            assertThat(config.segmentWeights().weight(Segment.BASIC)).isZero();
        }

        @Test
        @DisplayName("should reject negative weights")
        void shouldRejectNegativeWeights() {
            Map<Category, Double> weights = new EnumMap<>(Category.class);
            weights.put(Category.BOOKS, 1.5d);
            weights.put(Category.HOME, -0.5d);

            assertThatThrownBy(() -> CategoricalWeights.of(Category.class, weights))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("non-negative");
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1})
        @DisplayName("should reject non-positive batch sizes")
        void shouldRejectBatchSize(int batchSize) {
            assertThatThrownBy(() -> GenerationConfig.builder().batchSize(batchSize).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Batch size");
        }

        @Test
        @DisplayName("should reject non-positive customer counts")
        void shouldRejectCustomerCount() {
            assertThatThrownBy(() -> GenerationConfig.builder().customers(0).build())
                .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a customer count smaller than the seed customers")
        void shouldRejectCountBelowSeedCustomers() {
            assertThatThrownBy(() -> GenerationConfig.builder().customers(49).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("50 seed customers");
            assertThat(GenerationConfig.builder().customers(50).build().bulkCustomerCount()).isZero();
            assertThat(GenerationConfig.builder().customers(49).includeSeedPatterns(false).build()
                .bulkCustomerCount()).isEqualTo(49L);
        }

        @Test
        @DisplayName("should reject a low engagement probability outside [0,1]")
        void shouldRejectProbability() {
            assertThatThrownBy(() -> GenerationConfig.builder().lowEngagementProbability(1.5d).build())
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> GenerationConfig.builder().lowEngagementProbability(Double.NaN).build())
                .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject zero retry attempts")
        void shouldRejectRetryAttempts() {
            assertThatThrownBy(() -> GenerationConfig.builder().retryAttempts(0).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Retry attempts");
        }

        @Test
        @DisplayName("should reject zero threads")
        void shouldRejectThreads() {
            assertThatThrownBy(() -> GenerationConfig.builder().threads(0).build())
                .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Compression")
    class CompressionTest {

        @ParameterizedTest
        @CsvSource({
            "snappy, SNAPPY",
            "GZIP, GZIP",
            "lz4, LZ4",
            " zstd , ZSTD",
            "uncompressed, UNCOMPRESSED"
        })
        @DisplayName("should resolve codec names")
        void shouldResolveNames(String name, Compression expected) {
            assertThat(Compression.of(name)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should reject unknown codec names")
        void shouldRejectUnknownCodec() {
            assertThatThrownBy(() -> GenerationConfig.builder().compression("brotli"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("brotli");
        }
    }

    @Test
    @DisplayName("toBuilder should reproduce an equal configuration")
    void shouldRoundTripThroughBuilder() {
        GenerationConfig config = GenerationConfig.builder()
            .customers(1234)
            .products(77)
            .seed(9)
            .batchSize(100)
            .singleFileThreshold(10)
            .compression(Compression.GZIP)
            .overwrite(true)
            .threads(3)
            .build();

        GenerationConfig copy = config.toBuilder().build();

        assertThat(copy.toString()).isEqualTo(config.toString());
        assertThat(copy.singleFileThreshold()).isEqualTo(10);
        assertThat(copy.segmentWeights()).isEqualTo(config.segmentWeights());
    }
}
