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

package io.nosqlbench.nbdatagen.api.random;

import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RandomStreams and DeterministicIds")
class RandomStreamsTest {

    @Test
    @DisplayName("should restart a stream on every call")
    void shouldRestartStreams() {
        RandomStreams streams = RandomStreams.of(42L);

        UniformRandomProvider first = streams.stream(StreamKind.CUSTOMERS);
        UniformRandomProvider second = streams.stream(StreamKind.CUSTOMERS);

        for (int i = 0; i < 100; i++) {
            assertThat(first.nextLong()).isEqualTo(second.nextLong());
        }
    }

    @Test
    @DisplayName("should keep streams independent of each other")
    void shouldSeparateStreams() {
        RandomStreams streams = RandomStreams.of(42L);

        assertThat(streams.seedOf(StreamKind.CUSTOMERS)).isEqualTo(42L + 1_000L);
        assertThat(streams.stream(StreamKind.CUSTOMERS).nextLong())
            .isNotEqualTo(streams.stream(StreamKind.PRODUCTS).nextLong());
    }

    @Test
    @DisplayName("should honor configured offsets")
    void shouldHonorOffsets() {
        RandomStreams streams = new RandomStreams(
            RandomGenerators.Algorithm.SPLIT_MIX_64, 10L, Map.of(StreamKind.PATTERNS, 5L));

        assertThat(streams.seedOf(StreamKind.PATTERNS)).isEqualTo(15L);
        assertThat(streams.seedOf(StreamKind.INTERACTIONS)).isEqualTo(5_010L);
    }

    @Test
    @DisplayName("name based ids should be stable")
    void shouldBuildStableNameIds() {
        String id = DeterministicIds.nameBased("seed-customer:VIP:0");

        assertThat(id).isEqualTo(DeterministicIds.nameBased("seed-customer:VIP:0"));
        assertThat(id).isNotEqualTo(DeterministicIds.nameBased("seed-customer:VIP:1"));
        assertThat(UUID.fromString(id).version()).isEqualTo(3);
    }

    @Test
    @DisplayName("indexed ids should be unique per index and recomputable")
    void shouldBuildIndexedIds() {
        Set<String> ids = new HashSet<>();
        for (long i = 0; i < 50_000; i++) {
            ids.add(DeterministicIds.indexed(1042L, 1L, i));
        }

        assertThat(ids).hasSize(50_000);
        assertThat(DeterministicIds.indexed(1042L, 1L, 17L))
            .isEqualTo(DeterministicIds.indexed(1042L, 1L, 17L))
            .isNotEqualTo(DeterministicIds.indexed(1042L, 2L, 17L));
        UUID uuid = UUID.fromString(DeterministicIds.indexed(1042L, 1L, 3L));
        assertThat(uuid.version()).isEqualTo(4);
        assertThat(uuid.variant()).isEqualTo(2);
    }

    @Test
    @DisplayName("stream ids should follow the stream")
    void shouldBuildStreamIds() {
        RandomStreams streams = RandomStreams.of(7L);

        String a = DeterministicIds.next(streams.stream(StreamKind.TRANSACTIONS));
        String b = DeterministicIds.next(streams.stream(StreamKind.TRANSACTIONS));

        assertThat(a).isEqualTo(b);
        assertThat(UUID.fromString(a).version()).isEqualTo(4);
    }

    @Test
    @DisplayName("nextIntBetween should stay within inclusive bounds")
    void shouldDrawInclusiveRange() {
        UniformRandomProvider rng = RandomGenerators.create(3L);
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            int v = RandomGenerators.nextIntBetween(rng, 1, 3);
            assertThat(v).isBetween(1, 3);
            seen.add(v);
        }
        assertThat(seen).containsExactlyInAnyOrder(1, 2, 3);
    }
}
