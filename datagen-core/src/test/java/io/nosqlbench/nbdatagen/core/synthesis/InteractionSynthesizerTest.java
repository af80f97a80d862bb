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

package io.nosqlbench.nbdatagen.core.synthesis;

import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import io.nosqlbench.nbdatagen.core.GenerationContext;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InteractionSynthesizer and RecencyTimestampSampler")
class InteractionSynthesizerTest {

    private static final Instant AS_OF = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    @DisplayName("should yield interactionsPerCustomer times the bulk customer count")
    void shouldYieldConfiguredCount() {
        GenerationContext context = GenerationContext.prepare(GenerationConfig.builder()
            .customers(250).products(60).interactionsPerCustomer(3).build());
        InteractionSynthesizer synthesizer = new InteractionSynthesizer(context);

        List<Interaction> interactions = new ArrayList<>();
        synthesizer.interactions().forEach(interactions::add);

        assertThat(synthesizer.count()).isEqualTo(600L);
        assertThat(interactions).hasSize(600);

        Set<String> bulkIds = new HashSet<>();
        context.entities().customers().forEach(p -> bulkIds.add(p.customerId()));
        assertThat(interactions).allSatisfy(i -> {
            assertThat(bulkIds).contains(i.customerId());
            assertThat(context.catalog().contains(i.productId())).isTrue();
            assertThat(i.durationSeconds()).isBetween(10, 300);
            assertThat(i.timestamp()).isBeforeOrEqualTo(AS_OF).isAfter(AS_OF.minus(Duration.ofDays(182)));
        });
        assertThat(interactions).extracting(Interaction::interactionId).doesNotHaveDuplicates();

        List<Interaction> again = new ArrayList<>();
        synthesizer.interactions().forEach(again::add);
        assertThat(again).isEqualTo(interactions);
    }

    @Test
    @DisplayName("recency buckets should split 60/30/10 over 90, 180 and 365 days")
    void shouldBiasTowardsRecentPurchases() {
        UniformRandomProvider rng = RandomGenerators.create(11L);
        RecencyTimestampSampler sampler = new RecencyTimestampSampler(rng, AS_OF);
        long ninety = Duration.ofDays(90).getSeconds();
        long halfYear = Duration.ofDays(180).getSeconds();
        int[] buckets = new int[3];
        int n = 20_000;
        for (int i = 0; i < n; i++) {
            Instant ts = sampler.sample();
            assertThat(ts).isBeforeOrEqualTo(AS_OF).isAfterOrEqualTo(AS_OF.minus(Duration.ofDays(365)));
            long back = Duration.between(ts, AS_OF).getSeconds();
            buckets[back <= ninety ? 0 : back <= halfYear ? 1 : 2]++;
        }
        assertThat((double) buckets[0] / n).isBetween(0.57d, 0.63d);
        assertThat((double) buckets[1] / n).isBetween(0.27d, 0.33d);
        assertThat((double) buckets[2] / n).isBetween(0.08d, 0.12d);
    }

    @Test
    @DisplayName("daysBefore should stay within its day range")
    void shouldKeepDaysBeforeInRange() {
        UniformRandomProvider rng = RandomGenerators.create(3L);
        Instant earliest = AS_OF.minus(Duration.ofDays(365));
        Instant latest = AS_OF.minus(Duration.ofDays(180));
        boolean nearEarliest = false;
        for (int i = 0; i < 10_000; i++) {
            Instant ts = RecencyTimestampSampler.daysBefore(rng, AS_OF, 180, 365);
            assertThat(ts).isBetween(earliest, latest);
            nearEarliest |= Duration.between(earliest, ts).toDays() < 1;
        }
        assertThat(nearEarliest).isTrue();
        assertThat(RecencyTimestampSampler.daysBefore(rng, AS_OF, 30, 30)).isEqualTo(AS_OF.minus(Duration.ofDays(30)));
    }

    @Test
    @DisplayName("clamp should never move a timestamp past the reference instant")
    void shouldClamp() {
        assertThat(RecencyTimestampSampler.clamp(AS_OF.plusSeconds(5), AS_OF)).isEqualTo(AS_OF);
        assertThat(RecencyTimestampSampler.clamp(AS_OF.minusSeconds(5), AS_OF)).isEqualTo(AS_OF.minusSeconds(5));
    }

    @Test
    @DisplayName("seed customers should not receive bulk interactions")
    void shouldOnlyUseBulkCustomers() {
        GenerationContext context = GenerationContext.prepare(GenerationConfig.builder()
            .customers(100).products(20).interactionsPerCustomer(2).build());
        Set<String> seedIds = new HashSet<>();
        for (CustomerProfile profile : context.seedCatalog().allCustomers()) {
            seedIds.add(profile.customerId());
        }

        new InteractionSynthesizer(context).interactions()
            .forEach(i -> assertThat(seedIds).doesNotContain(i.customerId()));
    }
}
