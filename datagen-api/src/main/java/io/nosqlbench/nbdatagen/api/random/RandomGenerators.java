package io.nosqlbench.nbdatagen.api.random;

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


import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * Provides seeded random number generators and the small set of sampling helpers the
 * generation stages share. Based on Apache Commons RNG, so every stream is reproducible
 * from its seed alone and independent of any process-wide random state.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     * XO_SHI_RO_256_PP is the default for its statistical quality and speed.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ algorithm - 256-bit state
         * Period: 2^256 - 1
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * SplitMix64 algorithm - 64-bit state
         * Period: 2^64
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm The PRNG algorithm to use
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a new random number generator with the default algorithm.
     *
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Draws an integer uniformly from an inclusive range.
     *
     * @param rng The random number generator
     * @param lower The lower bound (inclusive)
     * @param upper The upper bound (inclusive)
     * @return the drawn value
     */
    public static int nextIntBetween(UniformRandomProvider rng, int lower, int upper) {
        return lower + rng.nextInt(upper - lower + 1);
    }

    /**
     * Draws a double uniformly from [lower, upper).
     *
     * @param rng The random number generator
     * @param lower The lower bound (inclusive)
     * @param upper The upper bound (exclusive)
     * @return the drawn value
     */
    public static double nextDoubleBetween(UniformRandomProvider rng, double lower, double upper) {
        return lower + rng.nextDouble() * (upper - lower);
    }

    /**
     * Picks one element of a non-empty list uniformly.
     *
     * @param <T> The type of elements in the list
     * @param list The list to pick from
     * @param rng The random number generator
     * @return the chosen element
     */
    public static <T> T pick(List<T> list, UniformRandomProvider rng) {
        if (list.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return list.get(rng.nextInt(list.size()));
    }

    /**
     * Picks one constant of an enum uniformly.
     *
     * @param <E> The enum type
     * @param values The enum constants, as returned by {@code values()}
     * @param rng The random number generator
     * @return the chosen constant
     */
    public static <E extends Enum<E>> E pick(E[] values, UniformRandomProvider rng) {
        return values[rng.nextInt(values.length)];
    }

    /**
     * Shuffles a list in-place using the Fisher-Yates algorithm.
     *
     * @param <T> The type of elements in the list
     * @param list The list to shuffle
     * @param rng The random number generator
     */
    public static <T> void shuffle(List<T> list, UniformRandomProvider rng) {
        int size = list.size();
        for (int i = size - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            T temp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, temp);
        }
    }
}
