package io.nosqlbench.nbdatagen.command.common;

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


import picocli.CommandLine;

/**
 * Shared master seed option using the {@link Seed} record with automatic parsing.
 * When the option is absent the seed from the configuration file or environment applies,
 * and failing those the fixed default of {@value #DEFAULT_SEED}.
 */
public class RandomSeedOption {

    /** Master seed used when nothing else sets one */
    public static final long DEFAULT_SEED = 42L;

    /**
     * Immutable master seed specification.
     *
     * @param value the seed value, or null when not given on the command line
     */
    public record Seed(Long value) {

        public Seed(long value) {
            this(Long.valueOf(value));
        }

        public Seed() {
            this((Long) null);
        }

        /**
         * Gets the seed value, or the given fallback when none was specified.
         */
        public long orElse(long fallback) {
            return value != null ? value : fallback;
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "unset (default " + DEFAULT_SEED + ")";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }
            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer."
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Master random seed; every table stream is derived from it (default: " + DEFAULT_SEED + ")",
        converter = SeedConverter.class
    )
    private Seed seed;

    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
