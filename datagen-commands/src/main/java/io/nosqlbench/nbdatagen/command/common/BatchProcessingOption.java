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


import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import picocli.CommandLine;

/**
 * Shared options for partitioning output and running tables in parallel.
 * Options left unset keep whatever the configuration file or environment provided.
 */
public class BatchProcessingOption {

    /**
     * Immutable batch processing overrides; null members are not overridden.
     *
     * @param threads             number of tables written concurrently
     * @param batchSize           rows per batch artifact
     * @param singleFileThreshold tables with at most this many rows get one artifact
     */
    public record BatchConfig(Integer threads, Integer batchSize, Integer singleFileThreshold) {

        public BatchConfig {
            if (threads != null && threads < 1) {
                throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
            }
            if (batchSize != null && batchSize <= 0) {
                throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            }
            if (singleFileThreshold != null && singleFileThreshold < 0) {
                throw new IllegalArgumentException("Single file threshold cannot be negative: " + singleFileThreshold);
            }
        }

        /**
         * Applies the given overrides to a configuration builder.
         */
        public GenerationConfig.Builder applyTo(GenerationConfig.Builder builder) {
            if (threads != null) {
                builder.threads(threads);
            }
            if (batchSize != null) {
                builder.batchSize(batchSize);
            }
            if (singleFileThreshold != null) {
                builder.singleFileThreshold(singleFileThreshold);
            }
            return builder;
        }

        @Override
        public String toString() {
            return "threads=" + (threads != null ? threads : "default")
                + ", batchSize=" + (batchSize != null ? batchSize : "default")
                + ", singleFileThreshold=" + (singleFileThreshold != null ? singleFileThreshold : "default");
        }
    }

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of tables written concurrently (default: 1)"
    )
    private Integer threads;

    @CommandLine.Option(
        names = {"--batch-size"},
        description = "Rows per batch artifact (default: 100000)"
    )
    private Integer batchSize;

    @CommandLine.Option(
        names = {"--single-file-threshold"},
        description = "Tables with at most this many rows are written as one artifact (default: the batch size)"
    )
    private Integer singleFileThreshold;

    /**
     * Gets the BatchConfig record constructed from the options.
     * Validation happens when the record is created.
     */
    public BatchConfig getBatchConfig() {
        return new BatchConfig(threads, batchSize, singleFileThreshold);
    }

    public void validate() {
        getBatchConfig();
    }

    @Override
    public String toString() {
        return getBatchConfig().toString();
    }
}
