package io.nosqlbench.nbdatagen.parquet;

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
import io.nosqlbench.nbdatagen.api.iteration.ChunkedSequence;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/// Persists one table as immutable chunks under `<output>/<table>/`.
///
/// # Resumability
///
/// A table directory that already holds completed artifacts is left alone unless
/// overwrite is on, in which case every artifact and leftover temporary file is removed
/// first. Each chunk goes to a temporary file that is renamed into place atomically once
/// the write has finished, so a crashed run never leaves a partial artifact under a
/// completed name.
///
/// # Layout
///
/// Rows are cut into chunks of `batchSize`. Chunks are buffered until either more than
/// `singleFileThreshold` rows have been seen or the rows run out. If they run out first the
/// table is written as the single artifact `<table>.parquet`; otherwise every chunk becomes
/// `<table>_batch_<sequence>.parquet` with sequences counting up from 0.
///
/// # Failures
///
/// Each chunk is attempted through the [RetryPolicy]. A chunk that still fails is recorded
/// as a [FailedBatch], its sequence number stays unused, and writing continues.
/// @param <T> the row type
public class BatchWriter<T> {

  private static final Logger logger = LogManager.getLogger(BatchWriter.class);

  private final Path outputRoot;
  private final TableCodec<T> codec;
  private final ChunkWriter<T> chunkWriter;
  private final RetryPolicy retry;
  private final int batchSize;
  private final int singleFileThreshold;
  private final boolean overwrite;

  /// @param outputRoot the directory holding all table directories
  /// @param codec the table codec
  /// @param chunkWriter writes one chunk file
  /// @param retry retry policy for chunk writes
  /// @param batchSize rows per batch artifact
  /// @param singleFileThreshold tables with at most this many rows get a single artifact
  /// @param overwrite whether to replace completed artifacts
  public BatchWriter(Path outputRoot, TableCodec<T> codec, ChunkWriter<T> chunkWriter, RetryPolicy retry,
                     int batchSize, int singleFileThreshold, boolean overwrite) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be positive, got: " + batchSize);
    }
    this.outputRoot = outputRoot;
    this.codec = codec;
    this.chunkWriter = chunkWriter;
    this.retry = retry;
    this.batchSize = batchSize;
    this.singleFileThreshold = singleFileThreshold;
    this.overwrite = overwrite;
  }

  /// A Parquet writer for one table, configured from a generation configuration.
  /// @param <T> the row type
  /// @param config the configuration
  /// @param codec the table codec
  /// @return the writer
  public static <T> BatchWriter<T> of(GenerationConfig config, TableCodec<T> codec) {
    return new BatchWriter<>(config.outputDirectory(), codec,
        new ParquetChunkWriter<>(codec, config.compression()), RetryPolicy.of(config.retry()),
        config.batchSize(), config.singleFileThreshold(), config.overwrite());
  }

  /// @return the directory this table is written to
  public Path tableDirectory() {
    return outputRoot.resolve(codec.table());
  }

  /// Write the table.
  /// @param rows the rows in output order; iterated exactly once
  /// @return the outcome
  /// @throws UncheckedIOException if the table directory cannot be prepared
  public TableWriteResult write(Iterable<T> rows) {
    String table = codec.table();
    Path directory = tableDirectory();
    try {
      Files.createDirectories(directory);
      List<Path> existing = ArtifactNames.completed(table, directory);
      if (!existing.isEmpty() && !overwrite) {
        logger.info("Skipping {}: {} completed artifacts present in {}", table, existing.size(), directory);
        return TableWriteResult.skipped(table, existing);
      }
      purge(directory, !existing.isEmpty());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to prepare table directory " + directory, e);
    }

    Iterator<List<T>> chunks = new ChunkedSequence<>(rows, batchSize).iterator();
    List<List<T>> pending = new ArrayList<>();
    long buffered = 0L;
    while (chunks.hasNext() && buffered <= singleFileThreshold) {
      List<T> chunk = chunks.next();
      pending.add(chunk);
      buffered += chunk.size();
    }

    Progress progress = new Progress(table);
    if (!chunks.hasNext() && buffered <= singleFileThreshold) {
      List<T> all = new ArrayList<>((int) buffered);
      pending.forEach(all::addAll);
      persist(directory.resolve(ArtifactNames.single(table)), all, progress);
      logger.info("Wrote {} rows of {} as a single artifact", progress.rows, table);
      return progress.result(TableWriteResult.Layout.SINGLE);
    }

    int sequence = 0;
    for (List<T> chunk : pending) {
      persist(directory.resolve(ArtifactNames.batch(table, sequence++)), chunk, progress);
    }
    pending.clear();
    while (chunks.hasNext()) {
      persist(directory.resolve(ArtifactNames.batch(table, sequence++)), chunks.next(), progress);
    }
    logger.info("Wrote {} rows of {} in {} batches, {} failed", progress.rows, table, sequence,
        progress.failures.size());
    return progress.result(TableWriteResult.Layout.BATCHED);
  }

  private void persist(Path artifact, List<T> rows, Progress progress) {
    Path temp = ArtifactNames.temp(artifact);
    String description = "write " + artifact.getFileName();
    try {
      retry.run(description, () -> {
        chunkWriter.write(temp, rows);
        Files.move(temp, artifact, StandardCopyOption.ATOMIC_MOVE);
      });
      progress.rows += rows.size();
      progress.artifacts.add(artifact);
      logger.debug("Completed {} with {} rows", artifact.getFileName(), rows.size());
    } catch (IOException e) {
      logger.error("Giving up on {} after {} attempts: {}", artifact.getFileName(), retry.maxAttempts(),
          e.getMessage(), e);
      progress.failures.add(new FailedBatch(codec.table(), artifact.getFileName().toString(), rows.size(),
          retry.maxAttempts(), String.valueOf(e.getMessage())));
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        logger.warn("Failed to clean up temporary file {}", temp, cleanup);
      }
    }
  }

  // removes completed artifacts when asked to, and temporary leftovers always
  private void purge(Path directory, boolean artifacts) throws IOException {
    String table = codec.table();
    List<Path> doomed = new ArrayList<>();
    try (Stream<Path> files = Files.list(directory)) {
      files.filter(Files::isRegularFile).forEach(p -> {
        String name = p.getFileName().toString();
        if (name.endsWith(ArtifactNames.TEMP_SUFFIX) || (artifacts && ArtifactNames.isCompleted(table, name))) {
          doomed.add(p);
        }
      });
    }
    for (Path path : doomed) {
      Files.delete(path);
    }
    if (!doomed.isEmpty()) {
      logger.info("Removed {} existing files from {}", doomed.size(), directory);
    }
  }

  private final class Progress {
    private final String table;
    private final List<Path> artifacts = new ArrayList<>();
    private final List<FailedBatch> failures = new ArrayList<>();
    private long rows = 0L;

    private Progress(String table) {
      this.table = table;
    }

    private TableWriteResult result(TableWriteResult.Layout layout) {
      return new TableWriteResult(table, layout, rows, artifacts, failures);
    }
  }
}
