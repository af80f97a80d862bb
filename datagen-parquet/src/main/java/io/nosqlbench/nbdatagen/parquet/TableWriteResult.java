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


import java.nio.file.Path;
import java.util.List;

/// The outcome of writing one table.
///
/// @param table the table name
/// @param layout how the table was laid out
/// @param rows rows written to completed artifacts
/// @param artifacts completed artifacts; for a skipped table, the ones already present
/// @param failures chunks that could not be persisted
public record TableWriteResult(
    String table,
    Layout layout,
    long rows,
    List<Path> artifacts,
    List<FailedBatch> failures
) {

  /// How a table directory is laid out
  public enum Layout {
    /// one unpartitioned artifact
    SINGLE,
    /// a run of batch artifacts
    BATCHED,
    /// left alone because completed artifacts were present
    SKIPPED,
    /// abandoned before any chunk could be attempted
    FAILED
  }

  public TableWriteResult {
    artifacts = List.copyOf(artifacts);
    failures = List.copyOf(failures);
  }

  /// @param table the table name
  /// @param existing the completed artifacts already present
  /// @return a result for a table that was not written
  public static TableWriteResult skipped(String table, List<Path> existing) {
    return new TableWriteResult(table, Layout.SKIPPED, 0L, existing, List.of());
  }

  /// A table whose writer gave up as a whole, for instance because its directory could not
  /// be prepared.
  /// @param table the table name
  /// @param error the failure
  /// @return a result carrying one failure that names the whole table
  public static TableWriteResult failed(String table, Throwable error) {
    String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    return new TableWriteResult(table, Layout.FAILED, 0L, List.of(),
        List.of(new FailedBatch(table, table + "/", 0, 1, message)));
  }

  public boolean isSkipped() {
    return layout == Layout.SKIPPED;
  }

  /// @return true if every chunk was persisted
  public boolean isSuccess() {
    return failures.isEmpty();
  }
}
