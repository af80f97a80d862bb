package io.nosqlbench.nbdatagen.command.run;

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


import io.nosqlbench.nbdatagen.core.patterns.PatternReport;
import io.nosqlbench.nbdatagen.parquet.FailedBatch;
import io.nosqlbench.nbdatagen.parquet.TableWriteResult;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/// The outcome of a generation run.
///
/// @param tables per table write results, in table order
/// @param patterns which seed patterns were placed
/// @param elapsed wall time of the run
public record RunReport(List<TableWriteResult> tables, PatternReport patterns, Duration elapsed) {

  public RunReport {
    tables = List.copyOf(tables);
  }

  /// @return true if any chunk could not be persisted
  public boolean hasFailures() {
    return tables.stream().anyMatch(t -> !t.isSuccess());
  }

  /// @return rows written over all tables in this run
  public long totalRows() {
    return tables.stream().mapToLong(TableWriteResult::rows).sum();
  }

  /// @return a printable per table summary followed by the pattern report
  public String summary() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%-14s %-8s %12s %9s %7s%n", "table", "layout", "rows", "artifacts", "failed"));
    for (TableWriteResult table : tables) {
      sb.append(String.format("%-14s %-8s %12d %9d %7d%n", table.table(), table.layout().name().toLowerCase(Locale.ROOT),
          table.rows(), table.artifacts().size(), table.failures().size()));
      for (FailedBatch failure : table.failures()) {
        sb.append("  failed: ").append(failure).append(System.lineSeparator());
      }
    }
    sb.append(System.lineSeparator()).append("patterns").append(System.lineSeparator());
    sb.append(patterns);
    sb.append(String.format("%ntotal rows %d in %.1fs%n", totalRows(), elapsed.toMillis() / 1000.0d));
    return sb.toString();
  }
}
