package io.nosqlbench.nbdatagen.command.verify;

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


import java.util.List;
import java.util.Map;

/// What [ArtifactVerifier] found in an output directory.
///
/// @param rowCounts rows per table, for tables that have artifacts
/// @param artifactCounts completed artifacts per table
/// @param missingTables tables without any completed artifact
/// @param duplicateIds rows whose identifier was already seen in the same dimension table, or in
///     the same artifact of a fact table
/// @param danglingCustomers transaction and interaction rows naming an unknown customer
/// @param danglingProducts transaction and interaction rows naming an unknown product
public record VerificationReport(
    Map<String, Long> rowCounts,
    Map<String, Integer> artifactCounts,
    List<String> missingTables,
    long duplicateIds,
    long danglingCustomers,
    long danglingProducts
) {

  public VerificationReport {
    rowCounts = Map.copyOf(rowCounts);
    artifactCounts = Map.copyOf(artifactCounts);
    missingTables = List.copyOf(missingTables);
  }

  /// @return true if every table is present and all references resolve
  public boolean isValid() {
    return missingTables.isEmpty() && duplicateIds == 0 && danglingCustomers == 0 && danglingProducts == 0;
  }

  /// @param tableOrder the order to list tables in
  /// @return a printable summary
  public String summary(List<String> tableOrder) {
    StringBuilder sb = new StringBuilder();
    for (String table : tableOrder) {
      if (missingTables.contains(table)) {
        sb.append(String.format("%-14s missing%n", table));
      } else {
        sb.append(String.format("%-14s %12d rows in %d artifacts%n", table, rowCounts.get(table),
            artifactCounts.get(table)));
      }
    }
    sb.append(String.format("duplicate ids %d, dangling customer refs %d, dangling product refs %d%n",
        duplicateIds, danglingCustomers, danglingProducts));
    sb.append(isValid() ? "OK" : "INVALID").append(System.lineSeparator());
    return sb.toString();
  }
}
