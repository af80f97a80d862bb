package io.nosqlbench.nbdatagen.core.patterns;

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


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/// What the pattern injector placed, and what it had to skip.
public final class PatternReport {

  /// Outcome of one pattern.
  /// @param pattern the pattern
  /// @param applied whether any rows were placed for it
  /// @param rows number of transactions, or interactions for [Pattern#SEED_INTERACTIONS]
  /// @param detail free form detail, the reason when skipped
  public record Entry(Pattern pattern, boolean applied, int rows, String detail) {
  }

  private final List<Entry> entries = new ArrayList<>();

  void applied(Pattern pattern, int rows, String detail) {
    entries.add(new Entry(pattern, true, rows, detail));
  }

  void skipped(Pattern pattern, String reason) {
    entries.add(new Entry(pattern, false, 0, reason));
  }

  public List<Entry> entries() {
    return Collections.unmodifiableList(entries);
  }

  /// @param pattern a pattern
  /// @return its entry, if the pattern was attempted
  public Optional<Entry> entry(Pattern pattern) {
    return entries.stream().filter(e -> e.pattern() == pattern).findFirst();
  }

  public List<Entry> skipped() {
    return entries.stream().filter(e -> !e.applied()).toList();
  }

  /// @return the number of rows placed over all applied patterns
  public int totalRows() {
    return entries.stream().mapToInt(Entry::rows).sum();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Entry entry : entries) {
      sb.append(String.format("%-24s %-8s %6d  %s%n", entry.pattern().label(),
          entry.applied() ? "applied" : "skipped", entry.rows(), entry.detail()));
    }
    return sb.toString();
  }
}
