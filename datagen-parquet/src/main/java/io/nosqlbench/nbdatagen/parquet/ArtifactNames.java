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


import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/// Naming of the artifacts in a table directory.
///
/// A completed table directory holds either `<table>.parquet` or a run of
/// `<table>_batch_00000.parquet`, `<table>_batch_00001.parquet`, ... with the sequence
/// padded to at least five digits. Chunks are written under
/// a temporary name ending in [#TEMP_SUFFIX] first and renamed once complete, so anything
/// else in the directory is never mistaken for a completed artifact.
public final class ArtifactNames {

  public static final String EXTENSION = ".parquet";
  public static final String TEMP_SUFFIX = ".inprogress";
  private static final Pattern BATCH = Pattern.compile("(.+)_batch_(\\d{5,10})\\.parquet");

  private ArtifactNames() {
  }

  /// @param table the table name
  /// @param sequence the chunk sequence, starting at 0
  /// @return the artifact file name
  public static String batch(String table, int sequence) {
    return String.format(Locale.ROOT, "%s_batch_%05d%s", table, sequence, EXTENSION);
  }

  /// @param table the table name
  /// @return the name of the unpartitioned artifact
  public static String single(String table) {
    return table + EXTENSION;
  }

  /// @param artifact a completed artifact
  /// @return the temporary file the artifact is written to before the rename
  public static Path temp(Path artifact) {
    return artifact.resolveSibling(artifact.getFileName() + TEMP_SUFFIX);
  }

  /// @param table the table name
  /// @param fileName a file name
  /// @return the batch sequence of the file, if it is a batch artifact of the table
  public static OptionalInt sequence(String table, String fileName) {
    Matcher matcher = BATCH.matcher(fileName);
    if (matcher.matches() && matcher.group(1).equals(table)) {
      long sequence = Long.parseLong(matcher.group(2));
      if (sequence <= Integer.MAX_VALUE) {
        return OptionalInt.of((int) sequence);
      }
    }
    return OptionalInt.empty();
  }

  /// @param table the table name
  /// @param fileName a file name
  /// @return true for the single artifact and for batch artifacts of the table
  public static boolean isCompleted(String table, String fileName) {
    return fileName.equals(single(table)) || sequence(table, fileName).isPresent();
  }

  /// List the completed artifacts of a table directory: the single artifact first, then the
  /// batches in sequence order.
  /// @param table the table name
  /// @param directory the table directory; a missing directory has no artifacts
  /// @return the artifact paths
  /// @throws IOException if the directory cannot be listed
  public static List<Path> completed(String table, Path directory) throws IOException {
    List<Path> found = new ArrayList<>();
    if (!Files.isDirectory(directory)) {
      return found;
    }
    try (Stream<Path> files = Files.list(directory)) {
      files.filter(Files::isRegularFile)
          .filter(p -> isCompleted(table, p.getFileName().toString()))
          .forEach(found::add);
    }
    found.sort(Comparator.comparingInt(p -> sequence(table, p.getFileName().toString()).orElse(-1)));
    return found;
  }
}
