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
import java.nio.file.Path;
import java.util.List;

/// Writes one chunk of rows to one file.
/// @param <T> the row type
@FunctionalInterface
public interface ChunkWriter<T> {

  /// Write all rows to the target, replacing any file already there.
  /// @param target the file to write
  /// @param rows the rows, in output order
  /// @throws IOException If an I/O error occurs during writing
  void write(Path target, List<T> rows) throws IOException;
}
