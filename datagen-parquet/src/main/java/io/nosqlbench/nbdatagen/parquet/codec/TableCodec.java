package io.nosqlbench.nbdatagen.parquet.codec;

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


import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.MessageType;

/// Maps one table's rows to and from Parquet [Group] records.
/// @param <T> the row type
public interface TableCodec<T> {

  /// @return the table name, which is also the name of its output directory
  String table();

  /// @return the Parquet schema of the table
  MessageType schema();

  /// Copy a row into an empty group of [#schema()].
  /// @param row the row
  /// @param group the target group
  void write(T row, Group group);

  /// Rebuild a row from a group read back from an artifact.
  /// @param group the source group
  /// @return the row
  T read(Group group);

  /// @return the name of the column holding the row identifier
  String idColumn();
}
