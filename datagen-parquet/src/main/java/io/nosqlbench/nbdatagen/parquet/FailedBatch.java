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


/// A chunk that could not be persisted after all retries.
///
/// @param table the table name
/// @param artifact the artifact name the chunk was meant to have
/// @param rows the number of rows in the chunk
/// @param attempts the attempts made
/// @param error the message of the last failure
public record FailedBatch(String table, String artifact, int rows, int attempts, String error) {

  @Override
  public String toString() {
    return artifact + " (" + rows + " rows, " + attempts + " attempts): " + error;
  }
}
