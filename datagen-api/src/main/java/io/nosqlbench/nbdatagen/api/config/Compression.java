package io.nosqlbench.nbdatagen.api.config;

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


import java.util.Locale;

/// Compression codecs available for written artifacts, addressed by their lower case name.
public enum Compression {
  SNAPPY,
  GZIP,
  LZ4,
  ZSTD,
  UNCOMPRESSED;

  /// @return the configuration name of this codec
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /// Resolve a codec by name.
  /// @param name one of `snappy`, `gzip`, `lz4`, `zstd` or `uncompressed`
  /// @return the codec
  /// @throws ConfigurationException for any other name
  public static Compression of(String name) {
    if (name == null || name.isBlank()) {
      throw new ConfigurationException("Compression codec name is empty");
    }
    for (Compression compression : values()) {
      if (compression.label().equals(name.trim().toLowerCase(Locale.ROOT))) {
        return compression;
      }
    }
    throw new ConfigurationException("Unknown compression codec '" + name
        + "', expected one of snappy, gzip, lz4, zstd, uncompressed");
  }
}
