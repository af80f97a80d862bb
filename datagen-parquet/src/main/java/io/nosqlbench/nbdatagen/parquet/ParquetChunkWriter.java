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


import io.nosqlbench.nbdatagen.api.config.Compression;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// Writes chunks as Parquet files through the example [Group] object model.
/// @param <T> the row type
public class ParquetChunkWriter<T> implements ChunkWriter<T> {

  private static final Logger logger = LogManager.getLogger(ParquetChunkWriter.class);

  private final TableCodec<T> codec;
  private final CompressionCodecName compression;
  private final SimpleGroupFactory groups;

  /// @param codec the table codec
  /// @param compression the compression codec of written files
  public ParquetChunkWriter(TableCodec<T> codec, Compression compression) {
    this.codec = codec;
    this.compression = codecName(compression);
    this.groups = new SimpleGroupFactory(codec.schema());
  }

  /// @param compression a configured codec
  /// @return the Parquet codec; `lz4` maps to the framing-free `LZ4_RAW`
  public static CompressionCodecName codecName(Compression compression) {
    switch (compression) {
      case SNAPPY:
        return CompressionCodecName.SNAPPY;
      case GZIP:
        return CompressionCodecName.GZIP;
      case LZ4:
        return CompressionCodecName.LZ4_RAW;
      case ZSTD:
        return CompressionCodecName.ZSTD;
      case UNCOMPRESSED:
        return CompressionCodecName.UNCOMPRESSED;
      default:
        throw new IllegalArgumentException("Unsupported compression: " + compression);
    }
  }

  @Override
  public void write(Path target, List<T> rows) throws IOException {
    try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalOutputFile(target))
        .withType(codec.schema())
        .withCompressionCodec(compression)
        .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
        .build()) {
      for (T row : rows) {
        Group group = groups.newGroup();
        codec.write(row, group);
        writer.write(group);
      }
    }
    logger.debug("Wrote {} {} rows to {}", rows.size(), codec.table(), target);
  }
}
