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


import io.nosqlbench.nbdatagen.parquet.codec.TableCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/// Reads a written table back, artifact by artifact in sequence order and row group by row
/// group within each artifact.
/// @param <T> the row type
public class BatchArtifactReader<T> implements Iterable<T> {

  private static final Logger logger = LogManager.getLogger(BatchArtifactReader.class);

  private final TableCodec<T> codec;
  private final List<Path> artifacts;

  /// @param codec the table codec
  /// @param outputRoot the directory holding all table directories
  /// @throws UncheckedIOException if the table directory cannot be listed
  public BatchArtifactReader(TableCodec<T> codec, Path outputRoot) {
    this.codec = codec;
    try {
      this.artifacts = ArtifactNames.completed(codec.table(), outputRoot.resolve(codec.table()));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /// @return the completed artifacts, in reading order
  public List<Path> artifacts() {
    return artifacts;
  }

  /// @return the total row count from the artifact footers, without reading any rows
  /// @throws UncheckedIOException if a footer cannot be read
  public long rowCount() {
    long rows = 0L;
    for (Path artifact : artifacts) {
      try (ParquetFileReader reader = ParquetFileReader.open(new LocalInputFile(artifact))) {
        rows += reader.getRecordCount();
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to read footer of " + artifact, e);
      }
    }
    return rows;
  }

  @Override
  public Iterator<T> iterator() {
    return new RowIterator(artifacts.iterator());
  }

  /// @param artifact one artifact of this table
  /// @return the rows of that artifact alone
  public Iterable<T> rows(Path artifact) {
    return () -> new RowIterator(List.of(artifact).iterator());
  }

  private final class RowIterator implements Iterator<T> {
    private final Iterator<Path> files;
    private ParquetFileReader fileReader;
    private MessageColumnIO columnIO;
    private MessageType schema;
    private RecordReader<Group> records;
    private long remaining;

    private RowIterator(Iterator<Path> files) {
      this.files = files;
    }

    @Override
    public boolean hasNext() {
      try {
        while (remaining == 0L) {
          if (fileReader != null) {
            PageReadStore rowGroup = fileReader.readNextRowGroup();
            if (rowGroup != null) {
              records = columnIO.getRecordReader(rowGroup, new GroupRecordConverter(schema));
              remaining = rowGroup.getRowCount();
              continue;
            }
            fileReader.close();
            fileReader = null;
          }
          if (!files.hasNext()) {
            return false;
          }
          Path path = files.next();
          logger.debug("Reading {}", path);
          fileReader = ParquetFileReader.open(new LocalInputFile(path));
          schema = fileReader.getFooter().getFileMetaData().getSchema();
          columnIO = new ColumnIOFactory().getColumnIO(schema);
        }
        return true;
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      remaining--;
      return codec.read(records.read());
    }
  }
}
