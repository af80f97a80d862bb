package io.nosqlbench.nbdatagen.api.iteration;

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
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/// A restartable sequence of rows presented as explicit chunks of at most `chunkSize`
/// rows. Each call to [#iterator()] re-iterates the underlying rows from the start, so the
/// sequence is restartable exactly when the wrapped [Iterable] is. Only one chunk is held in
/// memory at a time.
/// @param <T> the row type
public class ChunkedSequence<T> implements Iterable<List<T>> {

  private final Iterable<T> rows;
  private final int chunkSize;

  /// create a sequence of chunks over the given rows
  /// @param rows the rows to partition
  /// @param chunkSize the maximum number of rows per chunk
  public ChunkedSequence(Iterable<T> rows, int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("Chunk size must be positive, got: " + chunkSize);
    }
    this.rows = rows;
    this.chunkSize = chunkSize;
  }

  /// @return the maximum rows per chunk
  public int chunkSize() {
    return chunkSize;
  }

  @Override
  public Iterator<List<T>> iterator() {
    return new Iter<>(rows.iterator(), chunkSize);
  }

  /// An iterator of row chunks, all full except possibly the last.
  /// @param <T> the row type
  public static class Iter<T> implements Iterator<List<T>> {

    private final Iterator<T> iter;
    private final int chunkSize;
    private long chunks = 0L;

    /// @param iter the row iterator
    /// @param chunkSize the maximum rows per chunk
    public Iter(Iterator<T> iter, int chunkSize) {
      this.iter = iter;
      this.chunkSize = chunkSize;
    }

    @Override
    public boolean hasNext() {
      return iter.hasNext();
    }

    @Override
    public List<T> next() {
      if (!iter.hasNext()) {
        throw new NoSuchElementException("No more chunks after " + chunks);
      }
      List<T> chunk = new ArrayList<>(Math.min(chunkSize, 1024));
      while (chunk.size() < chunkSize && iter.hasNext()) {
        chunk.add(iter.next());
      }
      chunks++;
      return Collections.unmodifiableList(chunk);
    }
  }
}
