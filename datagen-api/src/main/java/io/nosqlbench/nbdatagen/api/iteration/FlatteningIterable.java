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


import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/// An [Iterable] of [O], wrapping the given [Iterable] of [I]
/// and function to convert an [I] -> [Iterable] of [O]
public class FlatteningIterable<I, O> implements Iterable<O> {
  private final Iterable<I> inner;
  private final Function<I, ? extends Iterable<? extends O>> function;

  public FlatteningIterable(Iterable<I> inner, Function<I, ? extends Iterable<? extends O>> function) {
    this.inner = inner;
    this.function = function;
  }

  /// Concatenate sequences end to end.
  /// @param parts the sequences, iterated in order
  /// @param <O> the element type
  /// @return an iterable that restarts every part on each iteration
  @SafeVarargs
  public static <O> Iterable<O> concat(Iterable<? extends O>... parts) {
    List<Iterable<? extends O>> list = Arrays.asList(parts);
    return new FlatteningIterable<Iterable<? extends O>, O>(list, Function.identity());
  }

  /// @param <O> the element type
  /// @return an iterable with no elements
  public static <O> Iterable<O> empty() {
    return Collections.emptyList();
  }

  @Override
  public Iterator<O> iterator() {
    return new FlatteningIterator<>(inner, function);
  }

  public static class FlatteningIterator<I, O> implements Iterator<O> {
    private final Function<I, ? extends Iterable<? extends O>> function;
    private final Iterator<I> inputIter;
    private Iterator<? extends O> outputIter = Collections.emptyIterator();

    public FlatteningIterator(Iterable<I> innerIterable, Function<I, ? extends Iterable<? extends O>> function) {
      this.function = function;
      this.inputIter = innerIterable.iterator();
    }

    @Override
    public boolean hasNext() {
      while (!outputIter.hasNext()) {
        if (!inputIter.hasNext()) {
          return false;
        }
        outputIter = function.apply(inputIter.next()).iterator();
      }
      return true;
    }

    @Override
    public O next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return outputIter.next();
    }
  }
}
