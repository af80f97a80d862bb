package io.nosqlbench.nbdatagen.api.random;

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


/// The independent random streams of a generation run. Each stream is seeded with the
/// master seed plus its offset, so changing how many values one stage draws never shifts
/// the values another stage sees.
public enum StreamKind {
  SEED_CATALOG(0L),
  CUSTOMERS(1_000L),
  PRODUCTS(2_000L),
  PATTERNS(3_000L),
  TRANSACTIONS(4_000L),
  INTERACTIONS(5_000L);

  private final long defaultOffset;

  StreamKind(long defaultOffset) {
    this.defaultOffset = defaultOffset;
  }

  /// @return the offset added to the master seed unless configured otherwise
  public long defaultOffset() {
    return defaultOffset;
  }
}
