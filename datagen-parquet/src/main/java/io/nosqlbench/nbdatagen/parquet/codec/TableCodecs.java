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


import io.nosqlbench.nbdatagen.api.model.Customer;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Transaction;

import java.util.List;

/// The four generated tables, in the order they are written.
public final class TableCodecs {

  public static final TableCodec<Customer> CUSTOMERS = new CustomerCodec();
  public static final TableCodec<Product> PRODUCTS = new ProductCodec();
  public static final TableCodec<Transaction> TRANSACTIONS = new TransactionCodec();
  public static final TableCodec<Interaction> INTERACTIONS = new InteractionCodec();

  private static final List<TableCodec<?>> ALL = List.of(CUSTOMERS, PRODUCTS, TRANSACTIONS, INTERACTIONS);

  private TableCodecs() {
  }

  /// @return every table codec
  public static List<TableCodec<?>> all() {
    return ALL;
  }

  /// @param table a table name
  /// @return the codec of that table
  /// @throws IllegalArgumentException for an unknown table
  public static TableCodec<?> forTable(String table) {
    for (TableCodec<?> codec : ALL) {
      if (codec.table().equals(table)) {
        return codec;
      }
    }
    throw new IllegalArgumentException("Unknown table: " + table);
  }
}
