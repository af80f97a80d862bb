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


import io.nosqlbench.nbdatagen.api.model.Channel;
import io.nosqlbench.nbdatagen.api.model.Transaction;
import io.nosqlbench.nbdatagen.api.model.TransactionStatus;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.MessageType;

/// `transactions` table.
public final class TransactionCodec implements TableCodec<Transaction> {

  private static final MessageType SCHEMA = new MessageType("transaction",
      Columns.string("transaction_id"),
      Columns.string("customer_id"),
      Columns.string("product_id"),
      Columns.money("amount"),
      Columns.int32("quantity"),
      Columns.timestamp("timestamp"),
      Columns.string("channel"),
      Columns.string("status"));

  @Override
  public String table() {
    return "transactions";
  }

  @Override
  public MessageType schema() {
    return SCHEMA;
  }

  @Override
  public String idColumn() {
    return "transaction_id";
  }

  @Override
  public void write(Transaction row, Group group) {
    group.append("transaction_id", row.transactionId());
    group.append("customer_id", row.customerId());
    group.append("product_id", row.productId());
    Columns.putMoney(group, "amount", row.amount());
    group.append("quantity", row.quantity());
    Columns.putTimestamp(group, "timestamp", row.timestamp());
    group.append("channel", row.channel().label());
    group.append("status", row.status().label());
  }

  @Override
  public Transaction read(Group group) {
    return new Transaction(
        Columns.getString(group, "transaction_id"),
        Columns.getString(group, "customer_id"),
        Columns.getString(group, "product_id"),
        Columns.getMoney(group, "amount"),
        group.getInteger("quantity", 0),
        Columns.getTimestamp(group, "timestamp"),
        Channel.of(Columns.getString(group, "channel")),
        TransactionStatus.of(Columns.getString(group, "status")));
  }
}
