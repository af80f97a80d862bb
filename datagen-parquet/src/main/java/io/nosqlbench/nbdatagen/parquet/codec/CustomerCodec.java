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
import io.nosqlbench.nbdatagen.api.model.Segment;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.MessageType;

/// `customers` table: one row per seed or bulk customer. Segments are stored by label.
public final class CustomerCodec implements TableCodec<Customer> {

  private static final MessageType SCHEMA = new MessageType("customer",
      Columns.string("customer_id"),
      Columns.string("email"),
      Columns.string("name"),
      Columns.string("segment"),
      Columns.money("ltv"),
      Columns.date("registration_date"),
      Columns.timestamp("created_at"));

  @Override
  public String table() {
    return "customers";
  }

  @Override
  public MessageType schema() {
    return SCHEMA;
  }

  @Override
  public String idColumn() {
    return "customer_id";
  }

  @Override
  public void write(Customer row, Group group) {
    group.append("customer_id", row.customerId());
    group.append("email", row.email());
    group.append("name", row.name());
    group.append("segment", row.segment().label());
    Columns.putMoney(group, "ltv", row.ltv());
    Columns.putDate(group, "registration_date", row.registrationDate());
    Columns.putTimestamp(group, "created_at", row.createdAt());
  }

  @Override
  public Customer read(Group group) {
    return new Customer(
        Columns.getString(group, "customer_id"),
        Columns.getString(group, "email"),
        Columns.getString(group, "name"),
        Segment.of(Columns.getString(group, "segment")),
        Columns.getMoney(group, "ltv"),
        Columns.getDate(group, "registration_date"),
        Columns.getTimestamp(group, "created_at"));
  }
}
