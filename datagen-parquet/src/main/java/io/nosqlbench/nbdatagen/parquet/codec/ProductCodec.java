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


import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Product;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.MessageType;

/// `products` table. Categories are stored by label.
public final class ProductCodec implements TableCodec<Product> {

  private static final MessageType SCHEMA = new MessageType("product",
      Columns.string("product_id"),
      Columns.string("name"),
      Columns.string("category"),
      Columns.string("brand"),
      Columns.money("price"),
      Columns.date("launch_date"),
      Columns.timestamp("created_at"));

  @Override
  public String table() {
    return "products";
  }

  @Override
  public MessageType schema() {
    return SCHEMA;
  }

  @Override
  public String idColumn() {
    return "product_id";
  }

  @Override
  public void write(Product row, Group group) {
    group.append("product_id", row.productId());
    group.append("name", row.name());
    group.append("category", row.category().label());
    group.append("brand", row.brand());
    Columns.putMoney(group, "price", row.price());
    Columns.putDate(group, "launch_date", row.launchDate());
    Columns.putTimestamp(group, "created_at", row.createdAt());
  }

  @Override
  public Product read(Group group) {
    return new Product(
        Columns.getString(group, "product_id"),
        Columns.getString(group, "name"),
        Category.of(Columns.getString(group, "category")),
        Columns.getString(group, "brand"),
        Columns.getMoney(group, "price"),
        Columns.getDate(group, "launch_date"),
        Columns.getTimestamp(group, "created_at"));
  }
}
