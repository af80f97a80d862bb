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


import io.nosqlbench.nbdatagen.api.model.Device;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.InteractionType;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.MessageType;

/// `interactions` table. The duration column holds seconds.
public final class InteractionCodec implements TableCodec<Interaction> {

  private static final MessageType SCHEMA = new MessageType("interaction",
      Columns.string("interaction_id"),
      Columns.string("customer_id"),
      Columns.string("product_id"),
      Columns.string("type"),
      Columns.timestamp("timestamp"),
      Columns.int32("duration"),
      Columns.string("device"),
      Columns.string("session_id"));

  @Override
  public String table() {
    return "interactions";
  }

  @Override
  public MessageType schema() {
    return SCHEMA;
  }

  @Override
  public String idColumn() {
    return "interaction_id";
  }

  @Override
  public void write(Interaction row, Group group) {
    group.append("interaction_id", row.interactionId());
    group.append("customer_id", row.customerId());
    group.append("product_id", row.productId());
    group.append("type", row.type().label());
    Columns.putTimestamp(group, "timestamp", row.timestamp());
    group.append("duration", row.durationSeconds());
    group.append("device", row.device().label());
    group.append("session_id", row.sessionId());
  }

  @Override
  public Interaction read(Group group) {
    return new Interaction(
        Columns.getString(group, "interaction_id"),
        Columns.getString(group, "customer_id"),
        Columns.getString(group, "product_id"),
        InteractionType.of(Columns.getString(group, "type")),
        Columns.getTimestamp(group, "timestamp"),
        group.getInteger("duration", 0),
        Device.of(Columns.getString(group, "device")),
        Columns.getString(group, "session_id"));
  }
}
