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


import io.nosqlbench.nbdatagen.api.model.Money;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/// Column types and value conversions shared by the table codecs.
///
/// | kind      | physical | logical                    |
/// |-----------|----------|----------------------------|
/// | string    | BINARY   | STRING                     |
/// | money     | INT64    | DECIMAL(18, 2)             |
/// | timestamp | INT64    | TIMESTAMP(MILLIS, UTC)     |
/// | date      | INT32    | DATE                       |
/// | int       | INT32    | INT(32, signed)            |
public final class Columns {

  /// Precision of monetary columns
  public static final int MONEY_PRECISION = 18;

  private Columns() {
  }

  public static PrimitiveType string(String name) {
    return Types.required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named(name);
  }

  public static PrimitiveType money(String name) {
    return Types.required(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.decimalType(Money.SCALE, MONEY_PRECISION)).named(name);
  }

  public static PrimitiveType timestamp(String name) {
    return Types.required(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.timestampType(true, LogicalTypeAnnotation.TimeUnit.MILLIS)).named(name);
  }

  public static PrimitiveType date(String name) {
    return Types.required(PrimitiveTypeName.INT32).as(LogicalTypeAnnotation.dateType()).named(name);
  }

  public static PrimitiveType int32(String name) {
    return Types.required(PrimitiveTypeName.INT32).as(LogicalTypeAnnotation.intType(32, true)).named(name);
  }

  /// @param group the target group
  /// @param field the column
  /// @param value a monetary amount; must not carry more than two fractional digits
  public static void putMoney(Group group, String field, BigDecimal value) {
    group.append(field, value.setScale(Money.SCALE, RoundingMode.UNNECESSARY).unscaledValue().longValueExact());
  }

  public static BigDecimal getMoney(Group group, String field) {
    return BigDecimal.valueOf(group.getLong(field, 0), Money.SCALE);
  }

  public static void putTimestamp(Group group, String field, Instant value) {
    group.append(field, value.toEpochMilli());
  }

  public static Instant getTimestamp(Group group, String field) {
    return Instant.ofEpochMilli(group.getLong(field, 0));
  }

  public static void putDate(Group group, String field, LocalDate value) {
    group.append(field, Math.toIntExact(value.toEpochDay()));
  }

  public static LocalDate getDate(Group group, String field) {
    return LocalDate.ofEpochDay(group.getInteger(field, 0));
  }

  public static String getString(Group group, String field) {
    return group.getString(field, 0);
  }
}
