package io.nosqlbench.nbdatagen.api.model;

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


import java.math.BigDecimal;
import java.math.RoundingMode;

/// Monetary values are carried as [BigDecimal] with two fractional digits.
public final class Money {

  /// Fractional digits of every monetary column
  public static final int SCALE = 2;

  private Money() {
  }

  /// Round a sampled value to a monetary amount.
  /// @param value the raw value
  /// @return the value rounded half-up to [#SCALE] digits
  public static BigDecimal of(double value) {
    return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
  }

  /// Multiply an amount by a factor, keeping monetary scale.
  /// @param amount the base amount
  /// @param factor the multiplier
  /// @return the product rounded half-up to [#SCALE] digits
  public static BigDecimal times(BigDecimal amount, double factor) {
    return amount.multiply(BigDecimal.valueOf(factor)).setScale(SCALE, RoundingMode.HALF_UP);
  }
}
