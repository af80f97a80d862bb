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


/// Customer tiers. Each tier carries the lifetime-value range its customers are drawn from,
/// the mean purchase frequency used for transaction counts, and the multiplier applied to
/// product prices when computing transaction amounts.
///
/// The [#label()] is the value written to the `segment` column; downstream queries filter
/// on these labels.
public enum Segment {
  TOP_TIER("VIP", 8000, 30000, 25, 3.0),
  PREMIUM("Premium", 5000, 12000, 15, 2.2),
  STANDARD("Regular", 800, 3000, 8, 1.2),
  BASIC("Basic", 200, 1000, 4, 0.8),
  NEW("New", 50, 400, 2, 0.6);

  private final String label;
  private final double minLtv;
  private final double maxLtv;
  private final double purchaseFrequency;
  private final double amountMultiplier;

  Segment(String label, double minLtv, double maxLtv, double purchaseFrequency, double amountMultiplier) {
    this.label = label;
    this.minLtv = minLtv;
    this.maxLtv = maxLtv;
    this.purchaseFrequency = purchaseFrequency;
    this.amountMultiplier = amountMultiplier;
  }

  /// @return the column value for this segment
  public String label() {
    return label;
  }

  public double minLtv() {
    return minLtv;
  }

  public double maxLtv() {
    return maxLtv;
  }

  /// @return the Poisson mean for the number of transactions per customer
  public double purchaseFrequency() {
    return purchaseFrequency;
  }

  public double amountMultiplier() {
    return amountMultiplier;
  }

  /// High value segments are the ones eligible for brand-name affinities, category exclusions
  /// and the reduced-engagement override.
  /// @return true for [#TOP_TIER] and [#PREMIUM]
  public boolean isHighValue() {
    return this == TOP_TIER || this == PREMIUM;
  }

  /// Resolve a segment by either its enum name or its column label, ignoring case.
  /// @param name the name or label
  /// @return the matching segment
  /// @throws IllegalArgumentException if nothing matches
  public static Segment of(String name) {
    for (Segment segment : values()) {
      if (segment.name().equalsIgnoreCase(name) || segment.label.equalsIgnoreCase(name)) {
        return segment;
      }
    }
    throw new IllegalArgumentException("Unknown segment: " + name);
  }
}
