package io.nosqlbench.nbdatagen.core.patterns;

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


/// The structural patterns placed on seed entities.
public enum Pattern {
  BRAND_LOYALTY("brand_loyalty"),
  COLLABORATIVE("collaborative_filtering"),
  RECOMMENDATION_CHAIN("recommendation_chain"),
  PRODUCT_AFFINITY("product_affinity"),
  CATEGORY_EXPANSION("category_expansion"),
  CATEGORY_GAP("category_gap"),
  BASKET_WINDOW("basket_window"),
  CHURN_RISK("churn_risk"),
  DIVERSITY("diversity"),
  SEGMENT_COVERAGE("segment_coverage"),
  SEED_INTERACTIONS("seed_interactions");

  private final String label;

  Pattern(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
