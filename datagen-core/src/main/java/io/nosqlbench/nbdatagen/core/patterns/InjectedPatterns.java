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


import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.Transaction;

import java.util.List;

/// Rows placed by the pattern injector.
///
/// @param transactions pattern transactions in placement order
/// @param interactions seed interactions in placement order
/// @param report what was applied and skipped
public record InjectedPatterns(List<Transaction> transactions, List<Interaction> interactions,
                               PatternReport report) {

  public InjectedPatterns {
    transactions = List.copyOf(transactions);
    interactions = List.copyOf(interactions);
  }
}
