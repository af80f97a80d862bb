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


/// Final status of a transaction.
public enum TransactionStatus {
  COMPLETED("completed"),
  CANCELLED("cancelled");

  private final String label;

  TransactionStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /// @param label the column label
  /// @return the constant with that label
  /// @throws IllegalArgumentException if nothing matches
  public static TransactionStatus of(String label) {
    for (TransactionStatus transactionStatus : values()) {
      if (transactionStatus.label.equals(label)) {
        return transactionStatus;
      }
    }
    throw new IllegalArgumentException("Unknown transaction status: " + label);
  }
}
