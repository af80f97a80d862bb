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

public enum Device {
  DESKTOP("desktop"),
  MOBILE("mobile"),
  TABLET("tablet");

  private final String label;

  Device(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /// @param label the column label
  /// @return the constant with that label
  /// @throws IllegalArgumentException if nothing matches
  public static Device of(String label) {
    for (Device device : values()) {
      if (device.label.equals(label)) {
        return device;
      }
    }
    throw new IllegalArgumentException("Unknown device: " + label);
  }
}
