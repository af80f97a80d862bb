package io.nosqlbench.nbdatagen.api.config;

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


/// Raised when a generation configuration is invalid. Always raised before any
/// data is generated or written.
public class ConfigurationException extends RuntimeException {

  /// @param message what is wrong with the configuration
  public ConfigurationException(String message) {
    super(message);
  }

  /// @param message what is wrong with the configuration
  /// @param cause the underlying parse or lookup failure
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
