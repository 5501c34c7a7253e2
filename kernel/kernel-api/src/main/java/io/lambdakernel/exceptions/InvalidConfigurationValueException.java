/*
 * Copyright (2024) The Delta Lake Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.lambdakernel.exceptions;

import io.lambdakernel.annotation.Evolving;

/**
 * Thrown when an illegal value is specified for a configuration property.
 *
 * @since 1.0.0
 */
@Evolving
public class InvalidConfigurationValueException extends KernelException {
  public InvalidConfigurationValueException(String key, String value, String helpMessage) {
    super(
        String.format(
            "Invalid value for configuration '%s': '%s'. %s", key, value, helpMessage));
  }
}
