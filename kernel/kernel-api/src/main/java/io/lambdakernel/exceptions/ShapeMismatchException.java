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
 * Thrown when two vectors that must describe the same rows have different row counts, for example
 * a captured column and the array column it is broadcast against.
 *
 * @since 1.0.0
 */
@Evolving
public class ShapeMismatchException extends KernelException {
  private final int expectedSize;
  private final int actualSize;

  public ShapeMismatchException(String context, int expectedSize, int actualSize) {
    super(
        String.format(
            "%s: expected %d rows but found %d rows", context, expectedSize, actualSize));
    this.expectedSize = expectedSize;
    this.actualSize = actualSize;
  }

  public int getExpectedSize() {
    return expectedSize;
  }

  public int getActualSize() {
    return actualSize;
  }
}
