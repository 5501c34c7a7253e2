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
 * Thrown when a vector references positions outside of the buffers it wraps: array offsets and
 * lengths beyond the elements vector, or dictionary indices beyond the base vector. This indicates
 * an upstream invariant violation, not a user error.
 *
 * @since 1.0.0
 */
@Evolving
public class CorruptVectorException extends KernelException {
  public CorruptVectorException(String message) {
    super(message);
  }
}
