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
 * Thrown when a lambda's formal parameters or captured columns do not match what the call site
 * supplies. Raised when a lambda is registered or bound to an input schema, never while a batch is
 * being evaluated.
 *
 * @since 1.0.0
 */
@Evolving
public class SignatureMismatchException extends KernelException {
  private final String lambdaName;

  public SignatureMismatchException(String lambdaName, String message) {
    super(String.format("Signature mismatch for lambda `%s`: %s", lambdaName, message));
    this.lambdaName = lambdaName;
  }

  public SignatureMismatchException(String lambdaName, String message, Throwable cause) {
    super(String.format("Signature mismatch for lambda `%s`: %s", lambdaName, message), cause);
    this.lambdaName = lambdaName;
  }

  /** @return name of the lambda whose signature did not match */
  public String getLambdaName() {
    return lambdaName;
  }
}
