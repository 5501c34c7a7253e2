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
package io.lambdakernel.engine;

import io.lambdakernel.annotation.Evolving;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.types.DataType;
import java.util.List;

/**
 * Evaluates a lambda body over a flattened vector of array elements.
 *
 * <p>Implementations must be reentrant: the same handle is evaluated concurrently for different
 * batches and for different row groups of one batch.
 *
 * @since 1.0.0
 */
@Evolving
public interface LambdaBodyEvaluator {

  /**
   * Resolve the static return type of the lambda body when its parameter is bound to elements of
   * type {@code elementType}. Called once at bind time.
   *
   * @throws io.lambdakernel.exceptions.SignatureMismatchException if the body cannot be typed
   */
  DataType resolveReturnType(LambdaHandle lambda, DataType elementType);

  /**
   * Evaluate the lambda body once per element.
   *
   * @param lambda the lambda to evaluate
   * @param elements the element parameter values, one per element
   * @param captures one vector per {@link LambdaHandle#getCaptures()} field, in the same order,
   *     each of the same size as {@code elements}
   * @return a vector of the resolved return type with exactly {@code elements.getSize()} values
   */
  ColumnVector evaluate(LambdaHandle lambda, ColumnVector elements, List<ColumnVector> captures);
}
