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
package io.lambdakernel.defaults.internal.transform;

import io.lambdakernel.engine.LambdaBodyEvaluator;
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.types.DataType;
import io.lambdakernel.types.StructField;
import io.lambdakernel.types.StructType;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds lambdas to a {@code TRANSFORM} call site. All checks run when the expression is bound, so
 * that a mismatching signature fails before any batch is evaluated.
 */
public final class LambdaBinder {
  private LambdaBinder() {}

  /**
   * Bind one lambda.
   *
   * @param lambda the lambda to bind
   * @param elementType element type of the array the lambda is applied to
   * @param inputSchema schema of the rows the call site evaluates; captured columns are read
   *     from it by name
   * @param bodyEvaluator resolves the return type of the body
   * @throws io.lambdakernel.exceptions.SignatureMismatchException if the parameter type does not
   *     accept the elements, a captured column is missing or has another type, or the body
   *     cannot be typed
   */
  public static BoundLambda bind(
      LambdaHandle lambda,
      DataType elementType,
      StructType inputSchema,
      LambdaBodyEvaluator bodyEvaluator) {
    if (!lambda.getParameterType().equivalent(elementType)) {
      throw LambdaErrors.parameterTypeMismatch(
          lambda.getName(), lambda.getParameterType(), elementType);
    }
    for (StructField capture : lambda.getCaptures().fields()) {
      StructField supplied = inputSchema.get(capture.getName());
      if (supplied == null) {
        throw LambdaErrors.missingCaptureColumn(lambda.getName(), capture.getName(), inputSchema);
      }
      if (!supplied.getDataType().equivalent(capture.getDataType())) {
        throw LambdaErrors.captureTypeMismatch(
            lambda.getName(), capture.getName(), capture.getDataType(), supplied.getDataType());
      }
    }
    DataType returnType = bodyEvaluator.resolveReturnType(lambda, elementType);
    return new BoundLambda(lambda, elementType, returnType);
  }

  /**
   * Bind the candidate lambdas of a conditional transform. Every candidate must return the same
   * type so that rows evaluated by different lambdas form one result array type.
   */
  public static List<BoundLambda> bindAll(
      List<LambdaHandle> lambdas,
      DataType elementType,
      StructType inputSchema,
      LambdaBodyEvaluator bodyEvaluator) {
    List<BoundLambda> bound = new ArrayList<>(lambdas.size());
    for (LambdaHandle lambda : lambdas) {
      BoundLambda candidate = bind(lambda, elementType, inputSchema, bodyEvaluator);
      if (!bound.isEmpty()) {
        BoundLambda first = bound.get(0);
        if (!first.getReturnType().equivalent(candidate.getReturnType())) {
          throw LambdaErrors.returnTypeMismatch(
              candidate.getName(),
              candidate.getReturnType(),
              first.getName(),
              first.getReturnType());
        }
      }
      bound.add(candidate);
    }
    return bound;
  }
}
