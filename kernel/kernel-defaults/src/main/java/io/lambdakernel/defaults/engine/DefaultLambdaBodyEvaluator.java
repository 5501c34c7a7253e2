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
package io.lambdakernel.defaults.engine;

import static java.util.Objects.requireNonNull;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.defaults.internal.data.DefaultColumnarBatch;
import io.lambdakernel.defaults.internal.expressions.DefaultExpressionEvaluator;
import io.lambdakernel.engine.Engine;
import io.lambdakernel.engine.LambdaBodyEvaluator;
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.types.DataType;
import java.util.List;

/**
 * Evaluates lambda bodies with {@link DefaultExpressionEvaluator}. The body sees a batch with the
 * lambda parameter as its first column followed by the captured columns.
 */
public class DefaultLambdaBodyEvaluator implements LambdaBodyEvaluator {
  private final Engine engine;

  public DefaultLambdaBodyEvaluator(Engine engine) {
    this.engine = requireNonNull(engine, "engine is null");
  }

  @Override
  public DataType resolveReturnType(LambdaHandle lambda, DataType elementType) {
    try {
      return new DefaultExpressionEvaluator(engine, lambda.getBodyInputSchema(), lambda.getBody())
          .getOutputType();
    } catch (UnsupportedOperationException | IllegalArgumentException e) {
      throw LambdaErrors.unsupportedLambdaBody(lambda.getName(), e);
    }
  }

  @Override
  public ColumnVector evaluate(
      LambdaHandle lambda, ColumnVector elements, List<ColumnVector> captures) {
    ColumnVector[] vectors = new ColumnVector[captures.size() + 1];
    vectors[0] = elements;
    for (int i = 0; i < captures.size(); i++) {
      vectors[i + 1] = captures.get(i);
    }
    DefaultColumnarBatch batch =
        new DefaultColumnarBatch(elements.getSize(), lambda.getBodyInputSchema(), vectors);
    try (DefaultExpressionEvaluator evaluator =
        new DefaultExpressionEvaluator(engine, lambda.getBodyInputSchema(), lambda.getBody())) {
      return evaluator.eval(batch);
    }
  }
}
