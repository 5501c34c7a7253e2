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

import io.lambdakernel.defaults.internal.expressions.DefaultExpressionEvaluator;
import io.lambdakernel.engine.Engine;
import io.lambdakernel.engine.ExpressionHandler;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.expressions.ExpressionEvaluator;
import io.lambdakernel.types.DataType;
import io.lambdakernel.types.StructType;

/** Default implementation of {@link ExpressionHandler} */
public class DefaultExpressionHandler implements ExpressionHandler {
  private final Engine engine;

  public DefaultExpressionHandler(Engine engine) {
    this.engine = requireNonNull(engine, "engine is null");
  }

  @Override
  public ExpressionEvaluator getEvaluator(
      StructType inputSchema, Expression expression, DataType outputType) {
    return new DefaultExpressionEvaluator(engine, inputSchema, expression, outputType);
  }
}
