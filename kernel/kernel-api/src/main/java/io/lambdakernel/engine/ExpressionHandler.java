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
import io.lambdakernel.data.ColumnarBatch;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.expressions.ExpressionEvaluator;
import io.lambdakernel.types.DataType;
import io.lambdakernel.types.StructType;

/**
 * Provides expression evaluation capability, including the {@code TRANSFORM} higher-order
 * function.
 *
 * @since 1.0.0
 */
@Evolving
public interface ExpressionHandler {

  /**
   * Create an {@link ExpressionEvaluator} that can evaluate the given <i>expression</i> on {@link
   * ColumnarBatch}s with the given <i>inputSchema</i>. The <i>expression</i> is expected to be a
   * scalar expression where for each one input row there is a one output value. Lambdas used by
   * the expression are bound against the schema here, so signature mismatches surface from this
   * call rather than from evaluation.
   *
   * @param inputSchema Input data schema
   * @param expression Expression to evaluate.
   * @param outputType Expected result data type.
   */
  ExpressionEvaluator getEvaluator(
      StructType inputSchema, Expression expression, DataType outputType);
}
