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
package io.lambdakernel.lambda;

import static java.util.Objects.requireNonNull;

import io.lambdakernel.annotation.Evolving;
import io.lambdakernel.expressions.Expression;
import java.util.Collections;
import java.util.List;

/**
 * An expression that refers to a registered lambda. It is only valid as the function argument of
 * {@code TRANSFORM}, either directly or as one of the branches of an {@code IF}.
 *
 * @since 1.0.0
 */
@Evolving
public final class LambdaExpression implements Expression {
  private final LambdaHandle lambda;

  public LambdaExpression(LambdaHandle lambda) {
    this.lambda = requireNonNull(lambda, "lambda is null");
  }

  public LambdaHandle getLambda() {
    return lambda;
  }

  /** The body is not a child: it is evaluated over elements, not over the enclosing rows. */
  @Override
  public List<Expression> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return "function(" + lambda.getName() + ")";
  }
}
