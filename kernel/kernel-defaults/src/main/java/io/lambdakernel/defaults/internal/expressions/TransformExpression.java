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
package io.lambdakernel.defaults.internal.expressions;

import static java.util.Objects.requireNonNull;

import io.lambdakernel.defaults.internal.transform.BoundLambda;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.types.ArrayType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@code TRANSFORM} after binding: the array input, the lambdas bound to its element type and,
 * when more than one lambda is given, the condition selecting a lambda per row.
 */
final class TransformExpression implements Expression {
  private final Expression array;
  private final Optional<Expression> condition;
  private final List<BoundLambda> lambdas;

  TransformExpression(Expression array, Optional<Expression> condition, List<BoundLambda> lambdas) {
    this.array = requireNonNull(array, "array is null");
    this.condition = requireNonNull(condition, "condition is null");
    this.lambdas = Collections.unmodifiableList(new ArrayList<>(lambdas));
  }

  Expression getArray() {
    return array;
  }

  Optional<Expression> getCondition() {
    return condition;
  }

  List<BoundLambda> getLambdas() {
    return lambdas;
  }

  ArrayType getOutputType() {
    return lambdas.get(0).getResultType();
  }

  @Override
  public List<Expression> getChildren() {
    List<Expression> children = new ArrayList<>(2);
    children.add(array);
    condition.ifPresent(children::add);
    return children;
  }

  @Override
  public String toString() {
    List<String> functions =
        lambdas.stream()
            .map(lambda -> "function(" + lambda.getName() + ")")
            .collect(Collectors.toList());
    if (!condition.isPresent()) {
      return String.format("TRANSFORM(%s, %s)", array, functions.get(0));
    }
    return String.format(
        "TRANSFORM(%s, IF(%s, %s))", array, condition.get(), String.join(", ", functions));
  }
}
