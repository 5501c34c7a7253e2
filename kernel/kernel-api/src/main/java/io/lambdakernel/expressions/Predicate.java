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
package io.lambdakernel.expressions;

import io.lambdakernel.annotation.Evolving;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Defines predicate scalar expression which is an extension of {@link ScalarExpression} that
 * evaluates to true, false, or null for each input row.
 *
 * <p>Currently, implementations of {@link io.lambdakernel.engine.ExpressionHandler} support the
 * following scalar expressions.
 *
 * <ol>
 *   <li>Name: <code>=</code>, <code>&lt;</code>, <code>&lt;=</code>, <code>&gt;</code>,
 *       <code>&gt;=</code>: comparison of two operands of the same (or implicitly castable) type.
 *   <li>Name: <code>AND</code>, <code>OR</code>: SQL three-valued logic.
 *   <li>Name: <code>NOT</code>, <code>IS_NULL</code>, <code>IS_NOT_NULL</code>
 * </ol>
 *
 * @since 1.0.0
 */
@Evolving
public class Predicate extends ScalarExpression {
  public Predicate(String name, List<Expression> children) {
    super(name, children);
  }

  /** Constructor for a unary Predicate expression */
  public Predicate(String name, Expression child) {
    this(name, Arrays.asList(child));
  }

  /** Constructor for a binary Predicate expression */
  public Predicate(String name, Expression left, Expression right) {
    this(name, Arrays.asList(left, right));
  }

  @Override
  public String toString() {
    if (BINARY_OPERATORS.contains(name)) {
      return String.format("(%s %s %s)", children.get(0), name, children.get(1));
    }
    return super.toString();
  }

  private static final Set<String> BINARY_OPERATORS =
      Stream.of("<", "<=", ">", ">=", "=", "AND", "OR").collect(Collectors.toSet());
}
