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

import static java.util.Objects.requireNonNull;

import io.lambdakernel.annotation.Evolving;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Scalar SQL expressions which take zero or more inputs and for each input row generate one
 * output value. A subclass of these expressions are of type {@link Predicate} whose result type is
 * `boolean`. See {@link Predicate} for predicate type scalar expressions. Supported non-predicate
 * type scalar expressions are listed below.
 *
 * <ol>
 *   <li>Name: <code>+</code>, <code>-</code>, <code>*</code>, <code>/</code>, <code>%</code>
 *       <ul>
 *         <li>Semantic: <code><i>expr1</i> op <i>expr2</i></code>. Arithmetic over numeric
 *             operands; result is null when either operand is null. Integer overflow and integer
 *             division by zero raise {@link ArithmeticException}.
 *       </ul>
 *   <li>Name: <code>COALESCE</code>
 *       <ul>
 *         <li>Semantic: <code>COALESCE(<i>expr1</i>, ..., <i>exprN</i>)</code> Return the first
 *             non-null argument. If all arguments are null returns null.
 *       </ul>
 *   <li>Name: <code>TRANSFORM</code>
 *       <ul>
 *         <li>Semantic: <code>TRANSFORM(<i>array</i>, <i>lambda</i>)</code>. Apply the lambda to
 *             every element of every array. <i>lambda</i> is a {@link
 *             io.lambdakernel.lambda.LambdaExpression} or <code>IF(<i>condition</i>,
 *             <i>lambda1</i>, <i>lambda2</i>)</code> which selects a lambda per row.
 *       </ul>
 * </ol>
 *
 * @since 1.0.0
 */
@Evolving
public class ScalarExpression implements Expression {
  protected final String name;
  protected final List<Expression> children;

  public ScalarExpression(String name, List<Expression> children) {
    this.name = requireNonNull(name, "name is null").toUpperCase(Locale.ENGLISH);
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
  }

  public ScalarExpression(String name, Expression... children) {
    this(name, Arrays.asList(children));
  }

  @Override
  public String toString() {
    return String.format(
        "%s(%s)", name, children.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }

  public String getName() {
    return name;
  }

  @Override
  public List<Expression> getChildren() {
    return children;
  }
}
