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
package io.lambdakernel.internal.util;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;
import static java.lang.String.format;

import io.lambdakernel.expressions.Column;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.lambda.LambdaExpression;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ExpressionUtils {
  private ExpressionUtils() {}

  /** Utility method to return the left child of the binary input expression */
  public static Expression getLeft(Expression expression) {
    List<Expression> children = expression.getChildren();
    checkArgument(
        children.size() == 2,
        format("%s: expected two inputs, but got %s", expression, children.size()));
    return children.get(0);
  }

  /** Utility method to return the right child of the binary input expression */
  public static Expression getRight(Expression expression) {
    List<Expression> children = expression.getChildren();
    checkArgument(
        children.size() == 2,
        format("%s: expected two inputs, but got %s", expression, children.size()));
    return children.get(1);
  }

  /** Utility method to return the single child of the unary input expression */
  public static Expression getUnaryChild(Expression expression) {
    List<Expression> children = expression.getChildren();
    checkArgument(
        children.size() == 1,
        format("%s: expected one inputs, but got %s", expression, children.size()));
    return children.get(0);
  }

  /** Utility method to return the child at the given position */
  public static Expression childAt(Expression expression, int index) {
    List<Expression> children = expression.getChildren();
    checkArgument(
        children.size() > index,
        format("%s: expected at least %s inputs, but got %s", expression, index + 1, children.size()));
    return children.get(index);
  }

  /**
   * Top level column names referenced by the given expression, in the order of first reference.
   * Columns captured by nested lambdas count as references of the enclosing expression.
   */
  public static Set<String> referencedColumns(Expression expression) {
    Set<String> names = new LinkedHashSet<>();
    collectReferencedColumns(expression, names);
    return names;
  }

  private static void collectReferencedColumns(Expression expression, Set<String> names) {
    if (expression instanceof Column) {
      names.add(((Column) expression).getNames()[0]);
    } else if (expression instanceof LambdaExpression) {
      names.addAll(((LambdaExpression) expression).getLambda().getCaptures().fieldNames());
    }
    for (Expression child : expression.getChildren()) {
      collectReferencedColumns(child, names);
    }
  }
}
