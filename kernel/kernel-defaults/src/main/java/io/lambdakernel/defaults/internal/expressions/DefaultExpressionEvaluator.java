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

import static io.lambdakernel.defaults.internal.DefaultEngineErrors.unsupportedExpressionException;
import static io.lambdakernel.defaults.internal.expressions.DefaultExpressionUtils.*;
import static io.lambdakernel.defaults.internal.expressions.ImplicitCastExpression.canCastTo;
import static io.lambdakernel.internal.util.ExpressionUtils.*;
import static io.lambdakernel.internal.util.Preconditions.checkArgument;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.ColumnarBatch;
import io.lambdakernel.defaults.internal.data.vector.DefaultConstantVector;
import io.lambdakernel.defaults.internal.transform.BoundLambda;
import io.lambdakernel.defaults.internal.transform.LambdaBinder;
import io.lambdakernel.defaults.internal.transform.TransformEvaluator;
import io.lambdakernel.engine.Engine;
import io.lambdakernel.engine.ExpressionHandler;
import io.lambdakernel.expressions.*;
import io.lambdakernel.lambda.LambdaExpression;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.types.*;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Implementation of {@link ExpressionEvaluator} for default {@link ExpressionHandler}. It takes
 * care of validating, adding necessary implicit casts, binding the lambdas of {@code TRANSFORM}
 * calls and evaluating the {@link Expression} on given {@link ColumnarBatch}.
 *
 * <p>{@code TRANSFORM} takes exactly two arguments: an array expression and either a {@link
 * LambdaExpression} or {@code IF(condition, lambda, lambda, ...)}. With a boolean condition the
 * first lambda applies to rows where it is true and the second to the other rows. With an integer
 * condition each row applies the lambda at that position.
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {
  private final Engine engine;
  private final Expression expression;
  private final DataType outputType;

  /**
   * Create a {@link DefaultExpressionEvaluator} instance bound to the given expression and
   * <i>inputSchema</i>.
   *
   * @param engine engine evaluating lambda bodies and lambda selectors
   * @param inputSchema Input data schema
   * @param expression Expression to evaluate.
   * @param outputType Expected result data type.
   */
  public DefaultExpressionEvaluator(
      Engine engine, StructType inputSchema, Expression expression, DataType outputType) {
    this.engine = requireNonNull(engine, "engine is null");
    ExpressionTransformResult transformResult =
        new ExpressionTransformer(engine, inputSchema).visit(expression);
    if (!transformResult.outputType.equivalent(outputType)) {
      String reason =
          String.format(
              "Expression %s does not match expected output type %s", expression, outputType);
      throw unsupportedExpressionException(expression, reason);
    }
    this.expression = transformResult.expression;
    this.outputType = transformResult.outputType;
  }

  /**
   * Create a {@link DefaultExpressionEvaluator} producing whatever type the expression resolves
   * to. See {@link #getOutputType()}.
   */
  public DefaultExpressionEvaluator(Engine engine, StructType inputSchema, Expression expression) {
    this.engine = requireNonNull(engine, "engine is null");
    ExpressionTransformResult transformResult =
        new ExpressionTransformer(engine, inputSchema).visit(expression);
    this.expression = transformResult.expression;
    this.outputType = transformResult.outputType;
  }

  /** @return the type of the vectors returned by {@link #eval(ColumnarBatch)} */
  public DataType getOutputType() {
    return outputType;
  }

  @Override
  public ColumnVector eval(ColumnarBatch input) {
    return new ExpressionEvalVisitor(engine, input).visit(expression);
  }

  @Override
  public void close() {
    /* nothing to close */
  }

  /** Encapsulates the result of {@link ExpressionTransformer} */
  private static class ExpressionTransformResult {
    public final Expression expression; // transformed expression
    public final DataType outputType; // output type of the expression

    ExpressionTransformResult(Expression expression, DataType outputType) {
      this.expression = expression;
      this.outputType = outputType;
    }
  }

  /**
   * Implementation of {@link ExpressionVisitor} to validate the given expression as follows.
   *
   * <ul>
   *   <li>given input column is part of the input data schema
   *   <li>expression inputs are of supported types. Insert cast according to the rules in {@link
   *       ImplicitCastExpression} to make the types compatible for evaluation by {@link
   *       ExpressionEvalVisitor}
   *   <li>lambdas passed to {@code TRANSFORM} accept the array elements and find their captured
   *       columns in the input data schema
   * </ul>
   *
   * <p>Return type of each expression visit is a tuple of new rewritten expression and its result
   * data type.
   */
  private static class ExpressionTransformer extends ExpressionVisitor<ExpressionTransformResult> {
    private final Engine engine;
    private final StructType inputDataSchema;

    ExpressionTransformer(Engine engine, StructType inputDataSchema) {
      this.engine = engine;
      this.inputDataSchema = requireNonNull(inputDataSchema, "inputDataSchema is null");
    }

    @Override
    ExpressionTransformResult visitAnd(And and) {
      Predicate left = validateIsPredicate(and, visit(and.getLeft()));
      Predicate right = validateIsPredicate(and, visit(and.getRight()));
      return new ExpressionTransformResult(new And(left, right), BooleanType.BOOLEAN);
    }

    @Override
    ExpressionTransformResult visitOr(Or or) {
      Predicate left = validateIsPredicate(or, visit(or.getLeft()));
      Predicate right = validateIsPredicate(or, visit(or.getRight()));
      return new ExpressionTransformResult(new Or(left, right), BooleanType.BOOLEAN);
    }

    @Override
    ExpressionTransformResult visitComparator(Predicate predicate) {
      ExpressionTransformResult leftResult = visit(getLeft(predicate));
      ExpressionTransformResult rightResult = visit(getRight(predicate));
      Expression left = leftResult.expression;
      Expression right = rightResult.expression;
      if (!leftResult.outputType.equivalent(rightResult.outputType)) {
        if (canCastTo(leftResult.outputType, rightResult.outputType)) {
          left = new ImplicitCastExpression(left, rightResult.outputType);
        } else if (canCastTo(rightResult.outputType, leftResult.outputType)) {
          right = new ImplicitCastExpression(right, leftResult.outputType);
        } else {
          String msg =
              format(
                  "operands are of different types which are not "
                      + "comparable: left type=%s, right type=%s",
                  leftResult.outputType, rightResult.outputType);
          throw unsupportedExpressionException(predicate, msg);
        }
      }
      return new ExpressionTransformResult(
          new Predicate(predicate.getName(), left, right), BooleanType.BOOLEAN);
    }

    @Override
    ExpressionTransformResult visitLiteral(Literal literal) {
      // nothing to validate or rewrite
      return new ExpressionTransformResult(literal, literal.getDataType());
    }

    @Override
    ExpressionTransformResult visitColumn(Column column) {
      DataType columnType = resolveColumn(inputDataSchema, column).getDataType();
      return new ExpressionTransformResult(column, columnType);
    }

    @Override
    ExpressionTransformResult visitCast(ImplicitCastExpression cast) {
      throw new UnsupportedOperationException("CAST expression is not expected.");
    }

    @Override
    ExpressionTransformResult visitNot(Predicate predicate) {
      Predicate child = validateIsPredicate(predicate, visit(getUnaryChild(predicate)));
      return new ExpressionTransformResult(
          new Predicate(predicate.getName(), child), BooleanType.BOOLEAN);
    }

    @Override
    ExpressionTransformResult visitIsNotNull(Predicate predicate) {
      Expression child = visit(getUnaryChild(predicate)).expression;
      return new ExpressionTransformResult(
          new Predicate(predicate.getName(), child), BooleanType.BOOLEAN);
    }

    @Override
    ExpressionTransformResult visitIsNull(Predicate predicate) {
      Expression child = visit(getUnaryChild(predicate)).expression;
      return new ExpressionTransformResult(
          new Predicate(predicate.getName(), child), BooleanType.BOOLEAN);
    }

    @Override
    ExpressionTransformResult visitCoalesce(ScalarExpression coalesce) {
      List<ExpressionTransformResult> children =
          coalesce.getChildren().stream().map(this::visit).collect(Collectors.toList());
      if (children.size() == 0) {
        throw unsupportedExpressionException(coalesce, "Coalesce requires at least one expression");
      }
      DataType firstType = children.get(0).outputType;
      if (children.stream().anyMatch(child -> !child.outputType.equivalent(firstType))) {
        throw unsupportedExpressionException(
            coalesce, "Coalesce is only supported for arguments of the same type");
      }
      return new ExpressionTransformResult(
          new ScalarExpression(
              "COALESCE", children.stream().map(e -> e.expression).collect(Collectors.toList())),
          firstType);
    }

    @Override
    ExpressionTransformResult visitArithmetic(ScalarExpression arithmetic) {
      if (arithmetic.getChildren().size() != 2) {
        throw unsupportedExpressionException(
            arithmetic, "arithmetic expressions require exactly two operands");
      }
      ExpressionTransformResult left = visit(getLeft(arithmetic));
      ExpressionTransformResult right = visit(getRight(arithmetic));
      DataType resultType =
          ArithmeticExpressionEvaluator.resolveResultType(
              arithmetic, left.outputType, right.outputType);
      return new ExpressionTransformResult(
          ArithmeticExpressionEvaluator.validateAndTransform(
              arithmetic,
              left.expression,
              left.outputType,
              right.expression,
              right.outputType,
              resultType),
          resultType);
    }

    @Override
    ExpressionTransformResult visitTransform(ScalarExpression transform) {
      if (transform.getChildren().size() != 2) {
        throw unsupportedExpressionException(
            transform, "TRANSFORM requires exactly two arguments: an array and a lambda");
      }
      ExpressionTransformResult array = visit(childAt(transform, 0));
      if (!(array.outputType instanceof ArrayType)) {
        throw unsupportedExpressionException(
            transform, format("first argument must be an array, but got %s", array.outputType));
      }
      DataType elementType = ((ArrayType) array.outputType).getElementType();

      Expression function = childAt(transform, 1);
      Optional<Expression> condition = Optional.empty();
      List<LambdaHandle> lambdas = new ArrayList<>();
      if (function instanceof LambdaExpression) {
        lambdas.add(((LambdaExpression) function).getLambda());
      } else if (function instanceof ScalarExpression
          && ((ScalarExpression) function).getName().equalsIgnoreCase("IF")) {
        condition = Optional.of(transformCondition(transform, (ScalarExpression) function));
        for (Expression branch : function.getChildren().subList(1, function.getChildren().size())) {
          if (!(branch instanceof LambdaExpression)) {
            throw unsupportedExpressionException(
                transform, format("IF branches of TRANSFORM must be lambdas, but got %s", branch));
          }
          lambdas.add(((LambdaExpression) branch).getLambda());
        }
      } else {
        throw unsupportedExpressionException(
            transform,
            format("second argument must be a lambda or IF(condition, lambdas), got %s", function));
      }

      List<BoundLambda> bound =
          LambdaBinder.bindAll(
              lambdas, elementType, inputDataSchema, engine.getLambdaBodyEvaluator());
      TransformExpression boundTransform =
          new TransformExpression(array.expression, condition, bound);
      return new ExpressionTransformResult(boundTransform, boundTransform.getOutputType());
    }

    @Override
    ExpressionTransformResult visitBoundTransform(TransformExpression transform) {
      // already bound, nothing to validate or rewrite
      return new ExpressionTransformResult(transform, transform.getOutputType());
    }

    private Expression transformCondition(ScalarExpression transform, ScalarExpression ifExpr) {
      int numLambdas = ifExpr.getChildren().size() - 1;
      if (numLambdas < 2) {
        throw unsupportedExpressionException(
            transform, "IF requires a condition and at least two lambdas");
      }
      ExpressionTransformResult condition = visit(childAt(ifExpr, 0));
      if (condition.outputType instanceof BooleanType) {
        if (numLambdas != 2) {
          throw unsupportedExpressionException(
              transform, "a boolean IF condition selects between exactly two lambdas");
        }
      } else if (!(condition.outputType instanceof IntegerType)) {
        throw unsupportedExpressionException(
            transform,
            format("IF condition must be boolean or integer, but got %s", condition.outputType));
      }
      return condition.expression;
    }

    private Predicate validateIsPredicate(
        Expression baseExpression, ExpressionTransformResult result) {
      checkArgument(
          result.outputType instanceof BooleanType && result.expression instanceof Predicate,
          "%s: expected a predicate expression but got %s with output type %s.",
          baseExpression,
          result.expression,
          result.outputType);
      return (Predicate) result.expression;
    }
  }

  /**
   * Implementation of {@link ExpressionVisitor} to evaluate expression on a {@link ColumnarBatch}.
   */
  private static class ExpressionEvalVisitor extends ExpressionVisitor<ColumnVector> {
    private final Engine engine;
    private final ColumnarBatch input;

    ExpressionEvalVisitor(Engine engine, ColumnarBatch input) {
      this.engine = engine;
      this.input = input;
    }

    // SQL three-valued logic: a false operand decides AND, a true operand decides OR, and
    // otherwise any null operand makes the row null.
    @Override
    ColumnVector visitAnd(And and) {
      ColumnVector left = visit(and.getLeft());
      ColumnVector right = visit(and.getRight());
      checkSameSize(and, left, right);
      return booleanVector(
          left.getSize(),
          rowId ->
              !isFalse(left, rowId)
                  && !isFalse(right, rowId)
                  && (left.isNullAt(rowId) || right.isNullAt(rowId)),
          rowId -> !isFalse(left, rowId) && !isFalse(right, rowId));
    }

    @Override
    ColumnVector visitOr(Or or) {
      ColumnVector left = visit(or.getLeft());
      ColumnVector right = visit(or.getRight());
      checkSameSize(or, left, right);
      return booleanVector(
          left.getSize(),
          rowId ->
              !isTrue(left, rowId)
                  && !isTrue(right, rowId)
                  && (left.isNullAt(rowId) || right.isNullAt(rowId)),
          rowId -> isTrue(left, rowId) || isTrue(right, rowId));
    }

    @Override
    ColumnVector visitComparator(Predicate predicate) {
      ColumnVector left = visit(getLeft(predicate));
      ColumnVector right = visit(getRight(predicate));
      checkSameSize(predicate, left, right);
      return compare(predicate.getName(), left, right);
    }

    @Override
    ColumnVector visitLiteral(Literal literal) {
      DataType dataType = literal.getDataType();
      if (dataType instanceof BasePrimitiveType) {
        return new DefaultConstantVector(dataType, input.getSize(), literal.getValue());
      }
      throw new UnsupportedOperationException("unsupported expression encountered: " + literal);
    }

    @Override
    ColumnVector visitColumn(Column column) {
      resolveColumn(input.getSchema(), column);
      return input.getColumnVector(input.getSchema().indexOf(column.getNames()[0]));
    }

    @Override
    ColumnVector visitCast(ImplicitCastExpression cast) {
      ColumnVector inputResult = visit(cast.getInput());
      return cast.eval(inputResult);
    }

    @Override
    ColumnVector visitNot(Predicate predicate) {
      ColumnVector child = visit(getUnaryChild(predicate));
      return booleanVector(child.getSize(), child::isNullAt, rowId -> !child.getBoolean(rowId));
    }

    @Override
    ColumnVector visitIsNotNull(Predicate predicate) {
      ColumnVector child = visit(getUnaryChild(predicate));
      return booleanVector(child.getSize(), rowId -> false, rowId -> !child.isNullAt(rowId));
    }

    @Override
    ColumnVector visitIsNull(Predicate predicate) {
      ColumnVector child = visit(getUnaryChild(predicate));
      return booleanVector(child.getSize(), rowId -> false, child::isNullAt);
    }

    @Override
    ColumnVector visitCoalesce(ScalarExpression coalesce) {
      List<ColumnVector> children =
          coalesce.getChildren().stream().map(this::visit).collect(Collectors.toList());
      return coalesce(children.get(0).getDataType(), children);
    }

    @Override
    ColumnVector visitArithmetic(ScalarExpression arithmetic) {
      ColumnVector left = visit(getLeft(arithmetic));
      ColumnVector right = visit(getRight(arithmetic));
      return ArithmeticExpressionEvaluator.eval(arithmetic, left, right);
    }

    @Override
    ColumnVector visitTransform(ScalarExpression transform) {
      throw new IllegalStateException("TRANSFORM is expected to be bound: " + transform);
    }

    @Override
    ColumnVector visitBoundTransform(TransformExpression transform) {
      ColumnVector arrays = visit(transform.getArray());
      List<BoundLambda> lambdas = transform.getLambdas();
      List<List<ColumnVector>> captures = new ArrayList<>(lambdas.size());
      for (BoundLambda lambda : lambdas) {
        captures.add(
            lambda.getCaptureNames().stream()
                .map(name -> visitColumn(new Column(name)))
                .collect(Collectors.toList()));
      }

      TransformEvaluator evaluator = new TransformEvaluator(engine);
      if (!transform.getCondition().isPresent()) {
        return evaluator.transform(arrays, lambdas.get(0), captures.get(0));
      }
      ColumnVector condition = visit(transform.getCondition().get());
      return evaluator.transform(arrays, condition, lambdas, captures);
    }

    private void checkSameSize(Expression expression, ColumnVector left, ColumnVector right) {
      checkArgument(
          left.getSize() == right.getSize(),
          "%s: operands returned different number of rows: left=%s, right=%s",
          expression,
          left.getSize(),
          right.getSize());
    }

    private static boolean isTrue(ColumnVector vector, int rowId) {
      return !vector.isNullAt(rowId) && vector.getBoolean(rowId);
    }

    private static boolean isFalse(ColumnVector vector, int rowId) {
      return !vector.isNullAt(rowId) && !vector.getBoolean(rowId);
    }
  }

  /** Top level field the column refers to. Nested column references are not supported. */
  private static StructField resolveColumn(StructType schema, Column column) {
    String[] names = column.getNames();
    if (names.length != 1) {
      throw unsupportedExpressionException(column, "nested column references are not supported");
    }
    StructField field = schema.get(names[0]);
    if (field == null) {
      throw new IllegalArgumentException(
          format("%s doesn't exist in input data schema: %s", column, schema));
    }
    return field;
  }
}
