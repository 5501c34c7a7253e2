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

import java.util.Optional;
import static java.lang.String.format;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.expressions.ScalarExpression;
import io.lambdakernel.types.*;

import io.lambdakernel.defaults.internal.data.vector.DefaultDoubleVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultIntVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultLongVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultShortVector;
import static io.lambdakernel.internal.util.Preconditions.checkArgument;

import static io.lambdakernel.defaults.internal.DefaultEngineErrors.arithmeticOverflow;
import static io.lambdakernel.defaults.internal.DefaultEngineErrors.divisionByZero;
import static io.lambdakernel.defaults.internal.DefaultEngineErrors.unsupportedExpressionException;
import static io.lambdakernel.defaults.internal.expressions.DefaultExpressionUtils.evalNullability;
import static io.lambdakernel.defaults.internal.expressions.ImplicitCastExpression.canCastTo;

/**
 * Utility methods to evaluate the binary arithmetic expressions {@code + - * / %}.
 *
 * <p>Operands are widened to a common type. {@code byte} operands compute in {@code short} and
 * {@code float} operands in {@code double}. A null operand makes the result null. Integral
 * results that do not fit the result type and integral division or remainder by zero fail with
 * an {@link ArithmeticException}; {@code double} arithmetic follows IEEE 754.
 */
class ArithmeticExpressionEvaluator {
    private ArithmeticExpressionEvaluator() {}

    /**
     * Resolve the type the given arithmetic expression computes in.
     */
    static DataType resolveResultType(
        ScalarExpression arithmetic, DataType leftType, DataType rightType) {
        checkNumeric(arithmetic, leftType);
        checkNumeric(arithmetic, rightType);

        DataType commonType;
        if (leftType.equivalent(rightType)) {
            commonType = leftType;
        } else if (canCastTo(leftType, rightType)) {
            commonType = rightType;
        } else {
            commonType = leftType;
        }
        if (commonType instanceof ByteType) {
            return ShortType.SHORT;
        } else if (commonType instanceof FloatType) {
            return DoubleType.DOUBLE;
        }
        return commonType;
    }

    /**
     * Validate and transform the arithmetic expression with given validated and transformed
     * inputs, casting each operand to {@code resultType} where needed.
     */
    static ScalarExpression validateAndTransform(
        ScalarExpression arithmetic,
        Expression left,
        DataType leftType,
        Expression right,
        DataType rightType,
        DataType resultType) {
        if (!leftType.equivalent(resultType)) {
            left = new ImplicitCastExpression(left, resultType);
        }
        if (!rightType.equivalent(resultType)) {
            right = new ImplicitCastExpression(right, resultType);
        }
        return new ScalarExpression(arithmetic.getName(), left, right);
    }

    /**
     * Evaluate the arithmetic expression on operands of the same type. The result is computed
     * eagerly so that overflow and division by zero surface from this call.
     */
    static ColumnVector eval(ScalarExpression arithmetic, ColumnVector left, ColumnVector right) {
        checkArgument(
            left.getSize() == right.getSize(),
            "Left and right operand returned different results: left=%s, right=%s",
            left.getSize(),
            right.getSize());
        int numRows = left.getSize();
        boolean[] nullability = evalNullability(left, right);
        String operator = arithmetic.getName();
        DataType type = left.getDataType();

        if (type instanceof ShortType) {
            short[] values = new short[numRows];
            for (int rowId = 0; rowId < numRows; rowId++) {
                if (!nullability[rowId]) {
                    long result = computeLong(
                        arithmetic, type, operator, left.getShort(rowId), right.getShort(rowId));
                    if (result != (short) result) {
                        throw arithmeticOverflow(arithmetic, type);
                    }
                    values[rowId] = (short) result;
                }
            }
            return new DefaultShortVector(numRows, Optional.of(nullability), values);
        } else if (type instanceof IntegerType) {
            int[] values = new int[numRows];
            for (int rowId = 0; rowId < numRows; rowId++) {
                if (!nullability[rowId]) {
                    long result = computeLong(
                        arithmetic, type, operator, left.getInt(rowId), right.getInt(rowId));
                    if (result != (int) result) {
                        throw arithmeticOverflow(arithmetic, type);
                    }
                    values[rowId] = (int) result;
                }
            }
            return new DefaultIntVector(numRows, Optional.of(nullability), values);
        } else if (type instanceof LongType) {
            long[] values = new long[numRows];
            for (int rowId = 0; rowId < numRows; rowId++) {
                if (!nullability[rowId]) {
                    values[rowId] = computeLong(
                        arithmetic, type, operator, left.getLong(rowId), right.getLong(rowId));
                }
            }
            return new DefaultLongVector(numRows, Optional.of(nullability), values);
        } else if (type instanceof DoubleType) {
            double[] values = new double[numRows];
            for (int rowId = 0; rowId < numRows; rowId++) {
                if (!nullability[rowId]) {
                    values[rowId] =
                        computeDouble(operator, left.getDouble(rowId), right.getDouble(rowId));
                }
            }
            return new DefaultDoubleVector(numRows, Optional.of(nullability), values);
        }
        throw unsupportedExpressionException(
            arithmetic, format("arithmetic on %s is not supported", type));
    }

    /**
     * Integral arithmetic in {@code long}. Narrower result types check the range of the returned
     * value themselves.
     */
    private static long computeLong(
        Expression arithmetic, DataType type, String operator, long left, long right) {
        switch (operator) {
            case "+":
            case "-":
            case "*":
                try {
                    return exact(operator, left, right);
                } catch (ArithmeticException e) {
                    throw arithmeticOverflow(arithmetic, type);
                }
            case "/":
                checkDivisor(arithmetic, right);
                if (left == Long.MIN_VALUE && right == -1) {
                    throw arithmeticOverflow(arithmetic, type);
                }
                return left / right;
            case "%":
                checkDivisor(arithmetic, right);
                return left % right;
            default:
                throw unknownOperator(arithmetic);
        }
    }

    private static long exact(String operator, long left, long right) {
        switch (operator) {
            case "+":
                return Math.addExact(left, right);
            case "-":
                return Math.subtractExact(left, right);
            default:
                return Math.multiplyExact(left, right);
        }
    }

    private static double computeDouble(String operator, double left, double right) {
        switch (operator) {
            case "+":
                return left + right;
            case "-":
                return left - right;
            case "*":
                return left * right;
            case "/":
                return left / right;
            case "%":
                return left % right;
            default:
                throw new IllegalArgumentException("Unknown arithmetic operator " + operator);
        }
    }

    private static void checkDivisor(Expression arithmetic, long divisor) {
        if (divisor == 0) {
            throw divisionByZero(arithmetic);
        }
    }

    private static void checkNumeric(ScalarExpression arithmetic, DataType type) {
        if (!(type instanceof ByteType
            || type instanceof ShortType
            || type instanceof IntegerType
            || type instanceof LongType
            || type instanceof FloatType
            || type instanceof DoubleType)) {
            throw unsupportedExpressionException(
                arithmetic, format("operand of type %s is not numeric", type));
        }
    }

    private static IllegalArgumentException unknownOperator(Expression arithmetic) {
        return new IllegalArgumentException("Unknown arithmetic expression " + arithmetic);
    }
}
