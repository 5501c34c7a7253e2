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

import java.util.*;
import java.util.function.IntToLongFunction;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.types.DataType;

/**
 * An implicit cast expression to convert the input type to another given type. Here is the valid
 * list of casts
 * <p>
 *  <ul>
 *    <li>{@code byte} to {@code short, int, long, float, double}</li>
 *    <li>{@code short} to {@code int, long, float, double}</li>
 *    <li>{@code int} to {@code long, float, double}</li>
 *    <li>{@code long} to {@code float, double}</li>
 *    <li>{@code float} to {@code double}</li>
 *  </ul>
 *
 * <p>
 * Inserted by {@link DefaultExpressionEvaluator} when the operands of a comparison or an
 * arithmetic expression are not of the same type, but the evaluator expects same type inputs.
 */
final class ImplicitCastExpression implements Expression {
    private final Expression input;
    private final DataType outputType;

    /**
     * Create a cast around the given input expression to specified output data
     * type. It is the responsibility of the caller to validate the input expression can be cast
     * to the new type using {@link #canCastTo(DataType, DataType)}
     */
    ImplicitCastExpression(Expression input, DataType outputType) {
        this.input = requireNonNull(input, "input is null");
        this.outputType = requireNonNull(outputType, "outputType is null");
    }

    public Expression getInput() {
        return input;
    }

    public DataType getOutputType() {
        return outputType;
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.singletonList(input);
    }

    @Override
    public String toString() {
        return format("CAST(%s AS %s)", input, outputType);
    }

    /**
     * Evaluate the cast on the input {@link ColumnVector}. The result reads the input lazily.
     *
     * @param input {@link ColumnVector} data of the input to the cast expression.
     * @return {@link ColumnVector} of the output type with one value per input row
     */
    ColumnVector eval(ColumnVector input) {
        String fromTypeStr = input.getDataType().toString();
        if (!canCastTo(input.getDataType(), outputType)) {
            throw new UnsupportedOperationException(
                format("Cast from %s to %s is not supported", fromTypeStr, outputType));
        }
        if (fromTypeStr.equals("float")) {
            return new WideningVector(outputType, input, null);
        }
        return new WideningVector(outputType, input, integralReader(fromTypeStr, input));
    }

    private static IntToLongFunction integralReader(String fromTypeStr, ColumnVector input) {
        switch (fromTypeStr) {
            case "byte":
                return input::getByte;
            case "short":
                return input::getShort;
            case "integer":
                return input::getInt;
            case "long":
                return input::getLong;
            default:
                throw new UnsupportedOperationException(
                    format("Cast from %s is not supported", fromTypeStr));
        }
    }

    // numeric types from narrowest to widest; a type widens to any type after it
    private static final List<String> WIDENING_ORDER =
        Arrays.asList("byte", "short", "integer", "long", "float", "double");

    /** Whether values of type {@code from} widen to type {@code to}. */
    static boolean canCastTo(DataType from, DataType to) {
        int fromRank = WIDENING_ORDER.indexOf(from.toString());
        int toRank = WIDENING_ORDER.indexOf(to.toString());
        return fromRank >= 0 && toRank > fromRank;
    }

    /**
     * Reads an integral input as a {@code long} and narrows it to the requested accessor. A float
     * input only widens to {@code double}.
     */
    private static final class WideningVector implements ColumnVector {
        private final DataType targetType;
        private final ColumnVector inputVector;
        private final IntToLongFunction integralReader;

        WideningVector(
                DataType targetType, ColumnVector inputVector, IntToLongFunction integralReader) {
            this.targetType = targetType;
            this.inputVector = inputVector;
            this.integralReader = integralReader;
        }

        @Override
        public DataType getDataType() {
            return targetType;
        }

        @Override
        public boolean isNullAt(int rowId) {
            return inputVector.isNullAt(rowId);
        }

        @Override
        public int getSize() {
            return inputVector.getSize();
        }

        @Override
        public void close() {
            inputVector.close();
        }

        @Override
        public short getShort(int rowId) {
            return (short) integralReader.applyAsLong(rowId);
        }

        @Override
        public int getInt(int rowId) {
            return (int) integralReader.applyAsLong(rowId);
        }

        @Override
        public long getLong(int rowId) {
            return integralReader.applyAsLong(rowId);
        }

        @Override
        public float getFloat(int rowId) {
            return integralReader.applyAsLong(rowId);
        }

        @Override
        public double getDouble(int rowId) {
            if (integralReader == null) {
                return inputVector.getFloat(rowId);
            }
            return integralReader.applyAsLong(rowId);
        }
    }
}
