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
package io.lambdakernel.defaults.internal;

import static java.lang.String.format;

import io.lambdakernel.expressions.Expression;
import io.lambdakernel.types.DataType;

public class DefaultEngineErrors {

    /**
     * Exception for when the default expression evaluator cannot evaluate an expression.
     * @param expression the unsupported expression
     * @param reason reason for why the expression is not supported/cannot be evaluated
     */
    public static UnsupportedOperationException unsupportedExpressionException(
            Expression expression, String reason) {
        String message = format(
            "Default expression evaluator cannot evaluate the expression: %s. Reason: %s",
            expression,
            reason);
        return new UnsupportedOperationException(message);
    }

    /**
     * Exception for an arithmetic result that does not fit in the result type.
     * @param expression the arithmetic expression
     * @param resultType type of the result
     */
    public static ArithmeticException arithmeticOverflow(
            Expression expression, DataType resultType) {
        return new ArithmeticException(
                format("%s overflow in expression %s", resultType, expression));
    }

    /**
     * Exception for an integral division or remainder by zero.
     * @param expression the arithmetic expression
     */
    public static ArithmeticException divisionByZero(Expression expression) {
        return new ArithmeticException(format("Division by zero in expression %s", expression));
    }
}
