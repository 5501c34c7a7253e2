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
package io.lambdakernel.defaults.internal.transform;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lambdakernel.engine.LambdaBodyEvaluator;
import io.lambdakernel.exceptions.SignatureMismatchException;
import io.lambdakernel.expressions.Column;
import io.lambdakernel.expressions.Literal;
import io.lambdakernel.expressions.ScalarExpression;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.lambda.LambdaRegistry;
import io.lambdakernel.types.*;

import io.lambdakernel.defaults.engine.DefaultEngine;

public class TestLambdaBinder {
    private static final LambdaBodyEvaluator BODY_EVALUATOR =
        DefaultEngine.create().getLambdaBodyEvaluator();

    private final LambdaRegistry registry = new LambdaRegistry();

    private final StructType inputSchema = new StructType()
        .add("arr", new ArrayType(IntegerType.INTEGER, true))
        .add("y", IntegerType.INTEGER)
        .add("name", StringType.STRING);

    @Test
    public void bindResolvesReturnType() {
        LambdaHandle lambda = registry.registerLambda(
            "plusY",
            new StructType().add("x", IntegerType.INTEGER),
            inputSchema,
            new ScalarExpression("+", new Column("x"), new Column("y")));

        BoundLambda bound =
            LambdaBinder.bind(lambda, IntegerType.INTEGER, inputSchema, BODY_EVALUATOR);

        assertThat(bound.getName()).isEqualTo("plusY");
        assertThat(bound.getReturnType()).isEqualTo(IntegerType.INTEGER);
        assertThat(bound.getResultType()).isEqualTo(new ArrayType(IntegerType.INTEGER, true));
        assertThat(bound.getCaptureNames()).containsExactly("y");
    }

    @Test
    public void bodyMayChangeTheElementType() {
        LambdaHandle lambda = registry.registerLambda(
            "isPositive",
            new StructType().add("x", IntegerType.INTEGER),
            new StructType(),
            new ScalarExpression(">", new Column("x"), Literal.ofInt(0)));

        BoundLambda bound =
            LambdaBinder.bind(lambda, IntegerType.INTEGER, inputSchema, BODY_EVALUATOR);

        assertThat(bound.getReturnType()).isEqualTo(BooleanType.BOOLEAN);
    }

    @Test
    public void parameterTypeMustMatchElements() {
        LambdaHandle lambda = registry.registerLambda(
            "longIdentity",
            new StructType().add("x", LongType.LONG),
            new StructType(),
            new Column("x"));

        assertThatThrownBy(() ->
            LambdaBinder.bind(lambda, IntegerType.INTEGER, inputSchema, BODY_EVALUATOR))
            .isInstanceOf(SignatureMismatchException.class)
            .hasMessageContaining("longIdentity")
            .hasMessageContaining("cannot be bound to array elements");
    }

    @Test
    public void capturedColumnMustBeInInput() {
        LambdaHandle lambda = registry.registerLambda(
            "plusZ",
            new StructType().add("x", IntegerType.INTEGER),
            new StructType().add("z", IntegerType.INTEGER),
            new ScalarExpression("+", new Column("x"), new Column("z")));

        assertThatThrownBy(() ->
            LambdaBinder.bind(lambda, IntegerType.INTEGER, inputSchema, BODY_EVALUATOR))
            .isInstanceOf(SignatureMismatchException.class)
            .hasMessageContaining("`z` is not present");
    }

    @Test
    public void capturedColumnMustHaveDeclaredType() {
        LambdaHandle lambda = registry.registerLambda(
            "plusName",
            new StructType().add("x", IntegerType.INTEGER),
            new StructType().add("name", IntegerType.INTEGER),
            new ScalarExpression("+", new Column("x"), new Column("name")));

        assertThatThrownBy(() ->
            LambdaBinder.bind(lambda, IntegerType.INTEGER, inputSchema, BODY_EVALUATOR))
            .isInstanceOf(SignatureMismatchException.class)
            .hasMessageContaining("`name` was declared as integer");
    }

    @Test
    public void unsupportedBodyIsASignatureMismatch() {
        LambdaHandle lambda = registry.registerLambda(
            "addName",
            new StructType().add("x", IntegerType.INTEGER),
            inputSchema,
            new ScalarExpression("+", new Column("x"), new Column("name")));

        assertThatThrownBy(() ->
            LambdaBinder.bind(lambda, IntegerType.INTEGER, inputSchema, BODY_EVALUATOR))
            .isInstanceOf(SignatureMismatchException.class)
            .hasMessageContaining("body cannot be evaluated")
            .hasCauseInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void alternativesMustReturnTheSameType() {
        LambdaHandle plusOne = registry.registerLambda(
            "plusOne",
            new StructType().add("x", IntegerType.INTEGER),
            new StructType(),
            new ScalarExpression("+", new Column("x"), Literal.ofInt(1)));
        LambdaHandle isOne = registry.registerLambda(
            "isOne",
            new StructType().add("x", IntegerType.INTEGER),
            new StructType(),
            new ScalarExpression("=", new Column("x"), Literal.ofInt(1)));
        List<LambdaHandle> lambdas = Arrays.asList(plusOne, isOne);

        assertThatThrownBy(() ->
            LambdaBinder.bindAll(lambdas, IntegerType.INTEGER, inputSchema, BODY_EVALUATOR))
            .isInstanceOf(SignatureMismatchException.class)
            .hasMessageContaining("alternative lambda `plusOne`")
            .satisfies(e ->
                assertThat(((SignatureMismatchException) e).getLambdaName()).isEqualTo("isOne"));
    }
}
