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
package io.lambdakernel.defaults.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.ColumnarBatch;
import io.lambdakernel.engine.Engine;
import io.lambdakernel.exceptions.SignatureMismatchException;
import io.lambdakernel.expressions.And;
import io.lambdakernel.expressions.Column;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.expressions.ExpressionEvaluator;
import io.lambdakernel.expressions.Literal;
import io.lambdakernel.expressions.Or;
import io.lambdakernel.expressions.Predicate;
import io.lambdakernel.expressions.ScalarExpression;
import io.lambdakernel.lambda.LambdaRegistry;
import io.lambdakernel.types.*;

import io.lambdakernel.defaults.internal.data.DefaultColumnarBatch;
import io.lambdakernel.defaults.internal.data.vector.DefaultArrayVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultBooleanVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultDoubleVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultLongVector;
import static io.lambdakernel.defaults.utils.DefaultVectorTestUtils.*;

public class TestDefaultExpressionHandler {
    private static final ArrayType INT_ARRAY_ARRAY = new ArrayType(INT_ARRAY, true);

    private final Engine engine = DefaultEngine.create();
    private final LambdaRegistry registry = new LambdaRegistry();

    private final StructType schema = new StructType()
        .add("arr", INT_ARRAY)
        .add("y", IntegerType.INTEGER)
        .add("flag", BooleanType.BOOLEAN)
        .add("choice", IntegerType.INTEGER)
        .add("nested", INT_ARRAY_ARRAY);

    {
        StructType element = new StructType().add("x", IntegerType.INTEGER);
        registry.registerLambda("plusOne", element, new StructType(),
            new ScalarExpression("+", new Column("x"), Literal.ofInt(1)));
        registry.registerLambda("timesTwo", element, new StructType(),
            new ScalarExpression("*", new Column("x"), Literal.ofInt(2)));
        registry.registerLambda("negate", element, new StructType(),
            new ScalarExpression("-", Literal.ofInt(0), new Column("x")));
        registry.registerLambda("plusY", element, schema,
            new ScalarExpression("+", new Column("x"), new Column("y")));
        registry.registerLambda("isEven", element, new StructType(),
            new ScalarExpression(
                "=",
                new ScalarExpression("%", new Column("x"), Literal.ofInt(2)),
                Literal.ofInt(0)));
    }

    /**
     * Rows:
     * <pre>
     * arr       y     flag   choice  nested
     * [1, 2]    10    true   0       [[1, 2], [3]]
     * []        20    false  1       []
     * null      30    null   2       null
     * [3, null] null  false  null    [[4], null]
     * </pre>
     */
    private final ColumnarBatch batch = new DefaultColumnarBatch(
        4,
        schema,
        new ColumnVector[] {
            intArrays(row(1, 2), row(), null, row(3, null)),
            ints(10, 20, 30, null),
            new DefaultBooleanVector(
                4,
                Optional.of(new boolean[] {false, false, true, false}),
                new boolean[] {true, false, false, false}),
            ints(0, 1, 2, null),
            new DefaultArrayVector(
                4,
                INT_ARRAY_ARRAY,
                Optional.of(new boolean[] {false, false, true, false}),
                new int[] {0, 2, 2, 2},
                new int[] {2, 0, 0, 2},
                intArrays(row(1, 2), row(3), row(4), null))
        });

    @Test
    public void transformWithLambda() {
        ColumnVector result = eval(transform("arr", registry.function("plusOne")), INT_ARRAY);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(2, 3), Collections.emptyList(), null, Arrays.asList(4, null));
    }

    @Test
    public void transformWithCapturedColumn() {
        ColumnVector result = eval(transform("arr", registry.function("plusY")), INT_ARRAY);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(11, 12), Collections.emptyList(), null, Arrays.asList(null, null));
    }

    @Test
    public void transformChangingElementType() {
        ColumnVector result = eval(
            transform("arr", registry.function("isEven")),
            new ArrayType(BooleanType.BOOLEAN, true));

        assertThat(toList(result)).containsExactly(
            Arrays.asList(false, true), Collections.emptyList(), null, Arrays.asList(false, null));
    }

    @Test
    public void transformWithBooleanCondition() {
        Expression expression = transform(
            "arr",
            new ScalarExpression(
                "IF",
                new Column("flag"),
                registry.function("plusOne"),
                registry.function("timesTwo")));

        ColumnVector result = eval(expression, INT_ARRAY);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(2, 3), Collections.emptyList(), null, Arrays.asList(6, null));
    }

    @Test
    public void transformWithIntegerCondition() {
        Expression expression = transform(
            "arr",
            new ScalarExpression(
                "IF",
                new Column("choice"),
                registry.function("plusOne"),
                registry.function("timesTwo"),
                registry.function("negate")));

        ColumnVector result = eval(expression, INT_ARRAY);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(2, 3), Collections.emptyList(), null, Arrays.asList(-3, null));
    }

    @Test
    public void nestedTransform() {
        registry.registerLambda(
            "plusOneAll",
            new StructType().add("xs", INT_ARRAY),
            new StructType(),
            new ScalarExpression("TRANSFORM", new Column("xs"), registry.function("plusOne")));

        ColumnVector result =
            eval(transform("nested", registry.function("plusOneAll")), INT_ARRAY_ARRAY);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(Arrays.asList(2, 3), Collections.singletonList(4)),
            Collections.emptyList(),
            null,
            Arrays.asList(Collections.singletonList(5), null));
    }

    @Test
    public void nestedTransformCapturesOuterColumn() {
        registry.registerLambda(
            "plusYAll",
            new StructType().add("xs", INT_ARRAY),
            schema,
            new ScalarExpression("TRANSFORM", new Column("xs"), registry.function("plusY")));

        ColumnVector result =
            eval(transform("nested", registry.function("plusYAll")), INT_ARRAY_ARRAY);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(Arrays.asList(11, 12), Collections.singletonList(13)),
            Collections.emptyList(),
            null,
            Arrays.asList(Collections.singletonList(null), null));
    }

    @Test
    public void booleanConditionNeedsTwoLambdas() {
        Expression expression = transform(
            "arr",
            new ScalarExpression(
                "IF",
                new Column("flag"),
                registry.function("plusOne"),
                registry.function("timesTwo"),
                registry.function("negate")));

        assertThatThrownBy(() -> eval(expression, INT_ARRAY))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("exactly two lambdas");
    }

    @Test
    public void lambdaMustAcceptTheElements() {
        registry.registerLambda(
            "longIdentity",
            new StructType().add("x", LongType.LONG),
            new StructType(),
            new Column("x"));

        assertThatThrownBy(() ->
            eval(transform("arr", registry.function("longIdentity")), INT_ARRAY))
            .isInstanceOf(SignatureMismatchException.class);
    }

    @Test
    public void lambdaOutsideOfTransformIsRejected() {
        assertThatThrownBy(() -> eval(registry.function("plusOne"), IntegerType.INTEGER))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("can only be used as an argument of TRANSFORM");
    }

    @Test
    public void outputTypeMustMatch() {
        assertThatThrownBy(() ->
            eval(transform("arr", registry.function("plusOne")), INT_ARRAY_ARRAY))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("does not match expected output type");
    }

    @Test
    public void arithmeticWidensOperands() {
        StructType longSchema = new StructType()
            .add("a", IntegerType.INTEGER)
            .add("b", LongType.LONG);
        ColumnarBatch input = new DefaultColumnarBatch(
            2,
            longSchema,
            new ColumnVector[] {
                ints(1, 2),
                new DefaultLongVector(2, Optional.empty(), new long[] {Long.MAX_VALUE - 1, 5L})
            });

        ColumnVector result = eval(
            longSchema,
            new ScalarExpression("+", new Column("a"), new Column("b")),
            LongType.LONG,
            input);

        assertThat(toList(result)).containsExactly(Long.MAX_VALUE, 7L);
    }

    @Test
    public void integralDivisionByZeroFails() {
        assertThatThrownBy(() -> eval(
            new ScalarExpression("/", new Column("y"), Literal.ofInt(0)), IntegerType.INTEGER))
            .isInstanceOf(ArithmeticException.class)
            .hasMessageContaining("Division by zero");
    }

    @Test
    public void integralOverflowFails() {
        assertThatThrownBy(() -> eval(
            new ScalarExpression("*", new Column("y"), Literal.ofInt(Integer.MAX_VALUE)),
            IntegerType.INTEGER))
            .isInstanceOf(ArithmeticException.class)
            .hasMessageContaining("integer overflow");
    }

    @Test
    public void doubleDivisionFollowsIeee() {
        StructType doubleSchema = new StructType().add("d", DoubleType.DOUBLE);
        ColumnarBatch input = new DefaultColumnarBatch(
            2,
            doubleSchema,
            new ColumnVector[] {
                new DefaultDoubleVector(2, Optional.empty(), new double[] {1.0, 0.0})
            });

        ColumnVector result = eval(
            doubleSchema,
            new ScalarExpression("/", new Column("d"), Literal.ofDouble(0.0)),
            DoubleType.DOUBLE,
            input);

        assertThat(result.getDouble(0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(result.getDouble(1)).isNaN();
    }

    @Test
    public void coalescePicksFirstNonNull() {
        ColumnVector result = eval(
            new ScalarExpression("COALESCE", new Column("choice"), new Column("y")),
            IntegerType.INTEGER);

        assertThat(toList(result)).containsExactly(0, 1, 2, null);
    }

    @Test
    public void booleanLogicIsThreeValued() {
        Predicate atLeastTwenty = new Predicate(">=", new Column("y"), Literal.ofInt(20));
        Predicate belowTwo = new Predicate("<", new Column("choice"), Literal.ofInt(2));

        assertThat(toList(eval(new And(atLeastTwenty, belowTwo), BooleanType.BOOLEAN)))
            .containsExactly(false, true, false, null);
        assertThat(toList(eval(new Or(atLeastTwenty, belowTwo), BooleanType.BOOLEAN)))
            .containsExactly(true, true, true, null);
        assertThat(toList(eval(new Predicate("NOT", atLeastTwenty), BooleanType.BOOLEAN)))
            .containsExactly(true, false, false, null);
    }

    @Test
    public void comparisonWidensOperands() {
        Expression expression = new Predicate(">", new Column("y"), Literal.ofLong(15L));

        assertThat(toList(eval(expression, BooleanType.BOOLEAN)))
            .containsExactly(false, true, true, null);
    }

    @Test
    public void nullChecksAreNeverNull() {
        assertThat(toList(eval(new Predicate("IS_NULL", new Column("y")), BooleanType.BOOLEAN)))
            .containsExactly(false, false, false, true);
        assertThat(toList(
            eval(new Predicate("IS_NOT_NULL", new Column("arr")), BooleanType.BOOLEAN)))
            .containsExactly(true, true, false, true);
    }

    @Test
    public void narrowLiteralsWidenToTheColumnType() {
        ColumnVector shortPlusInt = eval(
            new ScalarExpression("+", new Column("y"), Literal.ofShort((short) 5)),
            IntegerType.INTEGER);
        ColumnVector floatPlusInt = eval(
            new ScalarExpression("+", Literal.ofFloat(1.5f), new Column("y")),
            DoubleType.DOUBLE);

        assertThat(toList(shortPlusInt)).containsExactly(15, 25, 35, null);
        assertThat(toList(floatPlusInt)).containsExactly(11.5d, 21.5d, 31.5d, null);
    }

    @Test
    public void byteArithmeticComputesInShort() {
        ColumnVector result = eval(
            new ScalarExpression("*", Literal.ofByte((byte) 100), Literal.ofByte((byte) 3)),
            ShortType.SHORT);

        assertThat(result.getDataType()).isEqualTo(ShortType.SHORT);
        assertThat(toList(result)).containsExactly(
            (short) 300, (short) 300, (short) 300, (short) 300);
    }

    @Test
    public void shortOverflowFails() {
        assertThatThrownBy(() -> eval(
            new ScalarExpression(
                "+", Literal.ofShort(Short.MAX_VALUE), Literal.ofShort((short) 1)),
            ShortType.SHORT))
            .isInstanceOf(ArithmeticException.class)
            .hasMessageContaining("short overflow");
    }

    @Test
    public void coalesceFallsBackToBooleanLiteral() {
        ColumnVector result = eval(
            new ScalarExpression("COALESCE", new Column("flag"), Literal.ofBoolean(false)),
            BooleanType.BOOLEAN);

        assertThat(toList(result)).containsExactly(true, false, false, false);
    }

    @Test
    public void stringsCompareByUtf8Bytes() {
        Expression lower = new Predicate("<", Literal.ofString("abc"), Literal.ofString("abd"));
        // U+00E9 encodes to 0xC3 0xA9, above every ASCII byte
        Expression accented =
            new Predicate(">", Literal.ofString("\u00e9"), Literal.ofString("z"));

        assertThat(toList(eval(lower, BooleanType.BOOLEAN))).containsOnly(true);
        assertThat(toList(eval(accented, BooleanType.BOOLEAN))).containsOnly(true);
    }

    private Expression transform(String column, Expression function) {
        return new ScalarExpression("TRANSFORM", new Column(column), function);
    }

    private ColumnVector eval(Expression expression, DataType outputType) {
        return eval(schema, expression, outputType, batch);
    }

    private ColumnVector eval(
            StructType inputSchema,
            Expression expression,
            DataType outputType,
            ColumnarBatch input) {
        ExpressionEvaluator evaluator =
            engine.getExpressionHandler().getEvaluator(inputSchema, expression, outputType);
        return evaluator.eval(input);
    }
}
