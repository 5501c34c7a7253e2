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

import java.util.*;
import java.util.concurrent.*;

import org.junit.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.engine.Engine;
import io.lambdakernel.engine.LambdaBodyEvaluator;
import io.lambdakernel.engine.MetricsReporter;
import io.lambdakernel.exceptions.CorruptVectorException;
import io.lambdakernel.exceptions.ShapeMismatchException;
import io.lambdakernel.expressions.Column;
import io.lambdakernel.expressions.Literal;
import io.lambdakernel.expressions.ScalarExpression;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.lambda.LambdaRegistry;
import io.lambdakernel.metrics.TransformMetricsResult;
import io.lambdakernel.metrics.TransformReport;
import io.lambdakernel.types.DataType;
import io.lambdakernel.types.IntegerType;
import io.lambdakernel.types.StructType;

import io.lambdakernel.internal.MapConfigurationProvider;
import io.lambdakernel.internal.TransformConfig;

import io.lambdakernel.defaults.engine.DefaultEngine;
import io.lambdakernel.defaults.internal.data.vector.DefaultArrayVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultBooleanVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultConstantVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultDictionaryVector;
import static io.lambdakernel.defaults.utils.DefaultVectorTestUtils.*;

public class TestTransformEvaluator {
    private static final StructType INPUT_SCHEMA = new StructType()
        .add("arr", INT_ARRAY)
        .add("y", IntegerType.INTEGER);

    private final LambdaRegistry registry = new LambdaRegistry();

    private final LambdaHandle plusOne = registry.registerLambda(
        "plusOne",
        new StructType().add("x", IntegerType.INTEGER),
        new StructType(),
        new ScalarExpression("+", new Column("x"), Literal.ofInt(1)));

    private final LambdaHandle timesTwo = registry.registerLambda(
        "timesTwo",
        new StructType().add("x", IntegerType.INTEGER),
        new StructType(),
        new ScalarExpression("*", new Column("x"), Literal.ofInt(2)));

    private final LambdaHandle plusY = registry.registerLambda(
        "plusY",
        new StructType().add("x", IntegerType.INTEGER),
        INPUT_SCHEMA,
        new ScalarExpression("+", new Column("x"), new Column("y")));

    private final List<TransformReport> reports = new CopyOnWriteArrayList<>();

    /////////////////////////
    // Single lambda       //
    /////////////////////////

    @Test
    public void transformEveryElement() {
        ColumnVector arrays = intArrays(row(1, 2, 3), row(), null, row(4));

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(result.getDataType()).isEqualTo(INT_ARRAY);
        assertThat(toList(result)).containsExactly(
            Arrays.asList(2, 3, 4), Collections.emptyList(), null, Collections.singletonList(5));
        TransformMetricsResult metrics = lastMetrics();
        assertThat(metrics.getNumInputRows()).isEqualTo(4);
        assertThat(metrics.getNumLambdaInvocations()).isEqualTo(1);
        assertThat(metrics.getNumElementsEvaluated()).isEqualTo(4);
    }

    @Test
    public void nullElementsReachTheLambda() {
        ColumnVector arrays = intArrays(row(1, null), row((Integer) null));

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(toList(result)).containsExactly(Arrays.asList(2, null), Arrays.asList(
            (Object) null));
    }

    @Test
    public void emptyInputEvaluatesNothing() {
        ColumnVector arrays = intArrays();

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(result.getSize()).isEqualTo(0);
        assertThat(lastMetrics().getNumLambdaInvocations()).isEqualTo(0);
    }

    @Test
    public void rowsWithoutElementsSkipTheLambda() {
        ColumnVector arrays = intArrays(row(), null);

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(toList(result)).containsExactly(Collections.emptyList(), null);
        assertThat(lastMetrics().getNumLambdaInvocations()).isEqualTo(0);
    }

    @Test
    public void capturesAreReadPerRow() {
        ColumnVector arrays = intArrays(row(1, 2), row(3), null);
        ColumnVector y = ints(10, 20, 30);

        ColumnVector result = transform(engine(), arrays, plusY, y);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(11, 12), Collections.singletonList(23), null);
    }

    @Test
    public void nullCaptureGivesNullResults() {
        ColumnVector arrays = intArrays(row(1, 2), row(3));
        ColumnVector y = ints(null, 1);

        ColumnVector result = transform(engine(), arrays, plusY, y);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(null, null), Collections.singletonList(4));
    }

    @Test
    public void largeBatchMatchesElementWiseResult() {
        ColumnVector arrays = makeArrayVector(
            1000, rowId -> rowId % 7, i -> i * 3, rowId -> rowId % 11 == 0);
        Integer[] captures = new Integer[1000];
        for (int rowId = 0; rowId < captures.length; rowId++) {
            captures[rowId] = rowId % 5 == 0 ? null : rowId;
        }
        ColumnVector y = ints(captures);

        ColumnVector result = transform(engine(), arrays, plusY, y);

        List<Object> input = toList(arrays);
        List<Object> output = toList(result);
        for (int rowId = 0; rowId < 1000; rowId++) {
            if (input.get(rowId) == null) {
                assertThat(output.get(rowId)).isNull();
                continue;
            }
            List<Object> expected = new ArrayList<>();
            for (Object element : (List<?>) input.get(rowId)) {
                expected.add(captures[rowId] == null ? null : (Integer) element + captures[rowId]);
            }
            assertThat(output.get(rowId)).as("row %s", rowId).isEqualTo(expected);
        }
    }

    /////////////////////////
    // Dictionary peeling  //
    /////////////////////////

    @Test
    public void dictionaryEncodedArraysEvaluateEachBaseRowOnce() {
        ColumnVector base = intArrays(row(1, 2), row(3));
        ColumnVector arrays = new DefaultDictionaryVector(base, new int[] {1, 0, 1, 1});

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(4),
            Arrays.asList(2, 3),
            Collections.singletonList(4),
            Collections.singletonList(4));
        TransformMetricsResult metrics = lastMetrics();
        assertThat(metrics.getNumDictionaryPeels()).isEqualTo(1);
        assertThat(metrics.getNumElementsEvaluated()).isEqualTo(3);
    }

    @Test
    public void dictionaryResultMatchesFlatResult() {
        ColumnVector base = intArrays(row(5), row(), null, row(6, 7));
        int[] indices = {3, 3, 2, 0, 1, 0};
        ColumnVector dictionary = new DefaultDictionaryVector(base, indices);
        List<Integer>[] flatRows = new List[indices.length];
        for (int i = 0; i < indices.length; i++) {
            flatRows[i] = toIntegerList(base, indices[i]);
        }

        ColumnVector fromDictionary = transform(engine(), dictionary, plusOne);
        ColumnVector fromFlat = transform(engine(), intArrays(flatRows), plusOne);

        assertThat(toList(fromDictionary)).isEqualTo(toList(fromFlat));
    }

    @Test
    public void nestedDictionariesArePeeledAtOnce() {
        ColumnVector base = intArrays(row(1, 2), row(3));
        ColumnVector inner = new DefaultDictionaryVector(base, new int[] {1, 0});
        ColumnVector arrays = new DefaultDictionaryVector(inner, new int[] {0, 0, 1});

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(4), Collections.singletonList(4), Arrays.asList(2, 3));
        assertThat(lastMetrics().getNumElementsEvaluated()).isEqualTo(3);
    }

    @Test
    public void dictionaryLevelNullsStayNull() {
        ColumnVector base = intArrays(row(1, 2), row(3));
        ColumnVector arrays = new DefaultDictionaryVector(
            base, new int[] {0, 99, 1}, 3, Optional.of(new boolean[] {false, true, false}));

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(2, 3), null, Collections.singletonList(4));
    }

    @Test
    public void capturesVaryingWithinADictionaryEntryAreNotPeeled() {
        ColumnVector base = intArrays(row(1), row(2));
        ColumnVector arrays = new DefaultDictionaryVector(base, new int[] {0, 0, 1});
        ColumnVector y = ints(10, 20, 30);

        ColumnVector result = transform(engine(), arrays, plusY, y);

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(11),
            Collections.singletonList(21),
            Collections.singletonList(32));
        TransformMetricsResult metrics = lastMetrics();
        assertThat(metrics.getNumDictionaryPeels()).isEqualTo(0);
        assertThat(metrics.getNumPeelingFallbacks()).isEqualTo(1);
        assertThat(metrics.getNumElementsEvaluated()).isEqualTo(3);
    }

    @Test
    public void capturesSharingTheArrayIndicesArePeeled() {
        ColumnVector base = intArrays(row(1), row(2));
        int[] indices = {0, 0, 1};
        ColumnVector arrays = new DefaultDictionaryVector(base, indices);
        ColumnVector y = new DefaultDictionaryVector(ints(100, 200), indices);

        ColumnVector result = transform(engine(), arrays, plusY, y);

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(101),
            Collections.singletonList(101),
            Collections.singletonList(202));
        TransformMetricsResult metrics = lastMetrics();
        assertThat(metrics.getNumDictionaryPeels()).isEqualTo(1);
        assertThat(metrics.getNumElementsEvaluated()).isEqualTo(2);
    }

    @Test
    public void capturesOfDistinctBaseRowsArePeeled() {
        ColumnVector base = intArrays(row(1), row(2));
        ColumnVector arrays = new DefaultDictionaryVector(base, new int[] {1, 0});
        ColumnVector y = ints(10, 20);

        ColumnVector result = transform(engine(), arrays, plusY, y);

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(12), Collections.singletonList(21));
        assertThat(lastMetrics().getNumDictionaryPeels()).isEqualTo(1);
    }

    @Test
    public void constantCapturesAreKeptWhenPeeling() {
        ColumnVector base = intArrays(row(1), row(2));
        ColumnVector arrays = new DefaultDictionaryVector(base, new int[] {0, 1, 1, 0});
        ColumnVector y = new DefaultConstantVector(IntegerType.INTEGER, 4, 5);

        ColumnVector result = transform(engine(), arrays, plusY, y);

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(6),
            Collections.singletonList(7),
            Collections.singletonList(7),
            Collections.singletonList(6));
        assertThat(lastMetrics().getNumDictionaryPeels()).isEqualTo(1);
        assertThat(lastMetrics().getNumElementsEvaluated()).isEqualTo(2);
    }

    @Test
    public void dictionaryPeelingCanBeDisabled() {
        ColumnVector base = intArrays(row(1, 2), row(3));
        ColumnVector arrays = new DefaultDictionaryVector(base, new int[] {1, 0, 1, 1});
        Engine engine = engine(TransformConfig.DICTIONARY_PEELING_ENABLED.getKey(), "false");

        ColumnVector result = transform(engine, arrays, plusOne);

        assertThat(toList(result).get(1)).isEqualTo(Arrays.asList(2, 3));
        assertThat(lastMetrics().getNumDictionaryPeels()).isEqualTo(0);
        assertThat(lastMetrics().getNumElementsEvaluated()).isEqualTo(5);
    }

    /////////////////////////
    // Constant peeling    //
    /////////////////////////

    @Test
    public void constantArraysAreEvaluatedOnce() {
        ColumnVector arrays = DefaultConstantVector.fromRow(intArrays(row(1, 2)), 0, 1000);

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(result.getEncoding()).isEqualTo(VectorEncoding.CONSTANT);
        assertThat(result.getSize()).isEqualTo(1000);
        assertThat(toList(result).get(999)).isEqualTo(Arrays.asList(2, 3));
        TransformMetricsResult metrics = lastMetrics();
        assertThat(metrics.getNumConstantPeels()).isEqualTo(1);
        assertThat(metrics.getNumElementsEvaluated()).isEqualTo(2);
    }

    @Test
    public void constantNullArrayGivesNullRows() {
        ColumnVector arrays = new DefaultConstantVector(INT_ARRAY, 3, null);

        ColumnVector result = transform(engine(), arrays, plusOne);

        assertThat(toList(result)).containsExactly(null, null, null);
        assertThat(lastMetrics().getNumLambdaInvocations()).isEqualTo(0);
    }

    @Test
    public void constantArrayWithVaryingCapturesIsEvaluatedPerRow() {
        ColumnVector arrays = DefaultConstantVector.fromRow(intArrays(row(1)), 0, 3);

        ColumnVector result = transform(engine(), arrays, plusY, ints(1, 2, 3));

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(2),
            Collections.singletonList(3),
            Collections.singletonList(4));
        assertThat(lastMetrics().getNumConstantPeels()).isEqualTo(0);
    }

    @Test
    public void constantPeelingCanBeDisabled() {
        ColumnVector arrays = DefaultConstantVector.fromRow(intArrays(row(1, 2)), 0, 10);
        Engine engine = engine(TransformConfig.CONSTANT_PEELING_ENABLED.getKey(), "false");

        ColumnVector result = transform(engine, arrays, plusOne);

        assertThat(toList(result).get(9)).isEqualTo(Arrays.asList(2, 3));
        assertThat(lastMetrics().getNumConstantPeels()).isEqualTo(0);
        assertThat(lastMetrics().getNumElementsEvaluated()).isEqualTo(20);
    }

    /////////////////////////
    // Lambda selection    //
    /////////////////////////

    @Test
    public void eachRowAppliesItsSelectedLambda() {
        Engine engine = engine();
        ColumnVector arrays = intArrays(row(1, 2), row(3), null, row(4));

        ColumnVector result = new TransformEvaluator(engine).transform(
            arrays,
            new int[] {0, 1, 1, 0},
            bind(engine, plusOne, timesTwo),
            noCaptures(2));

        assertThat(toList(result)).containsExactly(
            Arrays.asList(2, 3), Collections.singletonList(6), null, Collections.singletonList(5));
        TransformReport report = lastReport();
        assertThat(report.getLambdaNames()).containsExactly("plusOne", "timesTwo");
        assertThat(report.getTransformMetrics().getNumDispatchGroups()).isEqualTo(2);
        assertThat(report.getTransformMetrics().getNumLambdaInvocations()).isEqualTo(2);
    }

    @Test
    public void booleanConditionSelectsBetweenTwoLambdas() {
        Engine engine = engine();
        ColumnVector arrays = intArrays(row(1), row(2), row(3));
        ColumnVector condition = new DefaultBooleanVector(
            3, Optional.of(new boolean[] {false, false, true}), new boolean[] {true, false, true});

        ColumnVector result = new TransformEvaluator(engine).transform(
            arrays, condition, bind(engine, plusOne, timesTwo), noCaptures(2));

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(2),
            Collections.singletonList(4),
            Collections.singletonList(6));
    }

    @Test
    public void selectedRowsOfADictionaryArePeeled() {
        Engine engine = engine();
        ColumnVector base = intArrays(row(1), row(2));
        ColumnVector arrays = new DefaultDictionaryVector(base, new int[] {0, 1, 0, 1});

        ColumnVector result = new TransformEvaluator(engine).transform(
            arrays,
            new int[] {0, 0, 1, 1},
            bind(engine, plusOne, timesTwo),
            noCaptures(2));

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(2),
            Collections.singletonList(3),
            Collections.singletonList(2),
            Collections.singletonList(4));
        assertThat(lastMetrics().getNumDictionaryPeels()).isEqualTo(2);
    }

    @Test
    public void selectionOutsideOfCandidatesIsCorrupt() {
        Engine engine = engine();
        ColumnVector arrays = intArrays(row(1), row(2));

        assertThatThrownBy(() -> new TransformEvaluator(engine).transform(
            arrays, new int[] {0, -1}, bind(engine, plusOne, timesTwo), noCaptures(2)))
            .isInstanceOf(CorruptVectorException.class);
        assertThat(lastReport().getException()).isPresent();
    }

    /////////////////////////
    // Errors              //
    /////////////////////////

    @Test
    public void captureSizeMustMatchRows() {
        ColumnVector arrays = intArrays(row(1), row(2));

        assertThatThrownBy(() -> transform(engine(), arrays, plusY, ints(1, 2, 3)))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("Captured column `y`: expected 2 rows but found 3 rows");
    }

    @Test
    public void inputMustBeAnArray() {
        assertThatThrownBy(() -> transform(engine(), ints(1, 2), plusOne))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("transform expects an array input");
    }

    @Test
    public void corruptArrayRangeIsReported() {
        ColumnVector arrays = arrays(
            IntegerType.INTEGER, ints(1, 2), new int[] {0, 2}, new int[] {2, 1});

        assertThatThrownBy(() -> transform(engine(), arrays, plusOne))
            .isInstanceOf(CorruptVectorException.class);
        assertThat(lastReport().getException().get())
            .isInstanceOf(CorruptVectorException.class);
    }

    @Test
    public void lambdaFailurePropagatesAndIsReported() {
        ColumnVector arrays = intArrays(row(1, Integer.MAX_VALUE));

        assertThatThrownBy(() -> transform(engine(), arrays, plusOne))
            .isInstanceOf(ArithmeticException.class)
            .hasMessageContaining("overflow");
        TransformReport report = lastReport();
        assertThat(report.getFunctionName()).isEqualTo(TransformEvaluator.FUNCTION_NAME);
        assertThat(report.getException().get()).isInstanceOf(ArithmeticException.class);
    }

    @Test
    public void failingGroupAbortsTheWholeSelection() {
        Engine engine = engine();
        ColumnVector arrays = intArrays(row(1, 2), row(Integer.MAX_VALUE), row(3));

        Throwable thrown = catchThrowable(() -> new TransformEvaluator(engine).transform(
            arrays,
            new int[] {0, 1, 0},
            bind(engine, plusOne, timesTwo),
            noCaptures(2)));

        assertThat(thrown)
            .isInstanceOf(ArithmeticException.class)
            .hasMessageContaining("integer overflow");
        TransformReport report = lastReport();
        assertThat(report.getLambdaNames()).containsExactly("plusOne", "timesTwo");
        assertThat(report.getException().get()).isSameAs(thrown);
    }

    @Test
    public void resultOfWrongSizeIsRejected() {
        LambdaBodyEvaluator shortResults = new LambdaBodyEvaluator() {
            @Override
            public DataType resolveReturnType(LambdaHandle lambda, DataType elementType) {
                return IntegerType.INTEGER;
            }

            @Override
            public ColumnVector evaluate(
                    LambdaHandle lambda, ColumnVector elements, List<ColumnVector> captures) {
                return ints(1);
            }
        };
        Engine engine = new DefaultEngine(new MapConfigurationProvider(new HashMap<>())) {
            @Override
            public LambdaBodyEvaluator getLambdaBodyEvaluator() {
                return shortResults;
            }
        };
        ColumnVector arrays = intArrays(row(1, 2, 3));

        assertThatThrownBy(() -> transform(engine, arrays, plusOne))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("Result of lambda `plusOne`: expected 3 rows but found 1 rows");
    }

    /////////////////////////
    // Metrics             //
    /////////////////////////

    @Test
    public void reportsCanBeDisabled() {
        Engine engine = engine(TransformConfig.METRICS_ENABLED.getKey(), "false");

        transform(engine, intArrays(row(1)), plusOne);

        assertThat(reports).isEmpty();
    }

    @Test
    public void everyCallGetsItsOwnReport() {
        Engine engine = engine();
        BoundLambda lambda = bind(engine, plusOne).get(0);
        TransformEvaluator evaluator = new TransformEvaluator(engine);

        evaluator.transform(intArrays(row(1, 2)), lambda, Collections.emptyList());
        evaluator.transform(intArrays(row(1), row(2), row(3)), lambda, Collections.emptyList());

        assertThat(reports).hasSize(2);
        assertThat(reports.get(0).getReportUUID()).isNotEqualTo(reports.get(1).getReportUUID());
        assertThat(reports.get(0).getTransformMetrics().getNumElementsEvaluated()).isEqualTo(2);
        assertThat(reports.get(1).getTransformMetrics().getNumElementsEvaluated()).isEqualTo(3);
        assertThat(reports.get(1).getTransformMetrics().getNumInputRows()).isEqualTo(3);
    }

    @Test
    public void evaluatorIsSharedAcrossThreads() throws Exception {
        Engine engine = engine();
        BoundLambda lambda = bind(engine, plusY).get(0);
        TransformEvaluator evaluator = new TransformEvaluator(engine);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<Object>>> futures = new ArrayList<>();
            for (int batch = 0; batch < 32; batch++) {
                final int value = batch;
                futures.add(executor.submit(() -> toList(evaluator.transform(
                    intArrays(row(value, value), row(value)),
                    lambda,
                    Collections.singletonList(ints(value, -value))))));
            }
            for (int batch = 0; batch < futures.size(); batch++) {
                assertThat(futures.get(batch).get()).containsExactly(
                    Arrays.asList(2 * batch, 2 * batch), Collections.singletonList(0));
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(reports).hasSize(32);
    }

    /////////////////////////
    // Helpers             //
    /////////////////////////

    private Engine engine(String... properties) {
        Map<String, String> config = new HashMap<>();
        for (int i = 0; i < properties.length; i += 2) {
            config.put(properties[i], properties[i + 1]);
        }
        MetricsReporter reporter = report -> reports.add((TransformReport) report);
        return new DefaultEngine(
                new MapConfigurationProvider(TransformConfig.validateProperties(config))) {
            @Override
            public List<MetricsReporter> getMetricsReporters() {
                return Collections.singletonList(reporter);
            }
        };
    }

    private static List<BoundLambda> bind(Engine engine, LambdaHandle... lambdas) {
        return LambdaBinder.bindAll(
            Arrays.asList(lambdas),
            IntegerType.INTEGER,
            INPUT_SCHEMA,
            engine.getLambdaBodyEvaluator());
    }

    private static ColumnVector transform(
            Engine engine, ColumnVector arrays, LambdaHandle lambda, ColumnVector... captures) {
        return new TransformEvaluator(engine)
            .transform(arrays, bind(engine, lambda).get(0), Arrays.asList(captures));
    }

    private static List<List<ColumnVector>> noCaptures(int numLambdas) {
        List<List<ColumnVector>> captures = new ArrayList<>();
        for (int i = 0; i < numLambdas; i++) {
            captures.add(Collections.emptyList());
        }
        return captures;
    }

    private static List<Integer> toIntegerList(ColumnVector arrays, int rowId) {
        if (arrays.isNullAt(rowId)) {
            return null;
        }
        List<Integer> values = new ArrayList<>();
        for (Object value : (List<?>) toList(arrays).get(rowId)) {
            values.add((Integer) value);
        }
        return values;
    }

    private TransformReport lastReport() {
        assertThat(reports).isNotEmpty();
        return reports.get(reports.size() - 1);
    }

    private TransformMetricsResult lastMetrics() {
        return lastReport().getTransformMetrics();
    }
}
