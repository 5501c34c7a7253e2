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

import org.junit.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.exceptions.CorruptVectorException;
import io.lambdakernel.exceptions.KernelException;
import io.lambdakernel.exceptions.ShapeMismatchException;
import io.lambdakernel.expressions.Column;
import io.lambdakernel.lambda.LambdaRegistry;
import io.lambdakernel.types.IntegerType;
import io.lambdakernel.types.StructType;

import io.lambdakernel.internal.metrics.TransformMetrics;

import io.lambdakernel.defaults.internal.data.vector.DefaultArrayVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultConstantVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultIntVector;
import static io.lambdakernel.defaults.utils.DefaultVectorTestUtils.*;

public class TestLambdaDispatcher {
    private static final BoundLambda TIMES_TEN = identityLambda("timesTen");
    private static final BoundLambda TIMES_HUNDRED = identityLambda("timesHundred");
    private static final BoundLambda TIMES_THOUSAND = identityLambda("timesThousand");

    private final TransformMetrics metrics = new TransformMetrics();
    private final List<String> calls = new ArrayList<>();
    private final Map<String, List<Object>> capturesSeen = new HashMap<>();

    @Test
    public void rowsKeepTheirPositionAcrossGroups() {
        ColumnVector arrays = intArrays(row(1, 2), row(3), null, row(), row(4, 5));

        ColumnVector result = dispatcher(16).dispatch(
            arrays,
            new int[] {0, 1, 0, 1, 0},
            Arrays.asList(TIMES_TEN, TIMES_HUNDRED),
            Arrays.asList(Collections.emptyList(), Collections.emptyList()),
            this::multiply);

        assertThat(toList(result)).containsExactly(
            Arrays.asList(10, 20),
            Collections.singletonList(300),
            null,
            Collections.emptyList(),
            Arrays.asList(40, 50));
        assertThat(calls).containsExactly("timesTen[0, 2, 4]", "timesHundred[1, 3]");
        assertThat(metrics.dispatchGroupsCounter.value()).isEqualTo(2);
    }

    @Test
    public void capturesAreSlicedPerGroup() {
        ColumnVector arrays = intArrays(row(1), row(2), row(3));
        ColumnVector tens = ints(7, 8, 9);
        ColumnVector constant = new DefaultConstantVector(IntegerType.INTEGER, 3, 42);

        dispatcher(16).dispatch(
            arrays,
            new int[] {1, 0, 1},
            Arrays.asList(TIMES_TEN, TIMES_HUNDRED),
            Arrays.asList(
                Collections.singletonList(tens),
                Collections.singletonList(constant)),
            this::multiply);

        assertThat(capturesSeen.get("timesTen")).containsExactly(8);
        assertThat(capturesSeen.get("timesHundred")).containsExactly(42, 42);
    }

    @Test
    public void singleActiveGroupIsEvaluatedDirectly() {
        ColumnVector arrays = intArrays(row(1), row(2));

        ColumnVector result = dispatcher(16).dispatch(
            arrays,
            new int[] {2, 2},
            Arrays.asList(TIMES_TEN, TIMES_HUNDRED, TIMES_THOUSAND),
            Arrays.asList(
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList()),
            this::multiply);

        assertThat(toList(result)).containsExactly(
            Collections.singletonList(1000), Collections.singletonList(2000));
        assertThat(calls).containsExactly("timesThousand[0, 1]");
        assertThat(metrics.dispatchGroupsCounter.value()).isEqualTo(1);
    }

    @Test
    public void selectionOutsideOfCandidatesIsCorrupt() {
        ColumnVector arrays = intArrays(row(1), row(2));

        assertThatThrownBy(() -> dispatcher(16).dispatch(
            arrays,
            new int[] {0, 2},
            Arrays.asList(TIMES_TEN, TIMES_HUNDRED),
            Arrays.asList(Collections.emptyList(), Collections.emptyList()),
            this::multiply))
            .isInstanceOf(CorruptVectorException.class)
            .hasMessageContaining("Row 1 selected lambda 2");
        assertThat(calls).isEmpty();
    }

    @Test
    public void selectionMustCoverEveryRow() {
        ColumnVector arrays = intArrays(row(1), row(2));

        assertThatThrownBy(() -> dispatcher(16).dispatch(
            arrays,
            new int[] {0},
            Arrays.asList(TIMES_TEN, TIMES_HUNDRED),
            Arrays.asList(Collections.emptyList(), Collections.emptyList()),
            this::multiply))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    public void candidateCountIsBounded() {
        ColumnVector arrays = intArrays(row(1));

        assertThatThrownBy(() -> dispatcher(2).dispatch(
            arrays,
            new int[] {0},
            Arrays.asList(TIMES_TEN, TIMES_HUNDRED, TIMES_THOUSAND),
            Arrays.asList(
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList()),
            this::multiply))
            .isInstanceOf(KernelException.class)
            .hasMessageContaining("at most 2 lambdas but 3 were given");
    }

    private LambdaDispatcher dispatcher(int maxLambdas) {
        return new LambdaDispatcher(maxLambdas, metrics);
    }

    /** Multiplies every element by a factor depending on the lambda. */
    private ColumnVector multiply(
            ColumnVector arrays, int[] rows, BoundLambda lambda, List<ColumnVector> captures) {
        calls.add(lambda.getName() + Arrays.toString(rows));
        for (ColumnVector capture : captures) {
            capturesSeen.put(lambda.getName(), toList(capture));
        }
        int factor = lambda == TIMES_TEN ? 10 : lambda == TIMES_HUNDRED ? 100 : 1000;
        FlattenedArray flattened = ElementFlattener.flatten(arrays, rows);
        ColumnVector elements = flattened.getElements();
        int[] values = new int[elements.getSize()];
        for (int i = 0; i < values.length; i++) {
            values[i] = elements.getInt(i) * factor;
        }
        return new DefaultArrayVector(
            rows.length,
            INT_ARRAY,
            flattened.getRowNulls(),
            flattened.getOffsets(),
            flattened.getLengths(),
            new DefaultIntVector(values.length, Optional.empty(), values));
    }

    private static BoundLambda identityLambda(String name) {
        return new BoundLambda(
            new LambdaRegistry().registerLambda(
                name,
                new StructType().add("x", IntegerType.INTEGER),
                new StructType(),
                new Column("x")),
            IntegerType.INTEGER,
            IntegerType.INTEGER);
    }
}
