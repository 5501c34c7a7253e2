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
import java.util.Collections;
import java.util.Optional;

import org.junit.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.exceptions.CorruptVectorException;
import io.lambdakernel.types.IntegerType;

import io.lambdakernel.defaults.internal.data.vector.DefaultArrayVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultDictionaryVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultViewVector;
import static io.lambdakernel.defaults.utils.DefaultVectorTestUtils.*;

public class TestElementFlattener {

    @Test
    public void flattenKeepsRowBoundaries() {
        ColumnVector arrays = intArrays(row(1, 2), row(), null, row(3));

        FlattenedArray flattened = ElementFlattener.flatten(arrays);

        assertThat(flattened.getNumRows()).isEqualTo(4);
        assertThat(flattened.getNumElements()).isEqualTo(3);
        assertThat(toList(flattened.getElements())).containsExactly(1, 2, 3);
        assertThat(flattened.getElementToRowMap()).containsExactly(0, 0, 3);
        assertThat(flattened.getOffset(3)).isEqualTo(2);
        assertThat(flattened.getLength(1)).isEqualTo(0);
        assertThat(flattened.isNullAt(2)).isTrue();
        assertThat(flattened.getLength(2)).isEqualTo(0);
        assertThat(flattened.getRowNulls()).isPresent();
    }

    @Test
    public void contiguousRowsShareTheElementVector() {
        ColumnVector elements = ints(0, 1, 2, 3, 4, 5);
        ColumnVector arrays = arrays(
            IntegerType.INTEGER, elements, new int[] {1, 3}, new int[] {2, 2});

        FlattenedArray flattened = ElementFlattener.flatten(arrays);

        assertThat(flattened.getElements()).isInstanceOf(DefaultViewVector.class);
        assertThat(toList(flattened.getElements())).containsExactly(1, 2, 3, 4);
        assertThat(flattened.getRowNulls()).isEmpty();
    }

    @Test
    public void overlappingRowsAreGathered() {
        ColumnVector elements = ints(10, 20, 30);
        ColumnVector arrays = arrays(
            IntegerType.INTEGER, elements, new int[] {1, 0, 1}, new int[] {2, 2, 1});

        FlattenedArray flattened = ElementFlattener.flatten(arrays);

        assertThat(flattened.getElements().getEncoding()).isEqualTo(VectorEncoding.DICTIONARY);
        assertThat(toList(flattened.getElements())).containsExactly(20, 30, 10, 20, 20);
        assertThat(flattened.getElementToRowMap()).containsExactly(0, 0, 1, 1, 2);
    }

    @Test
    public void flattenSelectedRowsInGivenOrder() {
        ColumnVector arrays = intArrays(row(1), row(2, 3), row(4));

        FlattenedArray flattened = ElementFlattener.flatten(arrays, new int[] {2, 0, 2});

        assertThat(flattened.getNumRows()).isEqualTo(3);
        assertThat(toList(flattened.getElements())).containsExactly(4, 1, 4);
        assertThat(flattened.getElementToRowMap()).containsExactly(0, 1, 2);
    }

    @Test
    public void flattenDictionaryEncodedArrays() {
        ColumnVector base = intArrays(row(1, 2), row(3));
        ColumnVector arrays = new DefaultDictionaryVector(base, new int[] {1, 0, 1});

        FlattenedArray flattened = ElementFlattener.flatten(arrays);

        assertThat(toList(flattened.getElements())).containsExactly(3, 1, 2, 3);
        assertThat(flattened.getElementToRowMap()).containsExactly(0, 1, 1, 2);
    }

    @Test
    public void flattenOnlyEmptyRows() {
        ColumnVector arrays = intArrays(row(), null, row());

        FlattenedArray flattened = ElementFlattener.flatten(arrays);

        assertThat(flattened.getNumElements()).isEqualTo(0);
        assertThat(flattened.getElements().getSize()).isEqualTo(0);
        assertThat(flattened.isNullAt(1)).isTrue();
    }

    @Test
    public void rangeOutsideOfElementsIsCorrupt() {
        ColumnVector arrays = arrays(
            IntegerType.INTEGER, ints(1, 2), new int[] {0, 1}, new int[] {1, 5});

        assertThatThrownBy(() -> ElementFlattener.flatten(arrays))
            .isInstanceOf(CorruptVectorException.class)
            .hasMessageContaining("Array row 1");
    }

    @Test
    public void nullRowIsNotRangeChecked() {
        ColumnVector arrays = new DefaultArrayVector(
            2,
            INT_ARRAY,
            Optional.of(new boolean[] {false, true}),
            new int[] {0, 100},
            new int[] {1, 100},
            ints(7));

        FlattenedArray flattened = ElementFlattener.flatten(arrays);

        assertThat(flattened.getNumElements()).isEqualTo(1);
        assertThat(flattened.isNullAt(1)).isTrue();
        assertThat(Arrays.asList(flattened.getLength(0), flattened.getLength(1)))
            .isEqualTo(Arrays.asList(1, 0));
        assertThat(toList(flattened.getElements())).isEqualTo(Collections.singletonList(7));
    }
}
