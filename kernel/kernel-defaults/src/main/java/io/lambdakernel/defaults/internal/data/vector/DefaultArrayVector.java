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
package io.lambdakernel.defaults.internal.data.vector;

import java.util.Optional;
import static java.util.Objects.requireNonNull;

import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.types.ArrayType;
import io.lambdakernel.types.DataType;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

/**
 * {@link io.lambdakernel.data.ColumnVector} implementation for array type data.
 *
 * <p>Each row is an {@code (offset, length)} range of the shared element vector. Ranges need
 * not be sorted: they can overlap, repeat or leave unused elements between them. Ranges are not
 * validated here; readers check them when they access a row.
 */
public class DefaultArrayVector extends AbstractColumnVector {
    private final int[] offsets;
    private final int[] lengths;
    private final ColumnVector elementVector;

    /**
     * Create an instance of {@link io.lambdakernel.data.ColumnVector} for array type.
     *
     * @param size          number of elements in the vector.
     * @param type          array type of the vector
     * @param nullability   Optional array of nullability value for each element in the vector.
     *                      All values in the vector are considered non-null when parameter is
     *                      empty.
     * @param offsets       index in the element vector of the first element of each row
     * @param lengths       number of elements of each row
     * @param elementVector Vector containing the array elements.
     */
    public DefaultArrayVector(
        int size,
        DataType type,
        Optional<boolean[]> nullability,
        int[] offsets,
        int[] lengths,
        ColumnVector elementVector) {
        super(size, type, nullability);
        checkArgument(type instanceof ArrayType, "invalid array type: %s", type);
        this.offsets = requireNonNull(offsets, "offsets is null");
        this.lengths = requireNonNull(lengths, "lengths is null");
        checkArgument(offsets.length >= size && lengths.length >= size,
            "invalid offsets/lengths size for %s rows", size);
        this.elementVector = requireNonNull(elementVector, "elementVector is null");
    }

    /**
     * Create an array vector from consecutive offsets: row {@code i} spans
     * {@code [offsets[i], offsets[i + 1])}.
     */
    public DefaultArrayVector(
        int size,
        DataType type,
        Optional<boolean[]> nullability,
        int[] offsets,
        ColumnVector elementVector) {
        this(size, type, nullability, offsets, lengthsFromOffsets(size, offsets), elementVector);
    }

    /**
     * Get the value at given {@code rowId}. Returns {@code null} if the slot for {@code rowId} is
     * null.
     */
    @Override
    public ArrayValue getArray(int rowId) {
        checkValidRowId(rowId);
        if (isNullAt(rowId)) {
            return null;
        }
        int start = offsets[rowId];
        int length = lengths[rowId];
        if (start < 0 || length < 0 || (long) start + length > elementVector.getSize()) {
            throw LambdaErrors.arrayRangeOutOfBounds(
                rowId, start, length, elementVector.getSize());
        }
        return new ArrayValue() {

            // create a view over the elements for this rowId
            private final ColumnVector elements =
                new DefaultViewVector(elementVector, start, start + length);

            @Override
            public int getSize() {
                return elements.getSize();
            }

            @Override
            public ColumnVector getElements() {
                return elements;
            }
        };
    }

    public ColumnVector getElementVector() {
        return elementVector;
    }

    public int getOffset(int rowId) {
        checkValidRowId(rowId);
        return offsets[rowId];
    }

    public int getLength(int rowId) {
        checkValidRowId(rowId);
        return lengths[rowId];
    }

    private static int[] lengthsFromOffsets(int size, int[] offsets) {
        checkArgument(offsets.length >= size + 1, "invalid offset array size");
        int[] lengths = new int[size];
        for (int i = 0; i < size; i++) {
            lengths[i] = offsets[i + 1] - offsets[i];
        }
        return lengths;
    }
}
