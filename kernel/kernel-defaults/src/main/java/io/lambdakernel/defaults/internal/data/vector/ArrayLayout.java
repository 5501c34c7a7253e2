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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.types.ArrayType;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

/**
 * The {@code (elements, offsets, lengths, nulls)} form of an array typed vector, whatever its
 * encoding. Element vectors are shared with the source vector; only the per-row offsets and
 * lengths are materialized. Array vectors without a known layout have their elements copied.
 */
public final class ArrayLayout {
    private final ArrayType type;
    private final ColumnVector elements;
    private final int[] offsets;
    private final int[] lengths;
    private final boolean[] nulls;

    private ArrayLayout(
            ArrayType type,
            ColumnVector elements,
            int[] offsets,
            int[] lengths,
            boolean[] nulls) {
        this.type = type;
        this.elements = elements;
        this.offsets = offsets;
        this.lengths = lengths;
        this.nulls = nulls;
    }

    public static ArrayLayout of(ColumnVector vector) {
        checkArgument(vector.getDataType() instanceof ArrayType,
            "expected an array vector, got %s", vector.getDataType());
        ArrayType type = (ArrayType) vector.getDataType();
        int size = vector.getSize();

        if (vector instanceof DefaultArrayVector) {
            DefaultArrayVector arrays = (DefaultArrayVector) vector;
            int[] offsets = new int[size];
            int[] lengths = new int[size];
            boolean[] nulls = new boolean[size];
            for (int rowId = 0; rowId < size; rowId++) {
                nulls[rowId] = arrays.isNullAt(rowId);
                offsets[rowId] = arrays.getOffset(rowId);
                lengths[rowId] = arrays.getLength(rowId);
            }
            return new ArrayLayout(type, arrays.getElementVector(), offsets, lengths, nulls);
        }

        if (vector.getEncoding() == VectorEncoding.DICTIONARY) {
            ArrayLayout base = of(vector.getDictionary());
            int[] offsets = new int[size];
            int[] lengths = new int[size];
            boolean[] nulls = new boolean[size];
            for (int rowId = 0; rowId < size; rowId++) {
                if (vector.isNullAt(rowId)) {
                    nulls[rowId] = true;
                    continue;
                }
                int index = vector.getDictionaryIndex(rowId);
                offsets[rowId] = base.offsets[index];
                lengths[rowId] = base.lengths[index];
            }
            return new ArrayLayout(type, base.elements, offsets, lengths, nulls);
        }

        if (vector.getEncoding() == VectorEncoding.CONSTANT) {
            boolean[] nulls = new boolean[size];
            int[] lengths = new int[size];
            if (size == 0 || vector.isNullAt(0)) {
                Arrays.fill(nulls, true);
                return new ArrayLayout(
                    type, emptyElements(type), new int[size], lengths, nulls);
            }
            ArrayValue value = vector.getArray(0);
            Arrays.fill(lengths, value.getSize());
            return new ArrayLayout(type, value.getElements(), new int[size], lengths, nulls);
        }

        if (vector instanceof DefaultViewVector) {
            DefaultViewVector view = (DefaultViewVector) vector;
            ArrayLayout underlying = of(view.getUnderlyingVector());
            int start = view.getOffset();
            return new ArrayLayout(
                type,
                underlying.elements,
                Arrays.copyOfRange(underlying.offsets, start, start + size),
                Arrays.copyOfRange(underlying.lengths, start, start + size),
                Arrays.copyOfRange(underlying.nulls, start, start + size));
        }

        return copyOf(vector, type);
    }

    private static ArrayLayout copyOf(ColumnVector vector, ArrayType type) {
        int size = vector.getSize();
        int[] offsets = new int[size];
        int[] lengths = new int[size];
        boolean[] nulls = new boolean[size];
        List<Object> values = new ArrayList<>();
        for (int rowId = 0; rowId < size; rowId++) {
            ArrayValue value = vector.isNullAt(rowId) ? null : vector.getArray(rowId);
            if (value == null) {
                nulls[rowId] = true;
                continue;
            }
            offsets[rowId] = values.size();
            lengths[rowId] = value.getSize();
            ColumnVector rowElements = value.getElements();
            for (int i = 0; i < rowElements.getSize(); i++) {
                values.add(VectorUtils.getValueAsObject(rowElements, i));
            }
        }
        return new ArrayLayout(
            type,
            DefaultGenericVector.fromList(type.getElementType(), values),
            offsets,
            lengths,
            nulls);
    }

    private static ColumnVector emptyElements(ArrayType type) {
        return DefaultGenericVector.fromArray(type.getElementType(), new Object[0]);
    }

    public ArrayType getType() {
        return type;
    }

    public int getSize() {
        return offsets.length;
    }

    public ColumnVector getElements() {
        return elements;
    }

    public boolean isNullAt(int rowId) {
        return nulls[rowId];
    }

    public int getOffset(int rowId) {
        return offsets[rowId];
    }

    public int getLength(int rowId) {
        return lengths[rowId];
    }

    /**
     * @throws io.lambdakernel.exceptions.CorruptVectorException if the non-null row
     *         {@code rowId} reads outside of the element vector
     */
    public void checkRange(int rowId) {
        if (nulls[rowId]) {
            return;
        }
        int offset = offsets[rowId];
        int length = lengths[rowId];
        if (offset < 0 || length < 0 || (long) offset + length > elements.getSize()) {
            throw LambdaErrors.arrayRangeOutOfBounds(rowId, offset, length, elements.getSize());
        }
    }

    /** Rebuild an array vector of this layout's shape over the given elements. */
    public DefaultArrayVector toVector(ColumnVector newElements, ArrayType newType) {
        return new DefaultArrayVector(
            getSize(), newType, Optional.of(nulls.clone()), offsets, lengths, newElements);
    }
}
