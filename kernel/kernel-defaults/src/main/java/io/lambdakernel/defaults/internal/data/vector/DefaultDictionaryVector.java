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
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.internal.LambdaErrors;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

/**
 * A {@link VectorEncoding#DICTIONARY} vector: the value of row {@code i} is the value of the
 * base vector at {@code indices[i]}. Several rows may share an index. A row is null when the
 * dictionary marks it null, or when the base value it points to is null. The index of a row the
 * dictionary marks null is never read.
 */
public class DefaultDictionaryVector extends RemappedVector {
    private final int[] indices;
    private final Optional<boolean[]> nullability;

    /**
     * @param dictionary  the base vector
     * @param indices     index into the base vector for each row
     * @param size        number of rows
     * @param nullability optional dictionary level nulls
     * @throws io.lambdakernel.exceptions.CorruptVectorException if a non-null row points outside
     *                    of the base vector
     */
    public DefaultDictionaryVector(
        ColumnVector dictionary,
        int[] indices,
        int size,
        Optional<boolean[]> nullability) {
        super(dictionary, size);
        this.indices = requireNonNull(indices, "indices is null");
        this.nullability = requireNonNull(nullability, "nullability is null");
        checkArgument(size >= 0 && indices.length >= size,
            "invalid number of indices (%s) for given size (%s)", indices.length, size);
        nullability.ifPresent(array ->
            checkArgument(array.length >= size,
                "invalid number of values (%s) for given size (%s)", array.length, size));

        int baseSize = dictionary.getSize();
        for (int rowId = 0; rowId < size; rowId++) {
            if (isDictionaryNull(rowId)) {
                continue;
            }
            int index = indices[rowId];
            if (index < 0 || index >= baseSize) {
                throw LambdaErrors.dictionaryIndexOutOfBounds(rowId, index, baseSize);
            }
        }
    }

    public DefaultDictionaryVector(ColumnVector dictionary, int[] indices) {
        this(dictionary, indices, indices.length, Optional.empty());
    }

    @Override
    public VectorEncoding getEncoding() {
        return VectorEncoding.DICTIONARY;
    }

    @Override
    public ColumnVector getDictionary() {
        return underlying;
    }

    @Override
    public int getDictionaryIndex(int rowId) {
        return underlyingRow(rowId);
    }

    @Override
    public boolean isNullAt(int rowId) {
        int baseRow = underlyingRow(rowId);
        return isDictionaryNull(rowId) || underlying.isNullAt(baseRow);
    }

    @Override
    public ArrayValue getArray(int rowId) {
        if (isNullAt(rowId)) {
            return null;
        }
        return super.getArray(rowId);
    }

    private boolean isDictionaryNull(int rowId) {
        return nullability.isPresent() && nullability.get()[rowId];
    }

    @Override
    protected int mapRow(int rowId) {
        return indices[rowId];
    }
}
