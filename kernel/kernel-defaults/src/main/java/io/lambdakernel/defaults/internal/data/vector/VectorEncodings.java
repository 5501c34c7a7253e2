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

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.types.ArrayType;

/**
 * Structural operations on encoded vectors: peeling a dictionary layer off a vector, wrapping a
 * vector back into a dictionary and expanding an encoded vector into a flat one.
 */
public final class VectorEncodings {
    private VectorEncodings() {}

    /**
     * A dictionary encoded vector split into its base vector and, for every row, the index of
     * the base row holding its value. Rows that are null in the original vector are marked null
     * here and their index is meaningless.
     */
    public static final class PeeledDictionary {
        private final ColumnVector base;
        private final int[] indices;
        private final Optional<boolean[]> nulls;

        PeeledDictionary(ColumnVector base, int[] indices, Optional<boolean[]> nulls) {
            this.base = requireNonNull(base);
            this.indices = requireNonNull(indices);
            this.nulls = requireNonNull(nulls);
        }

        public ColumnVector getBase() {
            return base;
        }

        public int[] getIndices() {
            return indices;
        }

        public Optional<boolean[]> getNulls() {
            return nulls;
        }

        public int getSize() {
            return indices.length;
        }

        public boolean isNullAt(int rowId) {
            return nulls.isPresent() && nulls.get()[rowId];
        }

        public int getIndex(int rowId) {
            return indices[rowId];
        }
    }

    /**
     * Strip every dictionary layer of {@code vector}. Nested dictionaries are peeled in one step
     * by composing their indices.
     *
     * @return the base vector and the composed indices, or empty if {@code vector} is not
     *         dictionary encoded
     */
    public static Optional<PeeledDictionary> peelDictionary(ColumnVector vector) {
        if (vector.getEncoding() != VectorEncoding.DICTIONARY) {
            return Optional.empty();
        }
        int size = vector.getSize();
        int[] indices = new int[size];
        boolean[] nulls = new boolean[size];
        boolean hasNulls = false;
        for (int rowId = 0; rowId < size; rowId++) {
            // a non-null row has valid indices at every dictionary level
            if (vector.isNullAt(rowId)) {
                nulls[rowId] = true;
                hasNulls = true;
            } else {
                indices[rowId] = vector.getDictionaryIndex(rowId);
            }
        }

        ColumnVector base = vector.getDictionary();
        while (base.getEncoding() == VectorEncoding.DICTIONARY) {
            for (int rowId = 0; rowId < size; rowId++) {
                if (!nulls[rowId]) {
                    indices[rowId] = base.getDictionaryIndex(indices[rowId]);
                }
            }
            base = base.getDictionary();
        }
        return Optional.of(
            new PeeledDictionary(base, indices, hasNulls ? Optional.of(nulls) : Optional.empty()));
    }

    /**
     * Whether no two non-null {@code rows} of the peeled dictionary share a base row.
     *
     * @param rows the rows to consider, each a valid row of {@code peeled}
     */
    public static boolean isInjective(PeeledDictionary peeled, int[] rows) {
        boolean[] seen = new boolean[peeled.getBase().getSize()];
        for (int rowId : rows) {
            if (peeled.isNullAt(rowId)) {
                continue;
            }
            int index = peeled.getIndex(rowId);
            if (seen[index]) {
                return false;
            }
            seen[index] = true;
        }
        return true;
    }

    /**
     * Expand a dictionary or constant encoded vector into a flat vector with the same logical
     * values. Array vectors keep sharing their element vector; other types are copied.
     */
    public static ColumnVector flattenDictionary(ColumnVector vector) {
        if (vector.getDataType() instanceof ArrayType) {
            ArrayLayout layout = ArrayLayout.of(vector);
            return layout.toVector(layout.getElements(), layout.getType());
        }
        if (vector.getEncoding() == VectorEncoding.FLAT) {
            return vector;
        }
        Object[] values = new Object[vector.getSize()];
        for (int rowId = 0; rowId < values.length; rowId++) {
            values[rowId] = VectorUtils.getValueAsObject(vector, rowId);
        }
        return DefaultGenericVector.fromArray(vector.getDataType(), values);
    }
}
