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

import io.lambdakernel.data.ColumnVector;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

/**
 * The rows {@code [start, end)} of another vector, read in place. Flattening uses it when the
 * selected arrays lie back to back in their elements vector.
 */
public class DefaultViewVector extends RemappedVector {
    private final int start;

    /**
     * @param underlyingVector vector to read
     * @param start first row of {@code underlyingVector} in the view
     * @param end row of {@code underlyingVector} where the view ends (exclusive)
     */
    public DefaultViewVector(ColumnVector underlyingVector, int start, int end) {
        super(underlyingVector, end - start);
        checkArgument(start >= 0 && start <= end && end <= underlyingVector.getSize(),
            "invalid view [%s, %s) over a vector of size %s",
            start, end, underlyingVector.getSize());
        this.start = start;
    }

    public ColumnVector getUnderlyingVector() {
        return underlying;
    }

    public int getOffset() {
        return start;
    }

    @Override
    protected int mapRow(int rowId) {
        return start + rowId;
    }
}
