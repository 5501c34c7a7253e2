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

import static java.util.Objects.requireNonNull;

import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.types.DataType;

/**
 * Base of the vectors that read every row from another row of an underlying vector, without
 * copying. Subclasses only decide which underlying row backs a row.
 */
abstract class RemappedVector implements ColumnVector {
    protected final ColumnVector underlying;
    protected final int size;

    protected RemappedVector(ColumnVector underlying, int size) {
        this.underlying = requireNonNull(underlying, "underlying vector is null");
        this.size = size;
    }

    /** Row of the underlying vector holding the value of {@code rowId}, a valid row. */
    protected abstract int mapRow(int rowId);

    @Override
    public DataType getDataType() {
        return underlying.getDataType();
    }

    @Override
    public int getSize() {
        return size;
    }

    @Override
    public void close() {
        // the underlying vector may be shared with other vectors
    }

    @Override
    public boolean isNullAt(int rowId) {
        return underlying.isNullAt(underlyingRow(rowId));
    }

    @Override
    public boolean getBoolean(int rowId) {
        return underlying.getBoolean(underlyingRow(rowId));
    }

    @Override
    public byte getByte(int rowId) {
        return underlying.getByte(underlyingRow(rowId));
    }

    @Override
    public short getShort(int rowId) {
        return underlying.getShort(underlyingRow(rowId));
    }

    @Override
    public int getInt(int rowId) {
        return underlying.getInt(underlyingRow(rowId));
    }

    @Override
    public long getLong(int rowId) {
        return underlying.getLong(underlyingRow(rowId));
    }

    @Override
    public float getFloat(int rowId) {
        return underlying.getFloat(underlyingRow(rowId));
    }

    @Override
    public double getDouble(int rowId) {
        return underlying.getDouble(underlyingRow(rowId));
    }

    @Override
    public String getString(int rowId) {
        return underlying.getString(underlyingRow(rowId));
    }

    @Override
    public ArrayValue getArray(int rowId) {
        return underlying.getArray(underlyingRow(rowId));
    }

    protected final int underlyingRow(int rowId) {
        if (rowId < 0 || rowId >= size) {
            throw new IllegalArgumentException(
                String.format("Invalid rowId=%s for size=%s", rowId, size));
        }
        return mapRow(rowId);
    }
}
