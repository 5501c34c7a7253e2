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
import io.lambdakernel.types.DataType;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

/**
 * Base of the {@link io.lambdakernel.data.VectorEncoding#FLAT} vectors that own their values in
 * an on-heap array. Holds the size, the type and the optional null flags; every value accessor
 * fails until a subclass overrides the one matching its type.
 */
public abstract class AbstractColumnVector implements ColumnVector {
    private final int size;
    private final DataType dataType;
    // absent when no row is null
    private final Optional<boolean[]> nullability;

    protected AbstractColumnVector(int size, DataType dataType, Optional<boolean[]> nullability) {
        checkArgument(size >= 0, "invalid size: %s", size);
        nullability.ifPresent(nulls -> checkArgument(nulls.length >= size,
            "invalid number of null flags (%s) for given size (%s)", nulls.length, size));
        this.size = size;
        this.dataType = requireNonNull(dataType, "dataType is null");
        this.nullability = nullability;
    }

    @Override
    public DataType getDataType() {
        return dataType;
    }

    @Override
    public int getSize() {
        return size;
    }

    @Override
    public void close() {
        // values live on heap
    }

    @Override
    public boolean isNullAt(int rowId) {
        checkValidRowId(rowId);
        return nullability.isPresent() && nullability.get()[rowId];
    }

    @Override
    public boolean getBoolean(int rowId) {
        throw wrongAccessor("boolean");
    }

    @Override
    public byte getByte(int rowId) {
        throw wrongAccessor("byte");
    }

    @Override
    public short getShort(int rowId) {
        throw wrongAccessor("short");
    }

    @Override
    public int getInt(int rowId) {
        throw wrongAccessor("int");
    }

    @Override
    public long getLong(int rowId) {
        throw wrongAccessor("long");
    }

    @Override
    public float getFloat(int rowId) {
        throw wrongAccessor("float");
    }

    @Override
    public double getDouble(int rowId) {
        throw wrongAccessor("double");
    }

    @Override
    public String getString(int rowId) {
        throw wrongAccessor("string");
    }

    @Override
    public ArrayValue getArray(int rowId) {
        throw wrongAccessor("array");
    }

    protected void checkValidRowId(int rowId) {
        checkArgument(rowId >= 0 && rowId < size, "invalid row access: %s", rowId);
    }

    private UnsupportedOperationException wrongAccessor(String accessType) {
        return new UnsupportedOperationException(String.format(
            "Trying to access a `%s` value from vector of type `%s`", accessType, dataType));
    }
}
