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

import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.types.DataType;

/**
 * A {@link VectorEncoding#CONSTANT} vector: every row holds the same value, or every row is
 * null. Array typed constants hold an {@link ArrayValue}.
 */
public class DefaultConstantVector implements ColumnVector {
    private final DataType dataType;
    private final int numRows;
    private final Object value;

    public DefaultConstantVector(DataType dataType, int numRows, Object value) {
        this.dataType = dataType;
        this.numRows = numRows;
        this.value = value;
    }

    /**
     * Create a constant vector of {@code numRows} rows holding the value of {@code vector} at
     * {@code rowId}.
     */
    public static DefaultConstantVector fromRow(ColumnVector vector, int rowId, int numRows) {
        return new DefaultConstantVector(
            vector.getDataType(), numRows, VectorUtils.getValueAsObject(vector, rowId));
    }

    /** @return the value shared by every row, {@code null} when all rows are null */
    public Object getValue() {
        return value;
    }

    @Override
    public VectorEncoding getEncoding() {
        return VectorEncoding.CONSTANT;
    }

    @Override
    public DataType getDataType() {
        return dataType;
    }

    @Override
    public int getSize() {
        return numRows;
    }

    @Override
    public void close() {
        // nothing to close
    }

    @Override
    public boolean isNullAt(int rowId) {
        return value == null;
    }

    @Override
    public boolean getBoolean(int rowId) {
        return (boolean) value;
    }

    @Override
    public byte getByte(int rowId) {
        return (byte) value;
    }

    @Override
    public short getShort(int rowId) {
        return (short) value;
    }

    @Override
    public int getInt(int rowId) {
        return (int) value;
    }

    @Override
    public long getLong(int rowId) {
        return (long) value;
    }

    @Override
    public float getFloat(int rowId) {
        return (float) value;
    }

    @Override
    public double getDouble(int rowId) {
        return (double) value;
    }

    @Override
    public String getString(int rowId) {
        return (String) value;
    }

    @Override
    public ArrayValue getArray(int rowId) {
        return (ArrayValue) value;
    }
}
