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

import java.util.List;

import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.types.*;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

/**
 * Column vector over boxed values, a {@code null} entry being a null row. Array typed values are
 * expected as {@link ArrayValue}s. Used where values are gathered one at a time: copies of
 * vectors of unknown implementation and empty results.
 */
public class DefaultGenericVector implements ColumnVector {

    public static DefaultGenericVector fromArray(DataType dataType, Object[] values) {
        return new DefaultGenericVector(dataType, values.clone());
    }

    public static DefaultGenericVector fromList(DataType dataType, List<?> values) {
        return new DefaultGenericVector(dataType, values.toArray());
    }

    private final DataType dataType;
    private final Object[] values;

    private DefaultGenericVector(DataType dataType, Object[] values) {
        this.dataType = dataType;
        this.values = values;
    }

    @Override
    public DataType getDataType() {
        return dataType;
    }

    @Override
    public int getSize() {
        return values.length;
    }

    @Override
    public void close() {
        // values live on heap
    }

    @Override
    public boolean isNullAt(int rowId) {
        checkValidRowId(rowId);
        return values[rowId] == null;
    }

    @Override
    public boolean getBoolean(int rowId) {
        return (Boolean) valueAt(rowId, BooleanType.class, "boolean");
    }

    @Override
    public byte getByte(int rowId) {
        return (Byte) valueAt(rowId, ByteType.class, "byte");
    }

    @Override
    public short getShort(int rowId) {
        return (Short) valueAt(rowId, ShortType.class, "short");
    }

    @Override
    public int getInt(int rowId) {
        return (Integer) valueAt(rowId, IntegerType.class, "int");
    }

    @Override
    public long getLong(int rowId) {
        return (Long) valueAt(rowId, LongType.class, "long");
    }

    @Override
    public float getFloat(int rowId) {
        return (Float) valueAt(rowId, FloatType.class, "float");
    }

    @Override
    public double getDouble(int rowId) {
        return (Double) valueAt(rowId, DoubleType.class, "double");
    }

    @Override
    public String getString(int rowId) {
        return (String) valueAt(rowId, StringType.class, "string");
    }

    @Override
    public ArrayValue getArray(int rowId) {
        return (ArrayValue) valueAt(rowId, ArrayType.class, "array");
    }

    private Object valueAt(int rowId, Class<? extends DataType> expectedType, String accessType) {
        if (!expectedType.isInstance(dataType)) {
            throw new UnsupportedOperationException(String.format(
                "Trying to access a `%s` value from vector of type `%s`", accessType, dataType));
        }
        checkValidRowId(rowId);
        return values[rowId];
    }

    private void checkValidRowId(int rowId) {
        checkArgument(rowId >= 0 && rowId < values.length,
            "Invalid rowId=%s for size=%s", rowId, values.length);
    }
}
