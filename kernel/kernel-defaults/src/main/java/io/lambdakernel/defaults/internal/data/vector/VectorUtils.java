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
import java.util.List;

import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.types.*;

/**
 * Utility methods for {@link io.lambdakernel.data.ColumnVector} implementations.
 */
public class VectorUtils {
    private VectorUtils() {}

    /**
     * Get the value at given {@code rowId} from the column vector. The type of the value object
     * depends on the data type of the {@code vector}; array values are returned as
     * {@link ArrayValue}.
     */
    public static Object getValueAsObject(ColumnVector vector, int rowId) {
        final DataType dataType = vector.getDataType();

        if (vector.isNullAt(rowId)) {
            return null;
        }

        if (dataType instanceof BooleanType) {
            return vector.getBoolean(rowId);
        } else if (dataType instanceof ByteType) {
            return vector.getByte(rowId);
        } else if (dataType instanceof ShortType) {
            return vector.getShort(rowId);
        } else if (dataType instanceof IntegerType) {
            return vector.getInt(rowId);
        } else if (dataType instanceof LongType) {
            return vector.getLong(rowId);
        } else if (dataType instanceof FloatType) {
            return vector.getFloat(rowId);
        } else if (dataType instanceof DoubleType) {
            return vector.getDouble(rowId);
        } else if (dataType instanceof StringType) {
            return vector.getString(rowId);
        } else if (dataType instanceof ArrayType) {
            return vector.getArray(rowId);
        }

        throw new UnsupportedOperationException(dataType + " is not supported yet");
    }

    /**
     * Converts the vector into a list of Java objects. Array values become (nested) lists and
     * null rows become {@code null} entries.
     */
    public static List<Object> toJavaList(ColumnVector vector) {
        List<Object> result = new ArrayList<>(vector.getSize());
        for (int rowId = 0; rowId < vector.getSize(); rowId++) {
            result.add(toJavaValue(vector, rowId));
        }
        return result;
    }

    private static Object toJavaValue(ColumnVector vector, int rowId) {
        Object value = getValueAsObject(vector, rowId);
        if (value instanceof ArrayValue) {
            return toJavaList(((ArrayValue) value).getElements());
        }
        return value;
    }
}
