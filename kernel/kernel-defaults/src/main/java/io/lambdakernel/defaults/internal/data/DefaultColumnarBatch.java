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
package io.lambdakernel.defaults.internal.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.ColumnarBatch;
import io.lambdakernel.types.StructType;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

public class DefaultColumnarBatch implements ColumnarBatch {
    private final int size;
    private final StructType schema;
    private final List<ColumnVector> columnVectors;

    public DefaultColumnarBatch(int size, StructType schema, ColumnVector[] columnVectors) {
        checkArgument(schema.length() == columnVectors.length,
            "schema has %s fields but %s vectors were given", schema.length(), columnVectors.length);
        for (ColumnVector vector : columnVectors) {
            checkArgument(vector.getSize() == size,
                "given vector size (%s) is not matching the batch size (%s)",
                vector.getSize(), size);
        }
        this.schema = schema;
        this.size = size;
        this.columnVectors = Collections.unmodifiableList(Arrays.asList(columnVectors));
    }

    @Override
    public StructType getSchema() {
        return schema;
    }

    @Override
    public ColumnVector getColumnVector(int ordinal) {
        checkColumnOrdinal(ordinal);
        return columnVectors.get(ordinal);
    }

    @Override
    public int getSize() {
        return size;
    }

    private void checkColumnOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= columnVectors.size()) {
            throw new IllegalArgumentException("invalid column ordinal: " + ordinal);
        }
    }
}
