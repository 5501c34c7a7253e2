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
import java.util.Collections;
import java.util.List;

import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.types.DataType;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

/**
 * Concatenation of several vectors of the same type, without copying their values.
 */
public class DefaultChunkedVector implements ColumnVector {
    private final DataType dataType;
    private final List<ColumnVector> chunks;
    // chunkStarts[i] is the first row of chunk i; the last entry is the total size
    private final int[] chunkStarts;

    public DefaultChunkedVector(DataType dataType, List<ColumnVector> chunks) {
        this.dataType = dataType;
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
        this.chunkStarts = new int[chunks.size() + 1];
        for (int i = 0; i < chunks.size(); i++) {
            ColumnVector chunk = chunks.get(i);
            checkArgument(chunk.getDataType().equivalent(dataType),
                "chunk %s has type %s, expected %s", i, chunk.getDataType(), dataType);
            chunkStarts[i + 1] = chunkStarts[i] + chunk.getSize();
        }
    }

    @Override
    public DataType getDataType() {
        return dataType;
    }

    @Override
    public int getSize() {
        return chunkStarts[chunks.size()];
    }

    @Override
    public void close() {
        // chunks are owned by whoever created them
    }

    @Override
    public boolean isNullAt(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).isNullAt(rowId - chunkStarts[chunk]);
    }

    @Override
    public boolean getBoolean(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getBoolean(rowId - chunkStarts[chunk]);
    }

    @Override
    public byte getByte(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getByte(rowId - chunkStarts[chunk]);
    }

    @Override
    public short getShort(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getShort(rowId - chunkStarts[chunk]);
    }

    @Override
    public int getInt(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getInt(rowId - chunkStarts[chunk]);
    }

    @Override
    public long getLong(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getLong(rowId - chunkStarts[chunk]);
    }

    @Override
    public float getFloat(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getFloat(rowId - chunkStarts[chunk]);
    }

    @Override
    public double getDouble(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getDouble(rowId - chunkStarts[chunk]);
    }

    @Override
    public String getString(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getString(rowId - chunkStarts[chunk]);
    }

    @Override
    public ArrayValue getArray(int rowId) {
        int chunk = chunkOf(rowId);
        return chunks.get(chunk).getArray(rowId - chunkStarts[chunk]);
    }

    private int chunkOf(int rowId) {
        checkArgument(rowId >= 0 && rowId < getSize(),
            "Invalid rowId=%s for size=%s", rowId, getSize());
        int pos = Arrays.binarySearch(chunkStarts, 0, chunks.size(), rowId);
        if (pos >= 0) {
            // skip empty chunks starting at the same row
            while (pos + 1 < chunks.size() && chunkStarts[pos + 1] == rowId) {
                pos++;
            }
            return pos;
        }
        return -pos - 2;
    }
}
