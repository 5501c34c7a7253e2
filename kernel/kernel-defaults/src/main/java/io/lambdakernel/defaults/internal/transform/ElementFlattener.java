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
package io.lambdakernel.defaults.internal.transform;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.defaults.internal.data.vector.ArrayLayout;
import io.lambdakernel.defaults.internal.data.vector.DefaultDictionaryVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultViewVector;
import io.lambdakernel.internal.util.Utils;

/**
 * Turns array rows into a {@link FlattenedArray}.
 *
 * <p>When the selected rows read consecutive ranges of the element vector, in row order, the
 * flattened elements are a view over the element vector. Otherwise they are a dictionary over it
 * listing the referenced positions in row order. Element values are never copied, and elements
 * no selected row references are left out.
 */
public final class ElementFlattener {
  private ElementFlattener() {}

  /** Flatten every row of {@code arrays}. */
  public static FlattenedArray flatten(ColumnVector arrays) {
    return flatten(arrays, Utils.identityRows(arrays.getSize()));
  }

  /**
   * Flatten the given rows of {@code arrays}, in the given order.
   *
   * @throws io.lambdakernel.exceptions.CorruptVectorException if a selected non-null row reads
   *     outside of the element vector
   */
  public static FlattenedArray flatten(ColumnVector arrays, int[] rows) {
    ArrayLayout layout = ArrayLayout.of(arrays);
    int numRows = rows.length;
    int[] offsets = new int[numRows];
    int[] lengths = new int[numRows];
    boolean[] rowNulls = new boolean[numRows];
    boolean hasNullRows = false;

    long numElements = 0;
    boolean contiguous = true;
    int start = -1;
    int nextOffset = -1;
    for (int pos = 0; pos < numRows; pos++) {
      int rowId = rows[pos];
      checkArgument(
          rowId >= 0 && rowId < layout.getSize(),
          "row %s is outside of an array vector of size %s",
          rowId,
          layout.getSize());
      offsets[pos] = (int) numElements;
      if (layout.isNullAt(rowId)) {
        rowNulls[pos] = true;
        hasNullRows = true;
        continue;
      }
      layout.checkRange(rowId);
      int length = layout.getLength(rowId);
      lengths[pos] = length;
      numElements += length;
      if (length > 0) {
        int offset = layout.getOffset(rowId);
        if (start < 0) {
          start = offset;
        } else if (offset != nextOffset) {
          contiguous = false;
        }
        nextOffset = offset + length;
      }
    }
    checkArgument(
        numElements <= Integer.MAX_VALUE, "too many elements to flatten: %s", numElements);

    int[] elementToRowMap = new int[(int) numElements];
    for (int pos = 0; pos < numRows; pos++) {
      int from = offsets[pos];
      for (int i = 0; i < lengths[pos]; i++) {
        elementToRowMap[from + i] = pos;
      }
    }

    ColumnVector source = layout.getElements();
    ColumnVector elements;
    if (numElements == 0) {
      elements = new DefaultViewVector(source, 0, 0);
    } else if (contiguous) {
      elements =
          start == 0 && numElements == source.getSize()
              ? source
              : new DefaultViewVector(source, start, start + (int) numElements);
    } else {
      int[] positions = new int[(int) numElements];
      for (int pos = 0; pos < numRows; pos++) {
        if (rowNulls[pos]) {
          continue;
        }
        int sourceOffset = layout.getOffset(rows[pos]);
        for (int i = 0; i < lengths[pos]; i++) {
          positions[offsets[pos] + i] = sourceOffset + i;
        }
      }
      elements = new DefaultDictionaryVector(source, positions);
    }
    return new FlattenedArray(elements, elementToRowMap, offsets, lengths, rowNulls, hasNullRows);
  }
}
