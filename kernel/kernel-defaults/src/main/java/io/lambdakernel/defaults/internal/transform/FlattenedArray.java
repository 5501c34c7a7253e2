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

import io.lambdakernel.data.ColumnVector;
import java.util.Optional;

/**
 * The elements of a set of array rows laid out as one vector, ready for a single lambda
 * evaluation.
 *
 * <p>Rows are addressed by their position in the flattened selection. Row {@code p} owns the
 * elements {@code [getOffset(p), getOffset(p) + getLength(p))} and {@code
 * getElementToRowMap()[e]} is the row owning element {@code e}. Null rows own no elements.
 */
public final class FlattenedArray {
  private final ColumnVector elements;
  private final int[] elementToRowMap;
  private final int[] offsets;
  private final int[] lengths;
  private final boolean[] rowNulls;
  private final boolean hasNullRows;

  FlattenedArray(
      ColumnVector elements,
      int[] elementToRowMap,
      int[] offsets,
      int[] lengths,
      boolean[] rowNulls,
      boolean hasNullRows) {
    this.elements = elements;
    this.elementToRowMap = elementToRowMap;
    this.offsets = offsets;
    this.lengths = lengths;
    this.rowNulls = rowNulls;
    this.hasNullRows = hasNullRows;
  }

  public ColumnVector getElements() {
    return elements;
  }

  public int[] getElementToRowMap() {
    return elementToRowMap;
  }

  public int getNumRows() {
    return offsets.length;
  }

  public int getNumElements() {
    return elementToRowMap.length;
  }

  public int getOffset(int row) {
    return offsets[row];
  }

  public int getLength(int row) {
    return lengths[row];
  }

  public boolean isNullAt(int row) {
    return rowNulls[row];
  }

  int[] getOffsets() {
    return offsets;
  }

  int[] getLengths() {
    return lengths;
  }

  /** Row nulls, or empty when no row is null. */
  Optional<boolean[]> getRowNulls() {
    return hasNullRows ? Optional.of(rowNulls) : Optional.empty();
  }
}
