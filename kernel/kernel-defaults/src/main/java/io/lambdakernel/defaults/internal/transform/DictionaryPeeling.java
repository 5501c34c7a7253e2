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
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.defaults.internal.data.vector.DefaultDictionaryVector;
import io.lambdakernel.defaults.internal.data.vector.VectorEncodings;
import io.lambdakernel.defaults.internal.data.vector.VectorEncodings.PeeledDictionary;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a transform over a dictionary encoded array vector can be evaluated over the
 * dictionary base instead, and if so which base rows to evaluate and what their captures are.
 *
 * <p>Peeling is only planned when it cannot change the result. Each referenced base row is
 * evaluated once, so every outer row mapping to that base row must see the same capture values.
 * That holds when
 *
 * <ul>
 *   <li>the lambda captures nothing, or every capture is constant,
 *   <li>a capture is dictionary encoded with the same composed indices as the array, in which
 *       case its own base is read at the same base rows, or
 *   <li>no two selected rows share a base row, in which case each base row takes the captures of
 *       the one outer row referencing it.
 * </ul>
 */
final class DictionaryPeeling {

  /** Result of a successful plan. */
  static final class Plan {
    private final PeeledDictionary dictionary;
    private final int[] baseRows;
    private final int[] localIndices;
    private final Optional<boolean[]> rowNulls;
    private final List<ColumnVector> baseCaptures;

    private Plan(
        PeeledDictionary dictionary,
        int[] baseRows,
        int[] localIndices,
        Optional<boolean[]> rowNulls,
        List<ColumnVector> baseCaptures) {
      this.dictionary = dictionary;
      this.baseRows = baseRows;
      this.localIndices = localIndices;
      this.rowNulls = rowNulls;
      this.baseCaptures = baseCaptures;
    }

    /** The array vector under every dictionary layer. */
    ColumnVector getBase() {
      return dictionary.getBase();
    }

    /** Distinct base rows referenced by the selected non-null rows, ascending. */
    int[] getBaseRows() {
      return baseRows;
    }

    /** Captures with one value per entry of {@link #getBaseRows()}. */
    List<ColumnVector> getBaseCaptures() {
      return baseCaptures;
    }

    /**
     * Wrap the result computed over {@link #getBaseRows()} back into one row per selected row.
     */
    ColumnVector rewrap(ColumnVector baseResult) {
      return new DefaultDictionaryVector(
          baseResult, localIndices, localIndices.length, rowNulls);
    }
  }

  private DictionaryPeeling() {}

  /**
   * @param arrays a dictionary encoded array vector
   * @param rows selected rows of {@code arrays}
   * @param captures capture vectors, value {@code p} belonging to row {@code rows[p]}
   * @return the plan, or empty if peeling could change the result
   */
  static Optional<Plan> plan(ColumnVector arrays, int[] rows, List<ColumnVector> captures) {
    PeeledDictionary peeled =
        VectorEncodings.peelDictionary(arrays)
            .orElseThrow(() -> new IllegalArgumentException("not a dictionary: " + arrays));

    int numRows = rows.length;
    int[] baseToLocal = new int[peeled.getBase().getSize()];
    boolean[] referenced = new boolean[baseToLocal.length];
    boolean[] rowNulls = new boolean[numRows];
    boolean hasNullRows = false;
    for (int pos = 0; pos < numRows; pos++) {
      if (peeled.isNullAt(rows[pos])) {
        rowNulls[pos] = true;
        hasNullRows = true;
      } else {
        referenced[peeled.getIndex(rows[pos])] = true;
      }
    }

    int numBaseRows = 0;
    for (boolean isReferenced : referenced) {
      if (isReferenced) {
        numBaseRows++;
      }
    }
    int[] baseRows = new int[numBaseRows];
    int next = 0;
    for (int baseRow = 0; baseRow < referenced.length; baseRow++) {
      if (referenced[baseRow]) {
        baseToLocal[baseRow] = next;
        baseRows[next++] = baseRow;
      }
    }

    int[] localIndices = new int[numRows];
    for (int pos = 0; pos < numRows; pos++) {
      if (!rowNulls[pos]) {
        localIndices[pos] = baseToLocal[peeled.getIndex(rows[pos])];
      }
    }

    List<ColumnVector> baseCaptures = new ArrayList<>(captures.size());
    int[] inverse = null;
    for (ColumnVector capture : captures) {
      if (capture.getEncoding() == VectorEncoding.CONSTANT) {
        baseCaptures.add(CaptureBroadcaster.resize(capture, numBaseRows));
        continue;
      }
      Optional<ColumnVector> alignedBase = alignedBase(peeled, rows, rowNulls, capture);
      if (alignedBase.isPresent()) {
        baseCaptures.add(new DefaultDictionaryVector(alignedBase.get(), baseRows));
        continue;
      }
      if (inverse == null) {
        if (!VectorEncodings.isInjective(peeled, rows)) {
          return Optional.empty();
        }
        inverse = new int[numBaseRows];
        for (int pos = 0; pos < numRows; pos++) {
          if (!rowNulls[pos]) {
            inverse[localIndices[pos]] = pos;
          }
        }
      }
      baseCaptures.add(new DefaultDictionaryVector(capture, inverse));
    }

    return Optional.of(
        new Plan(
            peeled,
            baseRows,
            localIndices,
            hasNullRows ? Optional.of(rowNulls) : Optional.empty(),
            baseCaptures));
  }

  /**
   * The base of {@code capture} if, for every selected non-null row, the capture is non-null and
   * reads the same base row as the array does.
   */
  private static Optional<ColumnVector> alignedBase(
      PeeledDictionary arrays, int[] rows, boolean[] rowNulls, ColumnVector capture) {
    Optional<PeeledDictionary> peeledCapture = VectorEncodings.peelDictionary(capture);
    if (!peeledCapture.isPresent()) {
      return Optional.empty();
    }
    PeeledDictionary captureDictionary = peeledCapture.get();
    if (captureDictionary.getBase().getSize() != arrays.getBase().getSize()) {
      return Optional.empty();
    }
    for (int pos = 0; pos < rows.length; pos++) {
      if (rowNulls[pos]) {
        continue;
      }
      if (captureDictionary.isNullAt(pos)
          || captureDictionary.getIndex(pos) != arrays.getIndex(rows[pos])) {
        return Optional.empty();
      }
    }
    return Optional.of(captureDictionary.getBase());
  }
}
