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
import io.lambdakernel.defaults.internal.data.vector.DefaultConstantVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultDictionaryVector;
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.lambda.LambdaHandle;
import java.util.ArrayList;
import java.util.List;

/**
 * Repeats captured outer row values once per array element, so that element {@code e} sees the
 * capture values of the row owning it. Constant captures stay constant; other captures become a
 * dictionary over the capture vector indexed by the element to row map.
 */
public final class CaptureBroadcaster {
  private CaptureBroadcaster() {}

  /**
   * @param lambda the lambda whose captures are broadcast
   * @param captures one vector per captured column, each with one value per flattened row
   * @param flattened the flattened rows
   * @return one vector per captured column, each with one value per flattened element
   * @throws io.lambdakernel.exceptions.ShapeMismatchException if a capture does not have one
   *     value per flattened row
   */
  public static List<ColumnVector> broadcast(
      LambdaHandle lambda, List<ColumnVector> captures, FlattenedArray flattened) {
    checkShapes(lambda, captures, flattened.getNumRows());
    int numElements = flattened.getNumElements();
    List<ColumnVector> broadcast = new ArrayList<>(captures.size());
    for (ColumnVector capture : captures) {
      if (capture.getEncoding() == VectorEncoding.CONSTANT) {
        broadcast.add(resize(capture, numElements));
      } else {
        broadcast.add(new DefaultDictionaryVector(capture, flattened.getElementToRowMap()));
      }
    }
    return broadcast;
  }

  /**
   * Check that the lambda gets one vector per captured column and that each has {@code numRows}
   * values.
   */
  public static void checkShapes(LambdaHandle lambda, List<ColumnVector> captures, int numRows) {
    List<String> names = lambda.getCaptures().fieldNames();
    if (captures.size() != names.size()) {
      throw new IllegalArgumentException(
          String.format(
              "lambda `%s` captures %s but %s capture vectors were given",
              lambda.getName(), names, captures.size()));
    }
    for (int i = 0; i < captures.size(); i++) {
      if (captures.get(i).getSize() != numRows) {
        throw LambdaErrors.captureSizeMismatch(names.get(i), numRows, captures.get(i).getSize());
      }
    }
  }

  /** A constant vector of {@code size} rows holding the value of a constant encoded vector. */
  static ColumnVector resize(ColumnVector constant, int size) {
    if (constant.getSize() == 0) {
      return new DefaultConstantVector(constant.getDataType(), size, null);
    }
    return DefaultConstantVector.fromRow(constant, 0, size);
  }
}
