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
package io.lambdakernel.defaults.internal.expressions;

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultBooleanVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultChunkedVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultDictionaryVector;
import io.lambdakernel.types.*;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;

/** Utility methods used by the default expression evaluator. */
class DefaultExpressionUtils {

  /** Orders strings by their UTF-8 bytes, compared as unsigned values. */
  static final Comparator<String> STRING_COMPARATOR =
      (leftOp, rightOp) -> {
        byte[] leftBytes = leftOp.getBytes(StandardCharsets.UTF_8);
        byte[] rightBytes = rightOp.getBytes(StandardCharsets.UTF_8);
        int common = Math.min(leftBytes.length, rightBytes.length);
        for (int i = 0; i < common; i++) {
          int diff = Byte.toUnsignedInt(leftBytes[i]) - Byte.toUnsignedInt(rightBytes[i]);
          if (diff != 0) {
            return diff;
          }
        }
        return Integer.compare(leftBytes.length, rightBytes.length);
      };

  private DefaultExpressionUtils() {}

  /** Rows where at least one of the two operands is null. */
  static boolean[] evalNullability(ColumnVector left, ColumnVector right) {
    int numRows = left.getSize();
    boolean[] nullability = new boolean[numRows];
    for (int rowId = 0; rowId < numRows; rowId++) {
      nullability[rowId] = left.isNullAt(rowId) || right.isNullAt(rowId);
    }
    return nullability;
  }

  /**
   * Materialize a boolean result of {@code numRows} rows. {@code value} is only consulted for rows
   * that {@code isNull} rejects.
   */
  static ColumnVector booleanVector(int numRows, IntPredicate isNull, IntPredicate value) {
    boolean[] nulls = new boolean[numRows];
    boolean[] values = new boolean[numRows];
    boolean hasNulls = false;
    for (int rowId = 0; rowId < numRows; rowId++) {
      if (isNull.test(rowId)) {
        nulls[rowId] = true;
        hasNulls = true;
      } else {
        values[rowId] = value.test(rowId);
      }
    }
    return new DefaultBooleanVector(
        numRows, hasNulls ? Optional.of(nulls) : Optional.empty(), values);
  }

  /**
   * Evaluate a comparison between two vectors of the same primitive type. A row is null when
   * either operand is null.
   *
   * @param comparator one of {@code =}, {@code <}, {@code <=}, {@code >}, {@code >=}
   */
  static ColumnVector compare(String comparator, ColumnVector left, ColumnVector right) {
    checkArgument(
        left.getSize() == right.getSize(),
        "Left and right operand have different vector sizes: %s and %s",
        left.getSize(),
        right.getSize());
    IntPredicate accept = acceptedOrdering(comparator);
    IntUnaryOperator ordering = rowOrdering(left, right);
    return booleanVector(
        left.getSize(),
        rowId -> left.isNullAt(rowId) || right.isNullAt(rowId),
        rowId -> accept.test(ordering.applyAsInt(rowId)));
  }

  /**
   * First non-null value of each row among {@code children}, or null when all are null. The
   * result is a dictionary over the concatenation of the children, so no value is copied.
   */
  static ColumnVector coalesce(DataType dataType, List<ColumnVector> children) {
    int numRows = children.get(0).getSize();
    int[] indices = new int[numRows];
    for (int rowId = 0; rowId < numRows; rowId++) {
      int source = 0;
      while (source < children.size() - 1 && children.get(source).isNullAt(rowId)) {
        source++;
      }
      indices[rowId] = source * numRows + rowId;
    }
    return new DefaultDictionaryVector(new DefaultChunkedVector(dataType, children), indices);
  }

  private static IntPredicate acceptedOrdering(String comparator) {
    switch (comparator) {
      case "=":
        return ordering -> ordering == 0;
      case "<":
        return ordering -> ordering < 0;
      case "<=":
        return ordering -> ordering <= 0;
      case ">":
        return ordering -> ordering > 0;
      case ">=":
        return ordering -> ordering >= 0;
      default:
        throw new IllegalArgumentException(
            String.format("%s is not a recognized comparator", comparator));
    }
  }

  private static IntUnaryOperator rowOrdering(ColumnVector left, ColumnVector right) {
    DataType dataType = left.getDataType();
    if (dataType instanceof BooleanType) {
      return rowId -> Boolean.compare(left.getBoolean(rowId), right.getBoolean(rowId));
    } else if (dataType instanceof ByteType) {
      return rowId -> Byte.compare(left.getByte(rowId), right.getByte(rowId));
    } else if (dataType instanceof ShortType) {
      return rowId -> Short.compare(left.getShort(rowId), right.getShort(rowId));
    } else if (dataType instanceof IntegerType) {
      return rowId -> Integer.compare(left.getInt(rowId), right.getInt(rowId));
    } else if (dataType instanceof LongType) {
      return rowId -> Long.compare(left.getLong(rowId), right.getLong(rowId));
    } else if (dataType instanceof FloatType) {
      return rowId -> Float.compare(left.getFloat(rowId), right.getFloat(rowId));
    } else if (dataType instanceof DoubleType) {
      return rowId -> Double.compare(left.getDouble(rowId), right.getDouble(rowId));
    } else if (dataType instanceof StringType) {
      return rowId -> STRING_COMPARATOR.compare(left.getString(rowId), right.getString(rowId));
    }
    throw new UnsupportedOperationException(dataType + " can not be compared.");
  }
}
