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
package io.lambdakernel.types;

import io.lambdakernel.annotation.Evolving;
import java.util.Objects;

/**
 * Represent {@code array} data type
 *
 * @since 1.0.0
 */
@Evolving
public class ArrayType extends DataType {
  private final DataType elementType;
  private final boolean containsNull;

  /**
   * @param elementType type of the array elements
   * @param containsNull whether elements may be null; two array types differing only here are
   *     {@link #equivalent} but not equal
   */
  public ArrayType(DataType elementType, boolean containsNull) {
    this.elementType = elementType;
    this.containsNull = containsNull;
  }

  public DataType getElementType() {
    return elementType;
  }

  @Override
  public boolean equivalent(DataType dataType) {
    return dataType instanceof ArrayType
        && ((ArrayType) dataType).getElementType().equivalent(getElementType());
  }

  @Override
  public boolean isNested() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ArrayType arrayType = (ArrayType) o;
    return containsNull == arrayType.containsNull && elementType.equals(arrayType.elementType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, containsNull);
  }

  @Override
  public String toString() {
    return "array[" + getElementType() + "]";
  }
}
