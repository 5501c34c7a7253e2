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

import java.util.Objects;

/**
 * Base class for the primitive element types a lambda can take or return. Two primitive types
 * are equal when their names are equal.
 */
public abstract class BasePrimitiveType extends DataType {
  private final String primitiveTypeName;

  protected BasePrimitiveType(String primitiveTypeName) {
    this.primitiveTypeName = primitiveTypeName;
  }

  @Override
  public boolean isNested() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BasePrimitiveType that = (BasePrimitiveType) o;
    return primitiveTypeName.equals(that.primitiveTypeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(primitiveTypeName);
  }

  @Override
  public String toString() {
    return primitiveTypeName;
  }
}
