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

import static java.util.Objects.requireNonNull;

import io.lambdakernel.annotation.Evolving;
import java.util.Objects;

/**
 * Represents a subfield of {@link StructType} with additional properties and metadata.
 *
 * @since 1.0.0
 */
@Evolving
public class StructField {
  private final String name;
  private final DataType dataType;
  private final boolean nullable;

  public StructField(String name, DataType dataType, boolean nullable) {
    this.name = requireNonNull(name, "name is null");
    this.dataType = requireNonNull(dataType, "dataType is null");
    this.nullable = nullable;
  }

  /** @return the name of this field */
  public String getName() {
    return name;
  }

  /** @return the data type of this field */
  public DataType getDataType() {
    return dataType;
  }

  /** @return whether this field allows to have a {@code null} value. */
  public boolean isNullable() {
    return nullable;
  }

  @Override
  public String toString() {
    return String.format("StructField(name=%s,type=%s,nullable=%s)", name, dataType, nullable);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    StructField that = (StructField) o;
    return nullable == that.nullable && name.equals(that.name) && dataType.equals(that.dataType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, dataType, nullable);
  }
}
