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
import io.lambdakernel.expressions.Column;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Struct type which contains one or more columns. Used as the schema of a batch and as the
 * parameter signature of a lambda.
 *
 * @since 1.0.0
 */
@Evolving
public final class StructType extends DataType {

  private final Map<String, Integer> nameToOrdinal;
  private final List<StructField> fields;
  private final List<String> fieldNames;

  public StructType() {
    this(new ArrayList<>());
  }

  public StructType(List<StructField> fields) {
    this.fields = fields;
    this.fieldNames = fields.stream().map(StructField::getName).collect(Collectors.toList());

    this.nameToOrdinal = new HashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      nameToOrdinal.putIfAbsent(fields.get(i).getName(), i);
    }
  }

  public StructType add(StructField field) {
    final List<StructField> fieldsCopy = new ArrayList<>(fields);
    fieldsCopy.add(field);

    return new StructType(fieldsCopy);
  }

  public StructType add(String name, DataType dataType) {
    return add(new StructField(name, dataType, true /* nullable */));
  }

  public StructType add(String name, DataType dataType, boolean nullable) {
    return add(new StructField(name, dataType, nullable));
  }

  /** @return array of fields */
  public List<StructField> fields() {
    return Collections.unmodifiableList(fields);
  }

  /** @return array of field names */
  public List<String> fieldNames() {
    return fieldNames;
  }

  /** @return the number of fields */
  public int length() {
    return fields.size();
  }

  /** @return ordinal of the field with the given name, or -1 when there is no such field */
  public int indexOf(String fieldName) {
    Integer ordinal = nameToOrdinal.get(fieldName);
    return ordinal == null ? -1 : ordinal;
  }

  /** @return the field with the given name, or {@code null} when there is no such field */
  public StructField get(String fieldName) {
    int ordinal = indexOf(fieldName);
    return ordinal == -1 ? null : fields.get(ordinal);
  }

  public StructField at(int index) {
    return fields.get(index);
  }

  /**
   * Creates a {@link Column} expression for the field at the given {@code ordinal}
   *
   * @param ordinal the ordinal of the {@link StructField} to create a column for
   * @return a {@link Column} expression for the {@link StructField} with ordinal {@code ordinal}
   */
  public Column column(int ordinal) {
    final StructField field = at(ordinal);
    return new Column(field.getName());
  }

  @Override
  public boolean equivalent(DataType dataType) {
    if (!(dataType instanceof StructType)) {
      return false;
    }
    StructType otherType = ((StructType) dataType);
    if (otherType.length() != length()) {
      return false;
    }
    for (int i = 0; i < length(); i++) {
      if (!at(i).getDataType().equivalent(otherType.at(i).getDataType())) {
        return false;
      }
    }
    return true;
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
    StructType that = (StructType) o;
    return Objects.equals(fields, that.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fields);
  }

  @Override
  public String toString() {
    return String.format(
        "struct(%s)", fields.stream().map(StructField::toString).collect(Collectors.joining(", ")));
  }
}
