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
package io.lambdakernel.expressions;

import io.lambdakernel.annotation.Evolving;
import io.lambdakernel.types.*;
import java.util.Collections;
import java.util.List;

/**
 * A literal value.
 *
 * <p>Definition:
 *
 * <ul>
 *   <li>Represents literal of primitive types as defined in the protocol.
 *   <li>Use {@link #getValue()} to fetch the literal value. Returned value type depends on the type
 *       of the literal data type. See the {@link #getValue()} for further details.
 * </ul>
 *
 * @since 1.0.0
 */
@Evolving
public final class Literal implements Expression {
  public static Literal ofBoolean(boolean value) {
    return new Literal(value, BooleanType.BOOLEAN);
  }

  public static Literal ofByte(byte value) {
    return new Literal(value, ByteType.BYTE);
  }

  public static Literal ofShort(short value) {
    return new Literal(value, ShortType.SHORT);
  }

  public static Literal ofInt(int value) {
    return new Literal(value, IntegerType.INTEGER);
  }

  public static Literal ofLong(long value) {
    return new Literal(value, LongType.LONG);
  }

  public static Literal ofFloat(float value) {
    return new Literal(value, FloatType.FLOAT);
  }

  public static Literal ofDouble(double value) {
    return new Literal(value, DoubleType.DOUBLE);
  }

  public static Literal ofString(String value) {
    return new Literal(value, StringType.STRING);
  }

  /**
   * Create {@code null} value literal.
   *
   * @param dataType {@link DataType} of the null literal.
   * @return a null {@link Literal} with the given data type
   */
  public static Literal ofNull(DataType dataType) {
    return new Literal(null, dataType);
  }

  private final Object value;
  private final DataType dataType;

  private Literal(Object value, DataType dataType) {
    if (dataType.isNested()) {
      throw new IllegalArgumentException(dataType + " is an invalid data type for Literal.");
    }
    this.value = value;
    this.dataType = dataType;
  }

  /**
   * Get the literal value. If the value is null a {@code null} is returned. For non-null literal
   * the returned value is one of {@code Boolean}, {@code Byte}, {@code Short}, {@code Integer},
   * {@code Long}, {@code Float}, {@code Double} or {@code String} matching {@link #getDataType()}.
   *
   * @return Literal value.
   */
  public Object getValue() {
    return value;
  }

  /**
   * Get the datatype of the literal object. Datatype lets the caller interpret the value type
   * returned by {@link #getValue()}
   *
   * @return Datatype of the literal object.
   */
  public DataType getDataType() {
    return dataType;
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }

  @Override
  public List<Expression> getChildren() {
    return Collections.emptyList();
  }
}
