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

import static java.util.Objects.requireNonNull;

import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.types.ArrayType;
import io.lambdakernel.types.DataType;
import java.util.List;

/**
 * A {@link LambdaHandle} bound to a call site: the element type it is applied to and the static
 * type its body returns for that element type.
 */
public final class BoundLambda {
  private final LambdaHandle handle;
  private final DataType elementType;
  private final DataType returnType;

  BoundLambda(LambdaHandle handle, DataType elementType, DataType returnType) {
    this.handle = requireNonNull(handle, "handle is null");
    this.elementType = requireNonNull(elementType, "elementType is null");
    this.returnType = requireNonNull(returnType, "returnType is null");
  }

  public LambdaHandle getHandle() {
    return handle;
  }

  public String getName() {
    return handle.getName();
  }

  public DataType getElementType() {
    return elementType;
  }

  public DataType getReturnType() {
    return returnType;
  }

  /** Type of the array produced by applying this lambda to every element. */
  public ArrayType getResultType() {
    return new ArrayType(returnType, true);
  }

  /** Names of the outer columns this lambda captures, in capture order. */
  public List<String> getCaptureNames() {
    return handle.getCaptures().fieldNames();
  }

  @Override
  public String toString() {
    return String.format("%s: %s -> %s", handle.getName(), elementType, returnType);
  }
}
