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
package io.lambdakernel.lambda;

import static java.util.Objects.requireNonNull;

import io.lambdakernel.annotation.Evolving;
import io.lambdakernel.expressions.Expression;
import io.lambdakernel.types.DataType;
import io.lambdakernel.types.StructField;
import io.lambdakernel.types.StructType;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered lambda: a name, a one parameter signature, the outer row type captures are drawn
 * from, the body expression, and the captured columns the body references.
 *
 * <p>Handles are immutable and compare by identity. They are created by {@link LambdaRegistry}
 * and can be evaluated any number of times, concurrently, over different batches or row subsets.
 *
 * @since 1.0.0
 */
@Evolving
public final class LambdaHandle {
  private final String name;
  private final StructType signature;
  private final StructType captureRowType;
  private final Expression body;
  private final StructType captures;

  LambdaHandle(
      String name,
      StructType signature,
      StructType captureRowType,
      Expression body,
      StructType captures) {
    this.name = requireNonNull(name, "name is null");
    this.signature = requireNonNull(signature, "signature is null");
    this.captureRowType = requireNonNull(captureRowType, "captureRowType is null");
    this.body = requireNonNull(body, "body is null");
    this.captures = requireNonNull(captures, "captures is null");
  }

  /** @return the name the lambda was registered under */
  public String getName() {
    return name;
  }

  /** @return the formal parameters of the lambda. Transform lambdas have exactly one. */
  public StructType getSignature() {
    return signature;
  }

  /** @return the formal element parameter */
  public StructField getParameter() {
    return signature.at(0);
  }

  /** @return the declared type of the element parameter */
  public DataType getParameterType() {
    return getParameter().getDataType();
  }

  /** @return the outer row type the captured columns are resolved against */
  public StructType getCaptureRowType() {
    return captureRowType;
  }

  public Expression getBody() {
    return body;
  }

  /**
   * Outer columns referenced by the body that are not the element parameter, in order of first
   * reference. An empty struct when the lambda captures nothing.
   */
  public StructType getCaptures() {
    return captures;
  }

  public boolean hasCaptures() {
    return captures.length() > 0;
  }

  /**
   * The schema of the batch the body is evaluated on: the element parameter followed by the
   * captured columns.
   */
  public StructType getBodyInputSchema() {
    List<StructField> fields = new ArrayList<>();
    fields.add(getParameter());
    fields.addAll(captures.fields());
    return new StructType(fields);
  }

  @Override
  public String toString() {
    return String.format(
        "lambda(%s: %s -> %s)",
        name, String.join(", ", signature.fieldNames()), body);
  }
}
