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
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.internal.util.ExpressionUtils;
import io.lambdakernel.types.StructField;
import io.lambdakernel.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named lambdas usable as the function argument of {@code TRANSFORM}.
 *
 * <p>Registration validates the signature: a transform lambda takes exactly one formal parameter
 * (the array element) and every other column its body references must be a field of the capture
 * row type. Violations fail with {@link io.lambdakernel.exceptions.SignatureMismatchException}
 * at registration time. Registering a name again replaces the binding for later lookups.
 *
 * @since 1.0.0
 */
@Evolving
public class LambdaRegistry {
  private static final Logger logger = LoggerFactory.getLogger(LambdaRegistry.class);

  private final Map<String, LambdaHandle> lambdas = new ConcurrentHashMap<>();

  /**
   * Register a lambda.
   *
   * @param name name used to look the lambda up
   * @param signature the formal parameters. Must contain exactly one field.
   * @param captureRowType the outer row type captured columns are resolved against
   * @param body the lambda body, referencing the parameter and captured columns by name
   * @return the immutable handle of the registered lambda
   */
  public LambdaHandle registerLambda(
      String name, StructType signature, StructType captureRowType, Expression body) {
    requireNonNull(name, "name is null");
    requireNonNull(signature, "signature is null");
    requireNonNull(captureRowType, "captureRowType is null");
    requireNonNull(body, "body is null");

    if (signature.length() != 1) {
      throw LambdaErrors.wrongParameterCount(name, signature.length());
    }
    String parameterName = signature.at(0).getName();

    List<StructField> captured = new ArrayList<>();
    for (String column : ExpressionUtils.referencedColumns(body)) {
      if (column.equals(parameterName)) {
        continue;
      }
      StructField field = captureRowType.get(column);
      if (field == null) {
        throw LambdaErrors.unknownCaptureColumn(name, column, captureRowType);
      }
      captured.add(field);
    }

    LambdaHandle handle =
        new LambdaHandle(name, signature, captureRowType, body, new StructType(captured));
    LambdaHandle previous = lambdas.put(name, handle);
    logger.info(
        "{} lambda `{}` with parameter `{}` and {} captured column(s)",
        previous == null ? "Registered" : "Replaced",
        name,
        parameterName,
        captured.size());
    return handle;
  }

  /** @return the handle registered under {@code name}, if any */
  public Optional<LambdaHandle> get(String name) {
    return Optional.ofNullable(lambdas.get(name));
  }

  /**
   * Returns an expression referring to the lambda registered under {@code name}.
   *
   * @throws io.lambdakernel.exceptions.KernelException if no lambda has that name
   */
  public LambdaExpression function(String name) {
    return get(name)
        .map(LambdaExpression::new)
        .orElseThrow(() -> LambdaErrors.unknownLambda(name));
  }
}
