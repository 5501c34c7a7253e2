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
package io.lambdakernel.internal.metrics;

import static java.util.Objects.requireNonNull;

import io.lambdakernel.metrics.TransformMetricsResult;
import io.lambdakernel.metrics.TransformReport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** A basic POJO implementation of {@link TransformReport} for creating them */
public class TransformReportImpl implements TransformReport {

  private final UUID reportUUID;
  private final String functionName;
  private final List<String> lambdaNames;
  private final Optional<Exception> exception;
  private final TransformMetricsResult transformMetrics;

  public TransformReportImpl(
      String functionName,
      List<String> lambdaNames,
      TransformMetrics transformMetrics,
      Optional<Exception> exception) {
    this.reportUUID = UUID.randomUUID();
    this.functionName = requireNonNull(functionName);
    this.lambdaNames = Collections.unmodifiableList(new ArrayList<>(requireNonNull(lambdaNames)));
    this.transformMetrics =
        requireNonNull(transformMetrics).captureTransformMetricsResult();
    this.exception = requireNonNull(exception);
  }

  @Override
  public UUID getReportUUID() {
    return reportUUID;
  }

  @Override
  public String getFunctionName() {
    return functionName;
  }

  @Override
  public List<String> getLambdaNames() {
    return lambdaNames;
  }

  @Override
  public Optional<Exception> getException() {
    return exception;
  }

  @Override
  public TransformMetricsResult getTransformMetrics() {
    return transformMetrics;
  }
}
