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
package io.lambdakernel.metrics;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Defines the metadata and metrics for one evaluation of a higher-order array function. */
@JsonSerialize(as = TransformReport.class)
@JsonPropertyOrder({
  "operationType",
  "reportUUID",
  "functionName",
  "lambdaNames",
  "exception",
  "transformMetrics"
})
public interface TransformReport extends MetricsReport {

  /** @return a unique ID for this report */
  UUID getReportUUID();

  /** @return the name of the evaluated function, for example {@code TRANSFORM} */
  String getFunctionName();

  /** @return the names of the candidate lambdas, in selection order */
  List<String> getLambdaNames();

  /** @return the exception that aborted the evaluation, if any */
  Optional<Exception> getException();

  /** @return the metrics collected during the evaluation */
  TransformMetricsResult getTransformMetrics();

  default String getOperationType() {
    return "Transform";
  }
}
