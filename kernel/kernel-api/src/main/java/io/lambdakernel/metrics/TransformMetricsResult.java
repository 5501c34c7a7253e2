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

/** Stores the metrics results for a {@link TransformReport} */
@JsonPropertyOrder({
  "totalDurationNs",
  "numInputRows",
  "numLambdaInvocations",
  "numElementsEvaluated",
  "numDictionaryPeels",
  "numPeelingFallbacks",
  "numConstantPeels",
  "numDispatchGroups"
})
public interface TransformMetricsResult {

  /** @return the total time spent evaluating, in nanoseconds */
  long getTotalDurationNs();

  /** @return the number of rows of the array input */
  long getNumInputRows();

  /** @return how many times a lambda body was evaluated */
  long getNumLambdaInvocations();

  /** @return the total number of array elements passed to lambda bodies */
  long getNumElementsEvaluated();

  /** @return how many dictionary layers were peeled instead of being expanded */
  long getNumDictionaryPeels();

  /** @return how many dictionary encoded inputs fell back to the flat path */
  long getNumPeelingFallbacks();

  /** @return how many constant inputs were evaluated over a single row */
  long getNumConstantPeels();

  /** @return the number of lambda groups the rows were partitioned into */
  long getNumDispatchGroups();
}
