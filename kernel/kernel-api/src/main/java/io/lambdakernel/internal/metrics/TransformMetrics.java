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

import io.lambdakernel.metrics.TransformMetricsResult;

/**
 * Stores the metrics for an ongoing transform evaluation. The counters are updated throughout the
 * evaluation; nested and per-group evaluations share the instance of the outermost call.
 *
 * <p>At report time an immutable {@link TransformMetricsResult} is captured from the counters.
 */
public class TransformMetrics {

  public final Timer totalTimer = new Timer();

  public final Counter inputRowsCounter = new Counter();

  public final Counter lambdaInvocationsCounter = new Counter();

  public final Counter elementsEvaluatedCounter = new Counter();

  public final Counter dictionaryPeelsCounter = new Counter();

  public final Counter peelingFallbacksCounter = new Counter();

  public final Counter constantPeelsCounter = new Counter();

  public final Counter dispatchGroupsCounter = new Counter();

  public TransformMetricsResult captureTransformMetricsResult() {
    return new TransformMetricsResult() {

      final long totalDurationNs = totalTimer.totalDurationNs();
      final long numInputRows = inputRowsCounter.value();
      final long numLambdaInvocations = lambdaInvocationsCounter.value();
      final long numElementsEvaluated = elementsEvaluatedCounter.value();
      final long numDictionaryPeels = dictionaryPeelsCounter.value();
      final long numPeelingFallbacks = peelingFallbacksCounter.value();
      final long numConstantPeels = constantPeelsCounter.value();
      final long numDispatchGroups = dispatchGroupsCounter.value();

      @Override
      public long getTotalDurationNs() {
        return totalDurationNs;
      }

      @Override
      public long getNumInputRows() {
        return numInputRows;
      }

      @Override
      public long getNumLambdaInvocations() {
        return numLambdaInvocations;
      }

      @Override
      public long getNumElementsEvaluated() {
        return numElementsEvaluated;
      }

      @Override
      public long getNumDictionaryPeels() {
        return numDictionaryPeels;
      }

      @Override
      public long getNumPeelingFallbacks() {
        return numPeelingFallbacks;
      }

      @Override
      public long getNumConstantPeels() {
        return numConstantPeels;
      }

      @Override
      public long getNumDispatchGroups() {
        return numDispatchGroups;
      }
    };
  }

  @Override
  public String toString() {
    return String.format(
        "TransformMetrics(totalTimer=%s, inputRowsCounter=%s, lambdaInvocationsCounter=%s, "
            + "elementsEvaluatedCounter=%s, dictionaryPeelsCounter=%s, "
            + "peelingFallbacksCounter=%s, constantPeelsCounter=%s, dispatchGroupsCounter=%s)",
        totalTimer,
        inputRowsCounter,
        lambdaInvocationsCounter,
        elementsEvaluatedCounter,
        dictionaryPeelsCounter,
        peelingFallbacksCounter,
        constantPeelsCounter,
        dispatchGroupsCounter);
  }
}
