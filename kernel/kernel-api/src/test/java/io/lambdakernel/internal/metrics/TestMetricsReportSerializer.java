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

import static org.assertj.core.api.Assertions.assertThat;

import io.lambdakernel.exceptions.ShapeMismatchException;
import io.lambdakernel.metrics.TransformReport;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import org.junit.Test;

public class TestMetricsReportSerializer {

  @Test
  public void serializeTransformReport() throws Exception {
    TransformMetrics metrics = new TransformMetrics();
    metrics.inputRowsCounter.increment(8);
    metrics.lambdaInvocationsCounter.increment(2);
    metrics.elementsEvaluatedCounter.increment(20);
    metrics.dictionaryPeelsCounter.increment();
    metrics.dispatchGroupsCounter.increment(2);
    metrics.totalTimer.record(100);
    TransformReport report =
        new TransformReportImpl(
            "transform", Arrays.asList("plusOne", "timesTwo"), metrics, Optional.empty());

    String json = MetricsReportSerializer.serialize(report);

    String expected =
        String.format(
            "{\"operationType\":\"Transform\","
                + "\"reportUUID\":\"%s\","
                + "\"functionName\":\"transform\","
                + "\"lambdaNames\":[\"plusOne\",\"timesTwo\"],"
                + "\"exception\":null,"
                + "\"transformMetrics\":{"
                + "\"totalDurationNs\":100,"
                + "\"numInputRows\":8,"
                + "\"numLambdaInvocations\":2,"
                + "\"numElementsEvaluated\":20,"
                + "\"numDictionaryPeels\":1,"
                + "\"numPeelingFallbacks\":0,"
                + "\"numConstantPeels\":0,"
                + "\"numDispatchGroups\":2}}",
            report.getReportUUID());
    assertThat(json).isEqualTo(expected);
  }

  @Test
  public void exceptionIsSerializedAsString() throws Exception {
    ShapeMismatchException exception = new ShapeMismatchException("Lambda selector", 3, 2);
    TransformReport report =
        new TransformReportImpl(
            "transform",
            Collections.singletonList("f"),
            new TransformMetrics(),
            Optional.of(exception));

    String json = MetricsReportSerializer.serialize(report);

    assertThat(json).contains("\"exception\":\"" + exception + "\"");
  }

  @Test
  public void snapshotIsNotAffectedByLaterUpdates() {
    TransformMetrics metrics = new TransformMetrics();
    metrics.lambdaInvocationsCounter.increment();
    TransformReport report =
        new TransformReportImpl(
            "transform", Collections.singletonList("f"), metrics, Optional.empty());

    metrics.lambdaInvocationsCounter.increment();

    assertThat(report.getTransformMetrics().getNumLambdaInvocations()).isEqualTo(1);
  }
}
