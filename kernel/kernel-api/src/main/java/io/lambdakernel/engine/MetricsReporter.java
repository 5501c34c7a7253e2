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
package io.lambdakernel.engine;

import io.lambdakernel.annotation.Evolving;
import io.lambdakernel.metrics.MetricsReport;

/**
 * Interface to be implemented by engines that want to receive the {@link MetricsReport}s
 * produced by evaluations.
 *
 * @since 1.0.0
 */
@Evolving
public interface MetricsReporter {

  /** Indicates that an operation is done by reporting a {@link MetricsReport} */
  void report(MetricsReport report);
}
