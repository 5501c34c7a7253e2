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
import io.lambdakernel.config.ConfigurationProvider;
import java.util.Collections;
import java.util.List;

/**
 * Interface encapsulating all clients needed to evaluate higher-order array functions. The
 * default implementation lives in the {@code lambda-kernel-defaults} module; connectors can
 * replace any of the collaborators with their own.
 *
 * @since 1.0.0
 */
@Evolving
public interface Engine {

  /**
   * Get the connector provided {@link ExpressionHandler}.
   *
   * @return An implementation of {@link ExpressionHandler}.
   */
  ExpressionHandler getExpressionHandler();

  /**
   * Get the {@link LambdaBodyEvaluator} used to evaluate lambda bodies over flattened elements.
   *
   * @return An implementation of {@link LambdaBodyEvaluator}.
   */
  LambdaBodyEvaluator getLambdaBodyEvaluator();

  /**
   * Get the {@link SelectorEvaluator} used to pick a lambda per row for conditional transforms.
   *
   * @return An implementation of {@link SelectorEvaluator}.
   */
  SelectorEvaluator getSelectorEvaluator();

  /** @return the configuration evaluation properties are read from */
  ConfigurationProvider getConfiguration();

  /** Get the engine's {@link MetricsReporter} instances to push reports to. */
  default List<MetricsReporter> getMetricsReporters() {
    return Collections.emptyList();
  }
}
