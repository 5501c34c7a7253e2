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
package io.lambdakernel.defaults.engine;

import static java.util.Objects.requireNonNull;

import io.lambdakernel.config.ConfigurationProvider;
import io.lambdakernel.engine.*;
import io.lambdakernel.internal.EmptyConfigurationProvider;
import io.lambdakernel.internal.MapConfigurationProvider;
import io.lambdakernel.internal.TransformConfig;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Default implementation of {@link Engine} evaluating everything on heap in the calling thread. */
public class DefaultEngine implements Engine {
  private final ConfigurationProvider configuration;

  protected DefaultEngine(ConfigurationProvider configuration) {
    this.configuration = requireNonNull(configuration, "configuration is null");
    // parse every property once so that invalid values fail here instead of on first use
    TransformConfig.DICTIONARY_PEELING_ENABLED.fromConfiguration(configuration);
    TransformConfig.CONSTANT_PEELING_ENABLED.fromConfiguration(configuration);
    TransformConfig.DISPATCH_MAX_LAMBDAS.fromConfiguration(configuration);
    TransformConfig.METRICS_ENABLED.fromConfiguration(configuration);
  }

  @Override
  public ExpressionHandler getExpressionHandler() {
    return new DefaultExpressionHandler(this);
  }

  @Override
  public LambdaBodyEvaluator getLambdaBodyEvaluator() {
    return new DefaultLambdaBodyEvaluator(this);
  }

  @Override
  public SelectorEvaluator getSelectorEvaluator() {
    return new DefaultSelectorEvaluator();
  }

  @Override
  public ConfigurationProvider getConfiguration() {
    return configuration;
  }

  @Override
  public List<MetricsReporter> getMetricsReporters() {
    return Collections.singletonList(new LoggingMetricsReporter());
  }

  /**
   * Create an instance of {@link DefaultEngine} where every property takes its default value.
   *
   * @return an instance of {@link DefaultEngine}.
   */
  public static DefaultEngine create() {
    return new DefaultEngine(EmptyConfigurationProvider.EMPTY);
  }

  /**
   * Create an instance of {@link DefaultEngine} reading its properties from the given provider.
   *
   * @param configuration provider of the {@code transform.*} properties
   * @return an instance of {@link DefaultEngine}.
   * @throws io.lambdakernel.exceptions.InvalidConfigurationValueException if a property has an
   *     invalid value
   */
  public static DefaultEngine create(ConfigurationProvider configuration) {
    return new DefaultEngine(configuration);
  }

  /**
   * Create an instance of {@link DefaultEngine} from a map of properties. Unknown {@code
   * transform.*} keys are rejected.
   *
   * @param properties the engine properties
   * @return an instance of {@link DefaultEngine}.
   * @throws io.lambdakernel.exceptions.UnknownConfigurationException if a {@code transform.*}
   *     property is unknown
   * @throws io.lambdakernel.exceptions.InvalidConfigurationValueException if a property has an
   *     invalid value
   */
  public static DefaultEngine create(Map<String, String> properties) {
    return new DefaultEngine(
        new MapConfigurationProvider(TransformConfig.validateProperties(properties)));
  }
}
