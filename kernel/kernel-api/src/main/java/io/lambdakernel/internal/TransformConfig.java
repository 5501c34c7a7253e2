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
package io.lambdakernel.internal;

import io.lambdakernel.config.ConfigurationProvider;
import io.lambdakernel.exceptions.InvalidConfigurationValueException;
import io.lambdakernel.exceptions.UnknownConfigurationException;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Represents the engine properties that control transform evaluation. Also provides methods to
 * access the property values from a {@link ConfigurationProvider} or a plain map.
 */
public class TransformConfig<T> {

  //////////////////////
  // TransformConfigs //
  //////////////////////

  /**
   * Whether dictionary encoded array inputs are peeled so that each distinct base row is evaluated
   * once. Peeling is only used when it is proven not to change the result.
   */
  public static final TransformConfig<Boolean> DICTIONARY_PEELING_ENABLED =
      new TransformConfig<>(
          "transform.dictionaryPeeling.enabled",
          "true",
          Boolean::valueOf,
          value -> true,
          "needs to be a boolean.");

  /** Whether constant array inputs with constant captures are evaluated over a single row. */
  public static final TransformConfig<Boolean> CONSTANT_PEELING_ENABLED =
      new TransformConfig<>(
          "transform.constantPeeling.enabled",
          "true",
          Boolean::valueOf,
          value -> true,
          "needs to be a boolean.");

  /** Maximum number of candidate lambdas a conditional transform may select among. */
  public static final TransformConfig<Integer> DISPATCH_MAX_LAMBDAS =
      new TransformConfig<>(
          "transform.dispatch.maxLambdas",
          "16",
          TransformConfig::parseInt,
          value -> value != null && value >= 2,
          "needs to be an integer greater than or equal to 2.");

  /** Whether a metrics report is built and pushed to the engine's reporters after each call. */
  public static final TransformConfig<Boolean> METRICS_ENABLED =
      new TransformConfig<>(
          "transform.metrics.enabled",
          "true",
          Boolean::valueOf,
          value -> true,
          "needs to be a boolean.");

  private static final Map<String, TransformConfig<?>> VALID_PROPERTIES =
      Collections.unmodifiableMap(
          new HashMap<String, TransformConfig<?>>() {
            {
              addConfig(this, DICTIONARY_PEELING_ENABLED);
              addConfig(this, CONSTANT_PEELING_ENABLED);
              addConfig(this, DISPATCH_MAX_LAMBDAS);
              addConfig(this, METRICS_ENABLED);
            }
          });

  ///////////////////////////
  // Static Helper Methods //
  ///////////////////////////

  /**
   * Validates the given engine properties. Properties with the `transform.` prefix must be known
   * and hold valid values; other properties are passed through untouched. The returned map has the
   * case of known keys normalized as defined in their {@link TransformConfig}.
   *
   * @param properties the properties to validate
   * @throws InvalidConfigurationValueException if any of the properties are invalid
   * @throws UnknownConfigurationException if any of the properties are unknown
   */
  public static Map<String, String> validateProperties(Map<String, String> properties) {
    Map<String, String> validatedProperties = new HashMap<>();
    for (Map.Entry<String, String> kv : properties.entrySet()) {
      String key = kv.getKey().toLowerCase(Locale.ROOT);
      String value = kv.getValue();
      if (key.startsWith("transform.")) {
        TransformConfig<?> config = VALID_PROPERTIES.get(key);
        if (config == null) {
          throw LambdaErrors.unknownConfigurationException(kv.getKey());
        }
        config.validate(value);
        validatedProperties.put(config.getKey(), value);
      } else {
        validatedProperties.put(kv.getKey(), value);
      }
    }
    return validatedProperties;
  }

  private static void addConfig(
      HashMap<String, TransformConfig<?>> configs, TransformConfig<?> config) {
    configs.put(config.getKey().toLowerCase(Locale.ROOT), config);
  }

  /////////////////////////////
  // Member Fields / Methods //
  /////////////////////////////

  private final String key;
  private final String defaultValue;
  private final Function<String, T> fromString;
  private final Predicate<T> validator;
  private final String helpMessage;

  private TransformConfig(
      String key,
      String defaultValue,
      Function<String, T> fromString,
      Predicate<T> validator,
      String helpMessage) {
    this.key = key;
    this.defaultValue = defaultValue;
    this.fromString = fromString;
    this.validator = validator;
    this.helpMessage = helpMessage;
  }

  /**
   * Returns the value of the property from the given configuration provider.
   *
   * @param configuration the engine configuration
   * @return the value of the property
   */
  public T fromConfiguration(ConfigurationProvider configuration) {
    return parse(configuration.getOptional(key).orElse(defaultValue));
  }

  /**
   * Returns the value of the property from the given properties.
   *
   * @param properties the engine properties
   * @return the value of the property
   */
  public T fromProperties(Map<String, String> properties) {
    return parse(properties.getOrDefault(key, defaultValue));
  }

  /**
   * Returns the key of the property.
   *
   * @return the key of the property
   */
  public String getKey() {
    return key;
  }

  public String getDefaultValue() {
    return defaultValue;
  }

  private T parse(String value) {
    validate(value);
    return fromString.apply(value);
  }

  private void validate(String value) {
    T parsedValue = fromString.apply(value);
    if (!validator.test(parsedValue)) {
      throw LambdaErrors.invalidConfigurationValueException(key, value, helpMessage);
    }
  }

  private static Integer parseInt(String value) {
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
