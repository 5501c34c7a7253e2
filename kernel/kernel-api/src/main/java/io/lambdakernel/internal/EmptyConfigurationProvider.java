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
import java.util.NoSuchElementException;
import java.util.Optional;

/** A {@link ConfigurationProvider} with no values. Every property takes its default. */
public class EmptyConfigurationProvider implements ConfigurationProvider {
  public static final EmptyConfigurationProvider EMPTY = new EmptyConfigurationProvider();

  private EmptyConfigurationProvider() {}

  @Override
  public String get(String key) throws NoSuchElementException {
    throw new NoSuchElementException(key);
  }

  @Override
  public Optional<String> getOptional(String key) {
    return Optional.empty();
  }

  @Override
  public boolean contains(String key) {
    return false;
  }
}
