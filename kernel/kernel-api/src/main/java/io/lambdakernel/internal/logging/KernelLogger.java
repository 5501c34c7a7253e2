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
package io.lambdakernel.internal.logging;

import java.util.function.Supplier;
import org.slf4j.Logger;

/** Wraps an SLF4J {@link Logger} and prefixes every message with the evaluation context. */
public class KernelLogger {

  private final Logger loggerImpl;
  private final String prefix;

  public KernelLogger(Logger loggerImpl, String context) {
    this.loggerImpl = loggerImpl;
    this.prefix = String.format("[%s]: ", context);
  }

  public void debug(String msg, Object... args) {
    loggerImpl.debug(prefix + msg, args);
  }

  public void debug(Supplier<String> message) {
    if (loggerImpl.isDebugEnabled()) {
      loggerImpl.debug(prefix + message.get());
    }
  }
}
