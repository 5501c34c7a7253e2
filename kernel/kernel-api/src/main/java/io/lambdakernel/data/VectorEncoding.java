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
package io.lambdakernel.data;

import io.lambdakernel.annotation.Evolving;

/**
 * Physical representation of a {@link ColumnVector}.
 *
 * @since 1.0.0
 */
@Evolving
public enum VectorEncoding {
  /** Values (or array offsets and lengths) are stored per row. */
  FLAT,
  /** Each row is an index into a base vector; see {@link ColumnVector#getDictionary()}. */
  DICTIONARY,
  /** Every row holds the same value. */
  CONSTANT
}
