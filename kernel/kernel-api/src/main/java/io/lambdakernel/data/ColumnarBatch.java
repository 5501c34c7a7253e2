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
import io.lambdakernel.types.StructType;

/**
 * Represents zero or more rows of records with same schema type.
 *
 * @since 1.0.0
 */
@Evolving
public interface ColumnarBatch {
  /** @return the schema of the data in this batch. */
  StructType getSchema();

  /**
   * Return the {@link ColumnVector} for the given ordinal in the columnar batch. If the ordinal is
   * not valid throws error.
   *
   * @param ordinal the ordinal of the column to retrieve
   * @return the {@link ColumnVector} for the given ordinal in the columnar batch
   */
  ColumnVector getColumnVector(int ordinal);

  /** @return the number of rows/records in the columnar batch */
  int getSize();
}
