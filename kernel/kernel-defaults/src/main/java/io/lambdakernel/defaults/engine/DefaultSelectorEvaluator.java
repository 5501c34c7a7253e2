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

import static io.lambdakernel.internal.util.Preconditions.checkArgument;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.engine.SelectorEvaluator;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.types.BooleanType;
import io.lambdakernel.types.IntegerType;
import java.util.List;

/**
 * Default {@link SelectorEvaluator}.
 *
 * <ul>
 *   <li>A {@code boolean} condition selects between two lambdas: {@code true} selects the first,
 *       {@code false} and {@code null} select the second.
 *   <li>An {@code integer} condition is the position of the lambda to apply. A {@code null}
 *       selects the last lambda.
 * </ul>
 */
public class DefaultSelectorEvaluator implements SelectorEvaluator {

  @Override
  public int[] evaluateSelector(ColumnVector condition, List<LambdaHandle> candidates) {
    int numRows = condition.getSize();
    int[] selection = new int[numRows];
    if (condition.getDataType() instanceof BooleanType) {
      checkArgument(
          candidates.size() == 2,
          "a boolean condition selects between 2 lambdas, got %s",
          candidates.size());
      for (int rowId = 0; rowId < numRows; rowId++) {
        boolean isTrue = !condition.isNullAt(rowId) && condition.getBoolean(rowId);
        selection[rowId] = isTrue ? 0 : 1;
      }
    } else if (condition.getDataType() instanceof IntegerType) {
      int last = candidates.size() - 1;
      for (int rowId = 0; rowId < numRows; rowId++) {
        selection[rowId] = condition.isNullAt(rowId) ? last : condition.getInt(rowId);
      }
    } else {
      throw new IllegalArgumentException(
          "unsupported lambda selector type: " + condition.getDataType());
    }
    return selection;
  }
}
