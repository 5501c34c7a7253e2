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
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.lambda.LambdaHandle;
import java.util.List;

/**
 * Resolves, per row, which of several candidate lambdas a conditional transform applies.
 *
 * @since 1.0.0
 */
@Evolving
public interface SelectorEvaluator {

  /**
   * @param condition the evaluated condition, one value per row
   * @param candidates the candidate lambdas in declaration order
   * @return for each row, the position in {@code candidates} of the lambda that applies
   */
  int[] evaluateSelector(ColumnVector condition, List<LambdaHandle> candidates);
}
