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
package io.lambdakernel.defaults.internal.transform;

import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.defaults.internal.data.vector.ArrayLayout;
import io.lambdakernel.defaults.internal.data.vector.DefaultArrayVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultChunkedVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultDictionaryVector;
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.internal.logging.KernelLogger;
import io.lambdakernel.internal.metrics.TransformMetrics;
import io.lambdakernel.types.ArrayType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

/**
 * Applies a different lambda to different rows. Rows are grouped by the lambda selected for them,
 * each group is evaluated on its own through the single lambda path, and the partial results are
 * merged back into row order.
 */
final class LambdaDispatcher {
  private static final KernelLogger logger =
      new KernelLogger(LoggerFactory.getLogger(LambdaDispatcher.class), "transform");

  /** Evaluates one lambda over a subset of rows. */
  @FunctionalInterface
  interface GroupEvaluator {
    /**
     * @param arrays the array vector
     * @param rows selected rows of {@code arrays}
     * @param lambda the lambda to apply
     * @param captures capture vectors with one value per selected row
     * @return an array vector with one row per selected row
     */
    ColumnVector evaluate(
        ColumnVector arrays, int[] rows, BoundLambda lambda, List<ColumnVector> captures);
  }

  private final int maxLambdas;
  private final TransformMetrics metrics;

  LambdaDispatcher(int maxLambdas, TransformMetrics metrics) {
    this.maxLambdas = maxLambdas;
    this.metrics = metrics;
  }

  /**
   * @param arrays the array vector
   * @param selection for each row, the position in {@code candidates} of the lambda to apply
   * @param candidates the candidate lambdas, all with the same return type
   * @param captures for each candidate, its capture vectors with one value per row of {@code
   *     arrays}
   * @param groupEvaluator evaluates a group of rows
   * @throws io.lambdakernel.exceptions.CorruptVectorException if a row selects no candidate
   * @throws io.lambdakernel.exceptions.ShapeMismatchException if the selection does not have one
   *     entry per row
   */
  ColumnVector dispatch(
      ColumnVector arrays,
      int[] selection,
      List<BoundLambda> candidates,
      List<List<ColumnVector>> captures,
      GroupEvaluator groupEvaluator) {
    if (candidates.size() > maxLambdas) {
      throw LambdaErrors.tooManyCandidateLambdas(candidates.size(), maxLambdas);
    }
    int numRows = arrays.getSize();
    if (selection.length != numRows) {
      throw LambdaErrors.selectorSizeMismatch(numRows, selection.length);
    }

    int[] groupSizes = new int[candidates.size()];
    for (int rowId = 0; rowId < numRows; rowId++) {
      int selected = selection[rowId];
      if (selected < 0 || selected >= candidates.size()) {
        throw LambdaErrors.invalidLambdaSelection(rowId, selected, names(candidates));
      }
      groupSizes[selected]++;
    }
    int[][] groupRows = new int[candidates.size()][];
    for (int candidate = 0; candidate < candidates.size(); candidate++) {
      groupRows[candidate] = new int[groupSizes[candidate]];
    }
    int[] filled = new int[candidates.size()];
    for (int rowId = 0; rowId < numRows; rowId++) {
      int selected = selection[rowId];
      groupRows[selected][filled[selected]++] = rowId;
    }

    List<Integer> activeGroups = new ArrayList<>();
    for (int candidate = 0; candidate < candidates.size(); candidate++) {
      if (groupSizes[candidate] > 0) {
        activeGroups.add(candidate);
      }
    }
    metrics.dispatchGroupsCounter.increment(activeGroups.size());
    logger.debug(
        () ->
            String.format(
                "dispatching %s rows to %s of %s candidate lambdas",
                numRows, activeGroups.size(), candidates.size()));

    if (activeGroups.size() == 1) {
      int only = activeGroups.get(0);
      return groupEvaluator.evaluate(
          arrays, groupRows[only], candidates.get(only), captures.get(only));
    }

    ArrayType resultType = candidates.get(0).getResultType();
    boolean[] nulls = new boolean[numRows];
    boolean hasNulls = false;
    int[] offsets = new int[numRows];
    int[] lengths = new int[numRows];
    List<ColumnVector> chunks = new ArrayList<>(activeGroups.size());
    int chunkStart = 0;
    for (int candidate : activeGroups) {
      int[] rows = groupRows[candidate];
      List<ColumnVector> groupCaptures = slice(captures.get(candidate), rows);
      ColumnVector partial =
          groupEvaluator.evaluate(arrays, rows, candidates.get(candidate), groupCaptures);
      if (partial.getSize() != rows.length) {
        throw LambdaErrors.lambdaResultSizeMismatch(
            candidates.get(candidate).getName(), rows.length, partial.getSize());
      }

      ArrayLayout layout = ArrayLayout.of(partial);
      for (int local = 0; local < rows.length; local++) {
        int rowId = rows[local];
        if (layout.isNullAt(local)) {
          nulls[rowId] = true;
          hasNulls = true;
          continue;
        }
        offsets[rowId] = chunkStart + layout.getOffset(local);
        lengths[rowId] = layout.getLength(local);
      }
      chunks.add(layout.getElements());
      chunkStart += layout.getElements().getSize();
    }

    return new DefaultArrayVector(
        numRows,
        resultType,
        hasNulls ? Optional.of(nulls) : Optional.empty(),
        offsets,
        lengths,
        new DefaultChunkedVector(resultType.getElementType(), chunks));
  }

  private static List<ColumnVector> slice(List<ColumnVector> captures, int[] rows) {
    List<ColumnVector> sliced = new ArrayList<>(captures.size());
    for (ColumnVector capture : captures) {
      if (capture.getEncoding() == VectorEncoding.CONSTANT) {
        sliced.add(CaptureBroadcaster.resize(capture, rows.length));
      } else {
        sliced.add(new DefaultDictionaryVector(capture, rows));
      }
    }
    return sliced;
  }

  private static List<String> names(List<BoundLambda> candidates) {
    return candidates.stream().map(BoundLambda::getName).collect(Collectors.toList());
  }
}
