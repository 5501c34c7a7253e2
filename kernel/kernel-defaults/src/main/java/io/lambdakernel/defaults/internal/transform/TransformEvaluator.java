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

import static io.lambdakernel.internal.util.Preconditions.checkArgument;
import static io.lambdakernel.internal.util.Preconditions.checkState;

import io.lambdakernel.config.ConfigurationProvider;
import io.lambdakernel.data.ArrayValue;
import io.lambdakernel.data.ColumnVector;
import io.lambdakernel.data.VectorEncoding;
import io.lambdakernel.defaults.internal.data.vector.DefaultArrayVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultConstantVector;
import io.lambdakernel.defaults.internal.data.vector.DefaultGenericVector;
import io.lambdakernel.engine.Engine;
import io.lambdakernel.engine.LambdaBodyEvaluator;
import io.lambdakernel.engine.MetricsReporter;
import io.lambdakernel.internal.LambdaErrors;
import io.lambdakernel.internal.TransformConfig;
import io.lambdakernel.internal.logging.KernelLogger;
import io.lambdakernel.internal.metrics.TransformMetrics;
import io.lambdakernel.internal.metrics.TransformReportImpl;
import io.lambdakernel.internal.util.Utils;
import io.lambdakernel.lambda.LambdaHandle;
import io.lambdakernel.metrics.TransformReport;
import io.lambdakernel.types.ArrayType;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

/**
 * Evaluates {@code transform(array, lambda)}: applies a lambda to every element of every array
 * row and returns an array vector with the same row shapes holding the lambda results.
 *
 * <p>For each call the input is evaluated as follows.
 *
 * <ol>
 *   <li>A constant array with constant captures is evaluated over a single row.
 *   <li>A dictionary encoded array is evaluated over the base rows it references, when {@link
 *       DictionaryPeeling} proves this does not change the result, and the result is wrapped in
 *       the same indices.
 *   <li>Otherwise the selected rows are flattened into one element vector, the captures are
 *       repeated once per element and the lambda body is evaluated once over all elements.
 * </ol>
 *
 * <p>When the rows select among several lambdas, rows are grouped per lambda by {@link
 * LambdaDispatcher} and each group goes through the steps above.
 *
 * <p>Every call gets its own metrics. An evaluator holds no state that changes across calls and
 * can be shared by threads evaluating different batches.
 */
public class TransformEvaluator {
  /** Function name used in metrics reports. */
  public static final String FUNCTION_NAME = "transform";

  private static final KernelLogger logger =
      new KernelLogger(LoggerFactory.getLogger(TransformEvaluator.class), "transform");

  private final Engine engine;
  private final LambdaBodyEvaluator bodyEvaluator;
  private final boolean dictionaryPeelingEnabled;
  private final boolean constantPeelingEnabled;
  private final int maxLambdas;
  private final boolean metricsEnabled;

  public TransformEvaluator(Engine engine) {
    this.engine = engine;
    this.bodyEvaluator = engine.getLambdaBodyEvaluator();
    ConfigurationProvider configuration = engine.getConfiguration();
    this.dictionaryPeelingEnabled =
        TransformConfig.DICTIONARY_PEELING_ENABLED.fromConfiguration(configuration);
    this.constantPeelingEnabled =
        TransformConfig.CONSTANT_PEELING_ENABLED.fromConfiguration(configuration);
    this.maxLambdas = TransformConfig.DISPATCH_MAX_LAMBDAS.fromConfiguration(configuration);
    this.metricsEnabled = TransformConfig.METRICS_ENABLED.fromConfiguration(configuration);
  }

  /**
   * Apply one lambda to every row.
   *
   * @param arrays the array vector
   * @param lambda the lambda, bound to the element type of {@code arrays}
   * @param captures one vector per captured column, each with one value per row
   * @return an array vector with one row per row of {@code arrays}
   */
  public ColumnVector transform(
      ColumnVector arrays, BoundLambda lambda, List<ColumnVector> captures) {
    checkInput(arrays, lambda);
    CaptureBroadcaster.checkShapes(lambda.getHandle(), captures, arrays.getSize());
    return evaluate(
        arrays,
        Collections.singletonList(lambda),
        evaluation ->
            evaluation.applyLambda(
                arrays, Utils.identityRows(arrays.getSize()), lambda, captures));
  }

  /**
   * Apply to each row the lambda a condition selects for it.
   *
   * @param arrays the array vector
   * @param condition the evaluated condition, one value per row; the engine's {@link
   *     io.lambdakernel.engine.SelectorEvaluator} maps it to a candidate per row
   * @param candidates the candidate lambdas
   * @param captures for each candidate, one vector per captured column with one value per row
   */
  public ColumnVector transform(
      ColumnVector arrays,
      ColumnVector condition,
      List<BoundLambda> candidates,
      List<List<ColumnVector>> captures) {
    List<LambdaHandle> handles =
        candidates.stream().map(BoundLambda::getHandle).collect(Collectors.toList());
    int[] selection = engine.getSelectorEvaluator().evaluateSelector(condition, handles);
    return transform(arrays, selection, candidates, captures);
  }

  /**
   * Apply to each row the lambda at position {@code selection[row]} of {@code candidates}.
   *
   * @throws io.lambdakernel.exceptions.CorruptVectorException if a selection is not a candidate
   * @throws io.lambdakernel.exceptions.ShapeMismatchException if {@code selection} or a capture
   *     does not have one value per row
   */
  public ColumnVector transform(
      ColumnVector arrays,
      int[] selection,
      List<BoundLambda> candidates,
      List<List<ColumnVector>> captures) {
    checkArgument(!candidates.isEmpty(), "at least one lambda is required");
    checkArgument(
        captures.size() == candidates.size(),
        "expected captures for %s lambdas, got %s",
        candidates.size(),
        captures.size());
    for (int i = 0; i < candidates.size(); i++) {
      checkInput(arrays, candidates.get(i));
      CaptureBroadcaster.checkShapes(
          candidates.get(i).getHandle(), captures.get(i), arrays.getSize());
    }
    return evaluate(
        arrays,
        candidates,
        evaluation ->
            new LambdaDispatcher(maxLambdas, evaluation.metrics)
                .dispatch(arrays, selection, candidates, captures, evaluation::applyLambda));
  }

  private ColumnVector evaluate(
      ColumnVector arrays, List<BoundLambda> lambdas, Function<Evaluation, ColumnVector> body) {
    Evaluation evaluation = new Evaluation(new TransformMetrics());
    evaluation.metrics.inputRowsCounter.increment(arrays.getSize());
    ColumnVector result;
    try {
      result = evaluation.metrics.totalTimer.time(() -> body.apply(evaluation));
    } catch (RuntimeException e) {
      report(lambdas, evaluation.metrics, Optional.of(e));
      throw e;
    }
    report(lambdas, evaluation.metrics, Optional.empty());
    return result;
  }

  private void report(
      List<BoundLambda> lambdas, TransformMetrics metrics, Optional<Exception> exception) {
    if (!metricsEnabled) {
      return;
    }
    List<String> names = lambdas.stream().map(BoundLambda::getName).collect(Collectors.toList());
    TransformReport report = new TransformReportImpl(FUNCTION_NAME, names, metrics, exception);
    for (MetricsReporter reporter : engine.getMetricsReporters()) {
      reporter.report(report);
    }
  }

  private static void checkInput(ColumnVector arrays, BoundLambda lambda) {
    checkArgument(
        arrays.getDataType() instanceof ArrayType,
        "transform expects an array input, got %s",
        arrays.getDataType());
    ArrayType type = (ArrayType) arrays.getDataType();
    checkArgument(
        type.getElementType().equivalent(lambda.getElementType()),
        "lambda `%s` was bound to elements of type %s but the input holds %s",
        lambda.getName(),
        lambda.getElementType(),
        type.getElementType());
  }

  /** State of one call. */
  private class Evaluation {
    private final TransformMetrics metrics;

    Evaluation(TransformMetrics metrics) {
      this.metrics = metrics;
    }

    /**
     * Apply {@code lambda} to the given rows of {@code arrays}.
     *
     * @param rows selected rows of {@code arrays}, in output order
     * @param captures capture vectors, value {@code p} belonging to row {@code rows[p]}
     * @return an array vector with one row per entry of {@code rows}
     */
    ColumnVector applyLambda(
        ColumnVector arrays, int[] rows, BoundLambda lambda, List<ColumnVector> captures) {
      if (rows.length == 0) {
        return emptyResult(lambda);
      }
      if (constantPeelingEnabled
          && arrays.getEncoding() == VectorEncoding.CONSTANT
          && captures.stream().allMatch(c -> c.getEncoding() == VectorEncoding.CONSTANT)) {
        return applyToConstant(arrays, rows.length, lambda, captures);
      }
      if (dictionaryPeelingEnabled && arrays.getEncoding() == VectorEncoding.DICTIONARY) {
        Optional<DictionaryPeeling.Plan> plan = DictionaryPeeling.plan(arrays, rows, captures);
        if (plan.isPresent()) {
          DictionaryPeeling.Plan peeled = plan.get();
          metrics.dictionaryPeelsCounter.increment();
          logger.debug(
              "lambda `{}`: evaluating {} rows over {} dictionary base rows",
              lambda.getName(),
              rows.length,
              peeled.getBaseRows().length);
          ColumnVector baseResult =
              applyLambda(peeled.getBase(), peeled.getBaseRows(), lambda, peeled.getBaseCaptures());
          return peeled.rewrap(baseResult);
        }
        metrics.peelingFallbacksCounter.increment();
        logger.debug(
            "lambda `{}`: captures vary across rows sharing a dictionary entry, "
                + "evaluating {} rows without peeling",
            lambda.getName(),
            rows.length);
      }
      return applyToElements(arrays, rows, lambda, captures);
    }

    private ColumnVector applyToConstant(
        ColumnVector arrays, int numRows, BoundLambda lambda, List<ColumnVector> captures) {
      metrics.constantPeelsCounter.increment();
      if (arrays.isNullAt(0)) {
        return new DefaultConstantVector(lambda.getResultType(), numRows, null);
      }
      ArrayValue value = arrays.getArray(0);
      ColumnVector single =
          new DefaultArrayVector(
              1,
              arrays.getDataType(),
              Optional.empty(),
              new int[] {0},
              new int[] {value.getSize()},
              value.getElements());
      List<ColumnVector> singleCaptures =
          captures.stream()
              .map(capture -> CaptureBroadcaster.resize(capture, 1))
              .collect(Collectors.toList());
      ColumnVector result = applyToElements(single, new int[] {0}, lambda, singleCaptures);
      return DefaultConstantVector.fromRow(result, 0, numRows);
    }

    private ColumnVector applyToElements(
        ColumnVector arrays, int[] rows, BoundLambda lambda, List<ColumnVector> captures) {
      FlattenedArray flattened = ElementFlattener.flatten(arrays, rows);
      int numElements = flattened.getNumElements();
      ColumnVector results;
      if (numElements == 0) {
        results = emptyElements(lambda);
      } else {
        List<ColumnVector> broadcast =
            CaptureBroadcaster.broadcast(lambda.getHandle(), captures, flattened);
        results = bodyEvaluator.evaluate(lambda.getHandle(), flattened.getElements(), broadcast);
        metrics.lambdaInvocationsCounter.increment();
        metrics.elementsEvaluatedCounter.increment(numElements);
        if (results.getSize() != numElements) {
          throw LambdaErrors.lambdaResultSizeMismatch(
              lambda.getName(), numElements, results.getSize());
        }
        checkState(
            results.getDataType().equivalent(lambda.getReturnType()),
            String.format(
                "lambda `%s` returned %s instead of %s",
                lambda.getName(), results.getDataType(), lambda.getReturnType()));
      }
      return new DefaultArrayVector(
          rows.length,
          lambda.getResultType(),
          flattened.getRowNulls(),
          flattened.getOffsets(),
          flattened.getLengths(),
          results);
    }
  }

  private static ColumnVector emptyResult(BoundLambda lambda) {
    return new DefaultArrayVector(
        0, lambda.getResultType(), Optional.empty(), new int[0], new int[0], emptyElements(lambda));
  }

  private static ColumnVector emptyElements(BoundLambda lambda) {
    return DefaultGenericVector.fromArray(lambda.getReturnType(), new Object[0]);
  }
}
