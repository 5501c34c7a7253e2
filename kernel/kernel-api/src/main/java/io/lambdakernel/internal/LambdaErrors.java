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

import static java.lang.String.format;

import io.lambdakernel.exceptions.*;
import io.lambdakernel.types.DataType;
import io.lambdakernel.types.StructType;
import java.util.List;

/** Contains methods to create user-facing transform exceptions. */
public final class LambdaErrors {
  private LambdaErrors() {}

  //////////////////////
  // Signature errors //
  //////////////////////

  public static KernelException wrongParameterCount(String lambdaName, int numParameters) {
    return new SignatureMismatchException(
        lambdaName,
        format("transform lambdas take exactly one parameter, but %s were declared", numParameters));
  }

  public static KernelException unknownCaptureColumn(
      String lambdaName, String column, StructType captureRowType) {
    return new SignatureMismatchException(
        lambdaName,
        format(
            "column `%s` is neither the lambda parameter nor a column of the capture row type %s",
            column, captureRowType));
  }

  public static KernelException parameterTypeMismatch(
      String lambdaName, DataType parameterType, DataType elementType) {
    return new SignatureMismatchException(
        lambdaName,
        format(
            "parameter of type %s cannot be bound to array elements of type %s",
            parameterType, elementType));
  }

  public static KernelException missingCaptureColumn(
      String lambdaName, String column, StructType inputSchema) {
    return new SignatureMismatchException(
        lambdaName,
        format("captured column `%s` is not present in the input schema %s", column, inputSchema));
  }

  public static KernelException captureTypeMismatch(
      String lambdaName, String column, DataType declaredType, DataType suppliedType) {
    return new SignatureMismatchException(
        lambdaName,
        format(
            "captured column `%s` was declared as %s but the call site supplies %s",
            column, declaredType, suppliedType));
  }

  public static KernelException returnTypeMismatch(
      String lambdaName, DataType returnType, String otherLambdaName, DataType otherReturnType) {
    return new SignatureMismatchException(
        lambdaName,
        format(
            "returns %s but the alternative lambda `%s` returns %s",
            returnType, otherLambdaName, otherReturnType));
  }

  public static KernelException unsupportedLambdaBody(String lambdaName, Exception cause) {
    return new SignatureMismatchException(
        lambdaName, "body cannot be evaluated: " + cause.getMessage(), cause);
  }

  public static KernelException unknownLambda(String lambdaName) {
    return new KernelException(format("No lambda registered under the name `%s`", lambdaName));
  }

  //////////////////
  // Shape errors //
  //////////////////

  public static KernelException captureSizeMismatch(String column, int rowCount, int captureSize) {
    return new ShapeMismatchException(format("Captured column `%s`", column), rowCount, captureSize);
  }

  public static KernelException lambdaResultSizeMismatch(
      String lambdaName, int numElements, int resultSize) {
    return new ShapeMismatchException(
        format("Result of lambda `%s`", lambdaName), numElements, resultSize);
  }

  public static KernelException selectorSizeMismatch(int rowCount, int selectorSize) {
    return new ShapeMismatchException("Lambda selector", rowCount, selectorSize);
  }

  ///////////////////////////
  // Corrupt vector errors //
  ///////////////////////////

  public static KernelException arrayRangeOutOfBounds(
      int rowId, int offset, int length, int numElements) {
    return new CorruptVectorException(
        format(
            "Array row %s references elements [%s, %s + %s) outside of the %s available elements",
            rowId, offset, offset, length, numElements));
  }

  public static KernelException dictionaryIndexOutOfBounds(int rowId, int index, int baseSize) {
    return new CorruptVectorException(
        format(
            "Dictionary row %s references index %s outside of the base vector of size %s",
            rowId, index, baseSize));
  }

  public static KernelException invalidLambdaSelection(
      int rowId, int selection, List<String> candidateNames) {
    return new CorruptVectorException(
        format(
            "Row %s selected lambda %s but only the candidates %s exist",
            rowId, selection, candidateNames));
  }

  ///////////////////
  // Other errors //
  //////////////////

  public static KernelException tooManyCandidateLambdas(int numCandidates, int maxLambdas) {
    return new KernelException(
        format(
            "A transform can select among at most %s lambdas but %s were given. See '%s'.",
            maxLambdas, numCandidates, TransformConfig.DISPATCH_MAX_LAMBDAS.getKey()));
  }

  public static KernelException unknownConfigurationException(String confKey) {
    return new UnknownConfigurationException(confKey);
  }

  public static KernelException invalidConfigurationValueException(
      String key, String value, String helpMessage) {
    return new InvalidConfigurationValueException(key, value, helpMessage);
  }
}
