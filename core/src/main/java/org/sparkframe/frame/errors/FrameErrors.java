/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sparkframe.frame.errors;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.sparkframe.FrameException;
import org.sparkframe.annotation.Private;
import org.sparkframe.frame.schema.Column;

/**
 * Factory for every exception raised by the frame layer. Keeping the condition names and their
 * parameters in one place keeps them in sync with {@code error/error-conditions.json}.
 */
@Private
public final class FrameErrors {

  private FrameErrors() {}

  public static FrameException cellParseError(int columnIndex, Column column, String reason) {
    return new FrameException("CELL_PARSE_ERROR", params(
      "columnName", toId(column.name()),
      "columnIndex", String.valueOf(columnIndex),
      "dataType", column.dataType().typeName(),
      "reason", reason));
  }

  public static FrameException schemaMismatch(int rowLength, int numColumns) {
    return new FrameException("SCHEMA_MISMATCH", params(
      "rowLength", String.valueOf(rowLength),
      "numColumns", String.valueOf(numColumns)));
  }

  public static FrameException corruptBatch(int partitionId, Throwable cause) {
    return new FrameException("CORRUPT_BATCH", params(
      "partitionId", String.valueOf(partitionId),
      "reason", String.valueOf(cause.getMessage())), cause);
  }

  public static FrameException unsupportedRowShape(Object value, int partitionId) {
    return new FrameException("UNSUPPORTED_ROW_SHAPE", params(
      "className", value == null ? "null" : value.getClass().getName(),
      "partitionId", String.valueOf(partitionId)));
  }

  public static FrameException columnNotFound(String columnName, Collection<String> columns) {
    return new FrameException("COLUMN_NOT_FOUND", params(
      "columnName", toId(columnName),
      "columns", toIds(columns)));
  }

  public static FrameException duplicateColumnName(String columnName, Collection<String> columns) {
    return new FrameException("DUPLICATE_COLUMN_NAME", params(
      "columnName", toId(columnName),
      "columns", toIds(columns)));
  }

  public static FrameException columnIndexOutOfRange(int index, int numColumns) {
    return new FrameException("COLUMN_INDEX_OUT_OF_RANGE", params(
      "index", String.valueOf(index),
      "numColumns", String.valueOf(numColumns)));
  }

  public static FrameException unsupportedFormatVersion(
      String formatId,
      int formatVersion,
      int[] supported) {
    return new FrameException("UNSUPPORTED_FORMAT_VERSION", params(
      "formatId", formatId,
      "formatVersion", String.valueOf(formatVersion),
      "supported", Arrays.stream(supported)
        .mapToObj(String::valueOf)
        .collect(Collectors.joining(", "))));
  }

  public static FrameException unknownDataType(String typeName, Collection<String> supported) {
    return new FrameException("UNKNOWN_DATA_TYPE", params(
      "typeName", "'" + typeName + "'",
      "supported", String.join(", ", supported)));
  }

  public static FrameException invalidConfig(String key, String value, String reason) {
    return new FrameException("INVALID_CONFIG", params(
      "key", key,
      "value", "'" + value + "'",
      "reason", reason));
  }

  private static String toId(String name) {
    return "`" + name + "`";
  }

  private static String toIds(Collection<String> names) {
    return names.stream().map(FrameErrors::toId).collect(Collectors.joining(", "));
  }

  private static Map<String, String> params(String... keysAndValues) {
    Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      params.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return params;
  }
}
