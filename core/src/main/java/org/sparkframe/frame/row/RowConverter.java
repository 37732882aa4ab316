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

package org.sparkframe.frame.row;

import java.io.Serializable;

import com.google.common.base.Preconditions;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;

import org.sparkframe.frame.errors.FrameErrors;
import org.sparkframe.frame.schema.Column;
import org.sparkframe.frame.schema.ParseOutcome;
import org.sparkframe.frame.schema.Schema;

/**
 * Converts positional raw values into a canonical {@link Row} of a {@link Schema}.
 * <p>
 * Null cells stay null without being parsed. A cell that fails to parse becomes null under
 * {@link ConversionPolicy#LENIENT} and raises CELL_PARSE_ERROR under
 * {@link ConversionPolicy#STRICT}. A row whose length differs from the schema always raises
 * SCHEMA_MISMATCH; dropping such rows is up to the caller (see {@link RowConversions}).
 * <p>
 * Converters hold no mutable state and are shared between partition tasks.
 */
public final class RowConverter implements Serializable {

  public static final RowConverter LENIENT = new RowConverter(ConversionPolicy.LENIENT);
  public static final RowConverter STRICT = new RowConverter(ConversionPolicy.STRICT);

  private final ConversionPolicy policy;

  private RowConverter(ConversionPolicy policy) {
    this.policy = policy;
  }

  public static RowConverter forPolicy(ConversionPolicy policy) {
    Preconditions.checkNotNull(policy, "policy");
    return policy == ConversionPolicy.STRICT ? STRICT : LENIENT;
  }

  public ConversionPolicy policy() {
    return policy;
  }

  public Row convert(Object[] raw, Schema schema) {
    return convert(raw, schema, null);
  }

  /**
   * @param metrics counters to update, or null
   */
  public Row convert(Object[] raw, Schema schema, ConversionMetrics metrics) {
    if (raw.length != schema.size()) {
      throw FrameErrors.schemaMismatch(raw.length, schema.size());
    }
    Object[] values = new Object[raw.length];
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] == null) {
        continue;
      }
      Column column = schema.column(i);
      ParseOutcome outcome = column.dataType().parse(raw[i]);
      if (outcome.isOk()) {
        values[i] = outcome.value();
      } else if (policy == ConversionPolicy.STRICT) {
        throw FrameErrors.cellParseError(i, column, outcome.failureReason());
      } else if (metrics != null) {
        metrics.cellNulled();
      }
    }
    if (metrics != null) {
      metrics.rowConverted();
    }
    return RowFactory.create(values);
  }

  // Singletons per policy survive serialization
  private Object readResolve() {
    return forPolicy(policy);
  }
}
