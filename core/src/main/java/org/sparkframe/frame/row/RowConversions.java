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

import java.util.Iterator;

import com.google.common.collect.AbstractIterator;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.sql.Row;

import org.sparkframe.frame.schema.Schema;
import org.sparkframe.internal.LogKeys;
import org.sparkframe.internal.Logger;
import org.sparkframe.internal.LoggerFactory;
import org.sparkframe.internal.MDC;

/**
 * Applies a {@link RowConverter} to every row of an RDD, partition by partition, preserving the
 * order of rows within each partition and the partitioning itself.
 */
public final class RowConversions {

  private static final Logger logger = LoggerFactory.getLogger(RowConversions.class);

  // Dropped rows beyond this many per partition are logged at DEBUG only
  private static final int MAX_DROPPED_ROW_WARNINGS = 10;

  private RowConversions() {}

  public static JavaRDD<Row> toRowRdd(
      JavaRDD<Object[]> raw,
      Schema schema,
      RowConverter converter,
      ConversionMetrics metrics) {
    return raw.mapPartitions(
      rows -> new ConvertingIterator(rows, schema, converter, metrics), true);
  }

  /**
   * Converts lazily; under LENIENT, rows whose length does not match the schema are skipped.
   */
  static final class ConvertingIterator extends AbstractIterator<Row> {
    private final Iterator<Object[]> rows;
    private final Schema schema;
    private final RowConverter converter;
    private final ConversionMetrics metrics;
    private int droppedInPartition = 0;

    ConvertingIterator(
        Iterator<Object[]> rows,
        Schema schema,
        RowConverter converter,
        ConversionMetrics metrics) {
      this.rows = rows;
      this.schema = schema;
      this.converter = converter;
      this.metrics = metrics;
    }

    @Override
    protected Row computeNext() {
      while (rows.hasNext()) {
        Object[] raw = rows.next();
        if (raw.length == schema.size() || converter.policy() == ConversionPolicy.STRICT) {
          return converter.convert(raw, schema, metrics);
        }
        drop(raw);
      }
      return endOfData();
    }

    private void drop(Object[] raw) {
      droppedInPartition++;
      if (metrics != null) {
        metrics.rowDropped();
      }
      if (droppedInPartition <= MAX_DROPPED_ROW_WARNINGS) {
        logger.warn("Dropping row of length {} in partition {}: schema has {} columns",
          MDC.of(LogKeys.ROW_LENGTH, raw.length),
          MDC.of(LogKeys.PARTITION_ID, RawRowAdapter.currentPartitionId()),
          MDC.of(LogKeys.EXPECTED_LENGTH, schema.size()));
      } else {
        logger.debug("Dropping row of length {} (expected {})", raw.length, schema.size());
      }
    }
  }
}
