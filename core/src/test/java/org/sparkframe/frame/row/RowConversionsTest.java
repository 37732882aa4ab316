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

import java.util.Arrays;
import java.util.List;

import org.apache.spark.SparkException;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.junit.jupiter.api.Test;

import org.sparkframe.SharedSparkContext;
import org.sparkframe.frame.schema.Column;
import org.sparkframe.frame.schema.DataTypes;
import org.sparkframe.frame.schema.Schema;

import static org.junit.jupiter.api.Assertions.*;

public class RowConversionsTest extends SharedSparkContext {

  private static final Schema SCHEMA = Schema.of(
    Column.of("id", DataTypes.INT32),
    Column.of("score", DataTypes.FLOAT64));

  private JavaRDD<Object[]> raw() {
    return jsc.parallelize(Arrays.asList(
      new Object[] {1, 0.5},
      new Object[] {2, "bad"},
      new Object[] {3},
      new Object[] {"4", "1.5"},
      new Object[] {5, 2.0, "extra"},
      new Object[] {6, null}), 2);
  }

  @Test
  public void lenientDropsAndNulls() {
    ConversionMetrics metrics = ConversionMetrics.register(jsc, "lenientDropsAndNulls");
    JavaRDD<Row> rows = RowConversions.toRowRdd(raw(), SCHEMA, RowConverter.LENIENT, metrics);
    assertEquals(2, rows.getNumPartitions());

    List<Row> collected = rows.collect();
    assertEquals(List.of(
      RowFactory.create(1, 0.5),
      RowFactory.create(2, null),
      RowFactory.create(4, 1.5),
      RowFactory.create(6, null)), collected);

    ConversionReport report = metrics.logReport();
    assertEquals(new ConversionReport(4, 2, 1), report);
    assertFalse(report.isClean());
  }

  @Test
  public void partitionBoundariesArePreserved() {
    JavaRDD<Row> rows = RowConversions.toRowRdd(raw(), SCHEMA, RowConverter.LENIENT, null);
    List<List<Row>> partitions = rows.glom().collect();
    assertEquals(2, partitions.size());
    assertEquals(List.of(RowFactory.create(1, 0.5), RowFactory.create(2, null)),
      partitions.get(0));
    assertEquals(List.of(RowFactory.create(4, 1.5), RowFactory.create(6, null)),
      partitions.get(1));
  }

  @Test
  public void cleanConversion() {
    ConversionMetrics metrics = ConversionMetrics.register(jsc, "clean");
    JavaRDD<Object[]> raw = jsc.parallelize(Arrays.asList(
      new Object[] {1, 1.0}, new Object[] {2, 2.0}), 1);
    assertEquals(2, RowConversions.toRowRdd(raw, SCHEMA, RowConverter.LENIENT, metrics).count());
    assertTrue(metrics.report().isClean());
    assertEquals("clean", metrics.name());
    assertEquals(2, metrics.report().convertedRows());
  }

  @Test
  public void strictFailsTheJob() {
    JavaRDD<Row> rows = RowConversions.toRowRdd(raw(), SCHEMA, RowConverter.STRICT, null);
    SparkException e = assertThrows(SparkException.class, rows::collect);
    assertTrue(e.getMessage().contains("CELL_PARSE_ERROR") ||
      e.getMessage().contains("SCHEMA_MISMATCH"), e.getMessage());
  }
}
