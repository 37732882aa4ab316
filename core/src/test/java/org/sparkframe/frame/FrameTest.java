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

package org.sparkframe.frame;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import net.razorvine.pickle.Pickler;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.network.util.MapConfigProvider;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.junit.jupiter.api.Test;

import org.sparkframe.FrameException;
import org.sparkframe.SharedSparkContext;
import org.sparkframe.config.FrameConf;
import org.sparkframe.frame.row.ConversionReport;
import org.sparkframe.frame.schema.Column;
import org.sparkframe.frame.schema.DataTypes;
import org.sparkframe.frame.schema.Schema;

import static org.junit.jupiter.api.Assertions.*;

public class FrameTest extends SharedSparkContext {

  private static final Schema SCHEMA = Schema.of(
    Column.of("name", DataTypes.STRING),
    Column.of("age", DataTypes.INT32));

  @Test
  public void createWithValidation() {
    List<Object> data = Arrays.asList(
      Arrays.asList("Bob", "30"),
      new Object[] {"Jim", "old"},
      Arrays.asList("Sue"),
      Arrays.asList("Ann", 41L));
    Frame frame = Frame.create(jsc, data, SCHEMA, true);
    assertEquals(SCHEMA, frame.schema());
    assertEquals(List.of(
      RowFactory.create("Bob", 30),
      RowFactory.create("Jim", null),
      RowFactory.create("Ann", 41)), frame.rdd().collect());
    assertEquals(Optional.of(new ConversionReport(3, 1, 1)), frame.conversionReport());
    assertEquals(3, frame.rowCount());
  }

  @Test
  public void createWithoutValidationKeepsValues() {
    Frame frame = Frame.create(jsc, List.of(List.of("Bob", "30")), SCHEMA, false);
    Row row = frame.take(1).get(0);
    assertEquals("30", row.get(1));
    FrameException e = assertThrows(FrameException.class,
      () -> Frame.create(jsc, List.of(List.of("Bob")), SCHEMA, false));
    assertEquals("SCHEMA_MISMATCH", e.getCondition());
  }

  @Test
  public void createWithInferredSchema() {
    List<List<Object>> data = List.of(List.of("Bob", 30, 8), List.of("Jim", 45, 9.5));
    Frame frame = Frame.create(jsc, data, List.of("name", "age", "shoe_size"), true,
      FrameConf.defaults());
    assertEquals(Schema.of(
      Column.of("name", DataTypes.STRING),
      Column.of("age", DataTypes.INT32),
      Column.of("shoe_size", DataTypes.FLOAT64)), frame.schema());
    assertEquals(RowFactory.create("Bob", 30, 8.0), frame.take(1).get(0));
    assertEquals(List.of("name", "age", "shoe_size"),
      frame.columns().stream().map(Column::name).collect(java.util.stream.Collectors.toList()));
  }

  @Test
  public void pythonRoundTrip() {
    FrameConf conf = new FrameConf(new MapConfigProvider(Map.of(
      FrameConf.BATCH_MIN_BYTES, "16b", FrameConf.BATCH_MAX_BYTES, "128b")));
    Frame frame = Frame.create(jsc,
      List.of(List.of("Bob", 30), List.of("Jim", 45), List.of("Sue", 25)), SCHEMA, true);
    JavaRDD<byte[]> batches = frame.toPython(conf);
    Frame back = Frame.fromPython(batches, SCHEMA, conf);
    assertEquals(frame.rdd().collect(), back.rdd().collect());
    assertEquals(frame.rdd().getNumPartitions(), back.rdd().getNumPartitions());
  }

  @Test
  public void fromPythonReportsDroppedRowsAndNulledCells() throws IOException {
    byte[] batch = new Pickler(true, false).dumps(List.of(
      List.of("Bob", "30"),
      List.of("Jim", "old"),
      List.of("Sue")));
    Frame frame = Frame.fromPython(jsc.parallelize(List.of(batch), 1), SCHEMA,
      FrameConf.defaults());
    assertEquals(List.of(
      RowFactory.create("Bob", 30),
      RowFactory.create("Jim", null)), frame.rdd().collect());
    assertEquals(Optional.of(new ConversionReport(2, 1, 1)), frame.conversionReport());
  }

  @Test
  public void createWithoutValidationHasNoReport() {
    Frame frame = Frame.create(jsc, List.of(List.of("Bob", 30)), SCHEMA, false);
    assertEquals(Optional.empty(), frame.conversionReport());
  }

  @Test
  public void executeSwapsState() {
    Frame frame = Frame.create(jsc, List.of(List.of("Bob", 30)), SCHEMA, true);
    FrameState before = frame.state();
    FrameTransform dropRows = state -> FrameState.empty(jsc, state.schema());
    assertSame(frame, frame.execute(dropRows));
    assertNotSame(before, frame.state());
    assertEquals(0, frame.rowCount());
    assertEquals(SCHEMA, frame.schema());
  }
}
