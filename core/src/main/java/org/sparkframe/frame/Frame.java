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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;

import org.sparkframe.config.FrameConf;
import org.sparkframe.frame.errors.FrameErrors;
import org.sparkframe.frame.ops.RenameColumns;
import org.sparkframe.frame.python.PythonRowCodec;
import org.sparkframe.frame.row.ConversionMetrics;
import org.sparkframe.frame.row.ConversionReport;
import org.sparkframe.frame.row.RawRowAdapter;
import org.sparkframe.frame.row.RowConversions;
import org.sparkframe.frame.row.RowConverter;
import org.sparkframe.frame.schema.Column;
import org.sparkframe.frame.schema.Schema;
import org.sparkframe.frame.schema.SchemaInference;
import org.sparkframe.internal.LogKeys;
import org.sparkframe.internal.Logger;
import org.sparkframe.internal.LoggerFactory;
import org.sparkframe.internal.MDC;

/**
 * A distributed table: a {@link Schema} plus an RDD of rows. A frame is a mutable handle over
 * immutable {@link FrameState}s; every {@link FrameTransform} executed on it swaps in the state
 * the transform returns.
 */
public class Frame {

  private static final Logger logger = LoggerFactory.getLogger(Frame.class);

  private FrameState state;

  public Frame(FrameState state) {
    this.state = Preconditions.checkNotNull(state, "state");
  }

  public Frame(JavaRDD<Row> rdd, Schema schema) {
    this(new FrameState(schema, rdd));
  }

  /**
   * Creates a frame from driver-local rows (lists or arrays).
   * <p>
   * With {@code validateSchema} every value is parsed to its column type and values that
   * cannot be parsed become null; rows of the wrong length are dropped. Without it values are
   * taken as they are and every row must have one value per column.
   */
  public static Frame create(
      JavaSparkContext sc,
      List<?> data,
      Schema schema,
      boolean validateSchema) {
    Preconditions.checkNotNull(data, "data");
    Preconditions.checkNotNull(schema, "schema");
    List<Object[]> rows = new ArrayList<>(data.size());
    for (Object raw : data) {
      Object[] values = RawRowAdapter.toArray(raw);
      if (!validateSchema && values.length != schema.size()) {
        throw FrameErrors.schemaMismatch(values.length, schema.size());
      }
      rows.add(values);
    }
    JavaRDD<Object[]> raw = sc.parallelize(rows);
    if (!validateSchema) {
      return new Frame(raw.map(RowFactory::create), schema);
    }
    ConversionMetrics metrics = ConversionMetrics.register(sc, "create");
    JavaRDD<Row> rdd = RowConversions.toRowRdd(raw, schema, RowConverter.LENIENT, metrics);
    return new Frame(new FrameState(schema, rdd, metrics));
  }

  /**
   * Creates a frame whose column types are inferred from the first rows of {@code data}.
   *
   * @param columnNames names of the columns, or null for C0, C1, ...
   */
  public static Frame create(
      JavaSparkContext sc,
      List<?> data,
      List<String> columnNames,
      boolean validateSchema,
      FrameConf conf) {
    Schema schema = SchemaInference.infer(data, columnNames, conf.inferenceSampleSize());
    logger.info("Inferred schema with {} columns from {} rows",
      MDC.of(LogKeys.NUM_COLUMNS, schema.size()),
      MDC.of(LogKeys.NUM_ROWS, Math.min(data.size(), conf.inferenceSampleSize())));
    return create(sc, data, schema, validateSchema);
  }

  /** Wraps batches coming from Python, see {@link PythonRowCodec#decode(JavaRDD, Schema)}. */
  public static Frame fromPython(JavaRDD<byte[]> batches, Schema schema, FrameConf conf) {
    return new Frame(new PythonRowCodec(conf).decode(batches, schema));
  }

  public JavaRDD<byte[]> toPython(FrameConf conf) {
    return new PythonRowCodec(conf).encode(state);
  }

  public FrameState state() {
    return state;
  }

  public Schema schema() {
    return state.schema();
  }

  public JavaRDD<Row> rdd() {
    return state.rdd();
  }

  public List<Column> columns() {
    return state.schema().columns();
  }

  /**
   * Logs and returns the dropped-row and nulled-cell counts of the conversion that produced
   * this frame's rows, or nothing if they were not converted. Exact only after an action has
   * run on the rows.
   */
  public Optional<ConversionReport> conversionReport() {
    return state.conversionMetrics().map(ConversionMetrics::logReport);
  }

  public long rowCount() {
    return state.rdd().count();
  }

  public List<Row> take(int n) {
    return state.rdd().take(n);
  }

  public Frame execute(FrameTransform transform) {
    logger.debug("Executing {} on {}", transform.name(), state.schema());
    state = transform.work(state);
    return this;
  }

  /** See {@link RenameColumns}. */
  public void renameColumns(Map<String, String> names) {
    execute(new RenameColumns(names));
  }
}
