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

import java.util.Optional;

import com.google.common.base.Preconditions;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.sql.Row;

import org.sparkframe.frame.row.ConversionMetrics;
import org.sparkframe.frame.schema.Schema;

/**
 * Immutable pairing of a schema with the rows it describes. Transforms never modify a state;
 * they return a new one.
 */
public final class FrameState {

  private final Schema schema;
  private final JavaRDD<Row> rdd;
  private final ConversionMetrics metrics;

  public FrameState(Schema schema, JavaRDD<Row> rdd) {
    this(schema, rdd, null);
  }

  /**
   * @param metrics counters of the conversion that produced {@code rdd}, or null
   */
  public FrameState(Schema schema, JavaRDD<Row> rdd, ConversionMetrics metrics) {
    this.schema = Preconditions.checkNotNull(schema, "schema");
    this.rdd = Preconditions.checkNotNull(rdd, "rdd");
    this.metrics = metrics;
  }

  /** A state with no rows, so that consumers always see the target schema. */
  public static FrameState empty(JavaSparkContext sc, Schema schema) {
    return new FrameState(schema, sc.emptyRDD());
  }

  public Schema schema() {
    return schema;
  }

  public JavaRDD<Row> rdd() {
    return rdd;
  }

  /** Counters of the conversion that produced these rows, if they came through one. */
  public Optional<ConversionMetrics> conversionMetrics() {
    return Optional.ofNullable(metrics);
  }

  /** Same rows, different column metadata. */
  public FrameState withSchema(Schema newSchema) {
    return new FrameState(newSchema, rdd, metrics);
  }

  @Override
  public String toString() {
    return "FrameState(" + schema + ", " + rdd + ")";
  }
}
