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

import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.util.LongAccumulator;

import org.sparkframe.internal.LogKeys;
import org.sparkframe.internal.Logger;
import org.sparkframe.internal.LoggerFactory;
import org.sparkframe.internal.MDC;

/**
 * Counters for a conversion, backed by Spark accumulators so that tasks on every executor
 * contribute to one driver-side {@link ConversionReport}.
 * <p>
 * Accumulator updates made inside transformations are only reliable once an action has
 * completed, and can be counted twice when a stage is recomputed.
 */
public final class ConversionMetrics implements Serializable {

  private static final Logger logger = LoggerFactory.getLogger(ConversionMetrics.class);

  private final String name;
  private final LongAccumulator convertedRows;
  private final LongAccumulator droppedRows;
  private final LongAccumulator nulledCells;

  private ConversionMetrics(
      String name,
      LongAccumulator convertedRows,
      LongAccumulator droppedRows,
      LongAccumulator nulledCells) {
    this.name = name;
    this.convertedRows = convertedRows;
    this.droppedRows = droppedRows;
    this.nulledCells = nulledCells;
  }

  /** Registers a fresh set of accumulators named after {@code name}. */
  public static ConversionMetrics register(JavaSparkContext sc, String name) {
    return new ConversionMetrics(name,
      sc.sc().longAccumulator(name + ".convertedRows"),
      sc.sc().longAccumulator(name + ".droppedRows"),
      sc.sc().longAccumulator(name + ".nulledCells"));
  }

  void rowConverted() {
    convertedRows.add(1L);
  }

  void rowDropped() {
    droppedRows.add(1L);
  }

  void cellNulled() {
    nulledCells.add(1L);
  }

  public String name() {
    return name;
  }

  /** Snapshot of the counters; call on the driver after an action. */
  public ConversionReport report() {
    return new ConversionReport(convertedRows.value(), droppedRows.value(), nulledCells.value());
  }

  /** Logs the report, at WARN when anything was dropped or nulled, and returns it. */
  public ConversionReport logReport() {
    ConversionReport report = report();
    if (report.isClean()) {
      logger.info("Conversion {} finished: {} rows converted",
        MDC.of(LogKeys.TRANSFORM, name),
        MDC.of(LogKeys.NUM_ROWS, report.convertedRows()));
    } else {
      logger.warn("Conversion {} finished: {} rows converted, {} rows dropped, {} cells nulled",
        MDC.of(LogKeys.TRANSFORM, name),
        MDC.of(LogKeys.NUM_ROWS, report.convertedRows()),
        MDC.of(LogKeys.DROPPED_ROWS, report.droppedRows()),
        MDC.of(LogKeys.NULLED_CELLS, report.nulledCells()));
    }
    return report;
  }
}
