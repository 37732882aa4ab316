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

package org.sparkframe.frame.python;

import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.sql.Row;

import org.sparkframe.config.FrameConf;
import org.sparkframe.frame.FrameState;
import org.sparkframe.frame.errors.FrameErrors;
import org.sparkframe.frame.row.ConversionMetrics;
import org.sparkframe.frame.row.RawRowAdapter;
import org.sparkframe.frame.row.RowConversions;
import org.sparkframe.frame.row.RowConverter;
import org.sparkframe.frame.schema.Schema;
import org.sparkframe.internal.LogKeys;
import org.sparkframe.internal.Logger;
import org.sparkframe.internal.LoggerFactory;
import org.sparkframe.internal.MDC;

/**
 * Moves frame rows across the JVM/Python boundary as RDDs of serialized batches.
 * <p>
 * Encoding turns each canonical row into a plain list of its values and batches the rows of
 * every partition with {@link AutoBatchedPickler}. Decoding reads the batches of every
 * partition back in order, normalizes each row to an array and runs the {@link RowConverter}
 * against the target schema. Both directions are narrow per-partition transformations: the
 * number and order of partitions and the order of rows within them are preserved.
 * <p>
 * A batch that cannot be deserialized fails its partition with CORRUPT_BATCH.
 */
public class PythonRowCodec implements Serializable {

  private static final Logger logger = LoggerFactory.getLogger(PythonRowCodec.class);

  private final BatchSerializer serializer;
  private final FrameConf conf;

  public PythonRowCodec(FrameConf conf) {
    this(PickleBatchSerializer.INSTANCE, conf);
  }

  public PythonRowCodec(BatchSerializer serializer, FrameConf conf) {
    this.serializer = Preconditions.checkNotNull(serializer, "serializer");
    this.conf = Preconditions.checkNotNull(conf, "conf");
  }

  public JavaRDD<byte[]> encode(FrameState state) {
    return encode(state.rdd());
  }

  public JavaRDD<byte[]> encode(JavaRDD<Row> rdd) {
    BatchSerializer serializer = this.serializer;
    int initialBatchSize = conf.initialBatchSize();
    long minBytes = conf.minBatchBytes();
    long maxBytes = conf.maxBatchBytes();
    return rdd
      .map(PythonRowCodec::toList)
      .mapPartitions(rows ->
        new AutoBatchedPickler(rows, serializer, initialBatchSize, minBytes, maxBytes), true);
  }

  /**
   * Decodes with the configured conversion policy. The returned state carries freshly
   * registered {@link ConversionMetrics}, readable once an action has run on its rows.
   */
  public FrameState decode(JavaRDD<byte[]> batches, Schema schema) {
    ConversionMetrics metrics = ConversionMetrics.register(
      JavaSparkContext.fromSparkContext(batches.context()), "fromPython");
    return decode(batches, schema, RowConverter.forPolicy(conf.conversionPolicy()), metrics);
  }

  /**
   * @param metrics counters for nulled cells and dropped rows, or null
   */
  public FrameState decode(
      JavaRDD<byte[]> batches,
      Schema schema,
      RowConverter converter,
      ConversionMetrics metrics) {
    Preconditions.checkNotNull(schema, "schema");
    logger.info("Decoding {} partitions into {} columns with policy {}",
      MDC.of(LogKeys.NUM_PARTITIONS, batches.getNumPartitions()),
      MDC.of(LogKeys.NUM_COLUMNS, schema.size()),
      MDC.of(LogKeys.CONVERSION_POLICY, converter.policy()));
    JavaRDD<Row> rows =
      RowConversions.toRowRdd(toJavaArrayRdd(batches), schema, converter, metrics);
    return new FrameState(schema, rows, metrics);
  }

  /** Deserializes batches into raw rows, in order, without applying any schema. */
  public JavaRDD<Object[]> toJavaArrayRdd(JavaRDD<byte[]> batches) {
    BatchSerializer serializer = this.serializer;
    return batches.mapPartitions(it -> new BatchReader(it, serializer), true);
  }

  // Values are already canonical; the Python side sees them without type information
  static List<Object> toList(Row row) {
    List<Object> values = new ArrayList<>(row.size());
    for (int i = 0; i < row.size(); i++) {
      values.add(row.get(i));
    }
    return values;
  }

  /** Flattens the batches of one partition into rows. */
  static final class BatchReader extends AbstractIterator<Object[]> {
    private final Iterator<byte[]> batches;
    private final BatchSerializer serializer;
    private final int partitionId = RawRowAdapter.currentPartitionId();
    private Iterator<?> current = null;

    BatchReader(Iterator<byte[]> batches, BatchSerializer serializer) {
      this.batches = batches;
      this.serializer = serializer;
    }

    @Override
    protected Object[] computeNext() {
      while (current == null || !current.hasNext()) {
        if (!batches.hasNext()) {
          return endOfData();
        }
        byte[] batch = batches.next();
        try {
          current = serializer.loads(batch).iterator();
        } catch (IOException e) {
          logger.error("Corrupt batch of {} bytes in partition {}", e,
            MDC.of(LogKeys.BATCH_BYTES, batch.length),
            MDC.of(LogKeys.PARTITION_ID, partitionId));
          throw FrameErrors.corruptBatch(partitionId, e);
        }
      }
      return RawRowAdapter.toArray(current.next(), partitionId);
    }
  }
}
