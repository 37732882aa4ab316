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

package org.sparkframe.config;

import java.io.Serializable;

import org.apache.spark.SparkConf;
import org.apache.spark.network.util.ConfigProvider;
import org.apache.spark.network.util.JavaUtils;
import org.apache.spark.network.util.MapConfigProvider;

import org.sparkframe.frame.errors.FrameErrors;
import org.sparkframe.frame.row.ConversionPolicy;

/**
 * Settings of the frame layer, read once from a {@link ConfigProvider} and validated.
 * Instances are immutable and travel with the closures shipped to executors.
 */
public class FrameConf implements Serializable {

  public static final String BATCH_INITIAL_SIZE = "spark.frame.codec.batch.initialSize";
  public static final String BATCH_MIN_BYTES = "spark.frame.codec.batch.minBytes";
  public static final String BATCH_MAX_BYTES = "spark.frame.codec.batch.maxBytes";
  public static final String CONVERSION_POLICY = "spark.frame.conversion.policy";
  public static final String INFERENCE_SAMPLE_SIZE = "spark.frame.schema.inference.sampleSize";

  private final int initialBatchSize;
  private final long minBatchBytes;
  private final long maxBatchBytes;
  private final ConversionPolicy conversionPolicy;
  private final int inferenceSampleSize;

  public FrameConf(ConfigProvider conf) {
    this.initialBatchSize = positiveInt(conf, BATCH_INITIAL_SIZE, "1");
    this.minBatchBytes = bytes(conf, BATCH_MIN_BYTES, "1m");
    this.maxBatchBytes = bytes(conf, BATCH_MAX_BYTES, "10m");
    if (minBatchBytes > maxBatchBytes) {
      throw FrameErrors.invalidConfig(BATCH_MIN_BYTES, Long.toString(minBatchBytes),
        "must not exceed " + BATCH_MAX_BYTES + " (" + maxBatchBytes + " bytes)");
    }
    this.conversionPolicy = policy(conf.get(CONVERSION_POLICY, "LENIENT"));
    this.inferenceSampleSize = positiveInt(conf, INFERENCE_SAMPLE_SIZE, "100");
  }

  public static FrameConf defaults() {
    return new FrameConf(MapConfigProvider.EMPTY);
  }

  public static FrameConf fromSparkConf(SparkConf conf) {
    return new FrameConf(new SparkConfigProvider(conf));
  }

  /** Number of rows in the first batch of every partition. */
  public int initialBatchSize() {
    return initialBatchSize;
  }

  /** Batches serialized below this size double the batch size. */
  public long minBatchBytes() {
    return minBatchBytes;
  }

  /** Batches serialized above this size halve the batch size. */
  public long maxBatchBytes() {
    return maxBatchBytes;
  }

  public ConversionPolicy conversionPolicy() {
    return conversionPolicy;
  }

  public int inferenceSampleSize() {
    return inferenceSampleSize;
  }

  private static int positiveInt(ConfigProvider conf, String key, String defaultValue) {
    String value = conf.get(key, defaultValue);
    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw FrameErrors.invalidConfig(key, value, "not an integer");
    }
    if (parsed <= 0) {
      throw FrameErrors.invalidConfig(key, value, "must be positive");
    }
    return parsed;
  }

  private static long bytes(ConfigProvider conf, String key, String defaultValue) {
    String value = conf.get(key, defaultValue);
    long parsed;
    try {
      parsed = JavaUtils.byteStringAsBytes(value);
    } catch (NumberFormatException e) {
      throw FrameErrors.invalidConfig(key, value, "not a byte size such as 512k or 10m");
    }
    if (parsed <= 0) {
      throw FrameErrors.invalidConfig(key, value, "must be positive");
    }
    return parsed;
  }

  private static ConversionPolicy policy(String value) {
    for (ConversionPolicy p : ConversionPolicy.values()) {
      if (p.name().equalsIgnoreCase(value.trim())) {
        return p;
      }
    }
    throw FrameErrors.invalidConfig(CONVERSION_POLICY, value,
      "expected one of LENIENT, STRICT");
  }
}
