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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;

import org.sparkframe.internal.Logger;
import org.sparkframe.internal.LoggerFactory;

/**
 * Serializes the rows of one partition into batches whose size adapts to the serialized row
 * size: the batch doubles while serialized batches stay under {@code minBytes} and halves while
 * they exceed {@code maxBytes}. Batch boundaries carry no meaning for the reader.
 */
public class AutoBatchedPickler implements Iterator<byte[]> {

  private static final Logger logger = LoggerFactory.getLogger(AutoBatchedPickler.class);

  // keeps doubling from overflowing
  private static final int MAX_BATCH_SIZE = 1 << 30;

  private final Iterator<?> rows;
  private final BatchSerializer serializer;
  private final long minBytes;
  private final long maxBytes;
  private final List<Object> buffer = new ArrayList<>();
  private int batch;

  public AutoBatchedPickler(
      Iterator<?> rows,
      BatchSerializer serializer,
      int initialBatchSize,
      long minBytes,
      long maxBytes) {
    Preconditions.checkArgument(initialBatchSize > 0, "initialBatchSize must be positive");
    Preconditions.checkArgument(minBytes <= maxBytes,
      "minBytes (%s) must not exceed maxBytes (%s)", minBytes, maxBytes);
    this.rows = rows;
    this.serializer = serializer;
    this.batch = initialBatchSize;
    this.minBytes = minBytes;
    this.maxBytes = maxBytes;
  }

  @Override
  public boolean hasNext() {
    return rows.hasNext();
  }

  @Override
  public byte[] next() {
    if (!rows.hasNext()) {
      throw new NoSuchElementException();
    }
    while (rows.hasNext() && buffer.size() < batch) {
      buffer.add(rows.next());
    }
    byte[] bytes;
    try {
      bytes = serializer.dumps(buffer);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize a batch of " + buffer.size() + " rows", e);
    }
    int rowsInBatch = buffer.size();
    buffer.clear();
    if (bytes.length < minBytes && batch < MAX_BATCH_SIZE) {
      batch *= 2;
    } else if (bytes.length > maxBytes && batch > 1) {
      batch /= 2;
    }
    logger.trace("Serialized {} rows into {} bytes, next batch size {}",
      rowsInBatch, bytes.length, batch);
    return bytes;
  }

  /** Number of rows the next batch will hold at most. */
  int batchSize() {
    return batch;
  }
}
