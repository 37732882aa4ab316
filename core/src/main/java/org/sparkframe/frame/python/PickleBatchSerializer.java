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
import java.util.Arrays;
import java.util.List;

import net.razorvine.pickle.Pickler;
import net.razorvine.pickle.Unpickler;

/**
 * Batches in the Python pickle protocol, the format PySpark's batched serializer reads and
 * writes: one pickled list of rows per batch. Java lists pickle as Python lists and Python
 * tuples unpickle as {@code Object[]}.
 */
public class PickleBatchSerializer implements BatchSerializer {

  public static final PickleBatchSerializer INSTANCE = new PickleBatchSerializer();

  @Override
  public byte[] dumps(List<?> rows) throws IOException {
    // Picklers are not thread-safe and cheap next to a batch, so one per call
    Pickler pickler = new Pickler(true, false);
    return pickler.dumps(rows);
  }

  @Override
  public List<?> loads(byte[] batch) throws IOException {
    Object obj;
    try {
      obj = new Unpickler().loads(batch);
    } catch (RuntimeException e) {
      // the unpickler reports malformed opcodes and arguments with assorted runtime exceptions
      throw new IOException("Malformed pickle data: " + e, e);
    }
    if (obj instanceof Object[]) {
      return Arrays.asList((Object[]) obj);
    } else if (obj instanceof List) {
      return (List<?>) obj;
    }
    throw new IOException("Expected a pickled batch of rows but found " +
      (obj == null ? "None" : obj.getClass().getName()));
  }
}
