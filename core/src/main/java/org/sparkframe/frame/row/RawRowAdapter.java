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

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.List;

import org.apache.spark.TaskContext;

import org.sparkframe.frame.errors.FrameErrors;

/**
 * Normalizes the row shapes produced by deserializing foreign-runtime data (Python lists arrive
 * as {@link List}, tuples as {@code Object[]}, typed arrays as primitive arrays) into a fresh
 * {@code Object[]}.
 */
public final class RawRowAdapter {

  private RawRowAdapter() {}

  public static Object[] toArray(Object raw) {
    return toArray(raw, currentPartitionId());
  }

  public static Object[] toArray(Object raw, int partitionId) {
    if (raw instanceof Object[]) {
      Object[] values = (Object[]) raw;
      return Arrays.copyOf(values, values.length, Object[].class);
    } else if (raw instanceof List) {
      return ((List<?>) raw).toArray(new Object[0]);
    } else if (raw != null && raw.getClass().isArray() && !(raw instanceof byte[])) {
      int length = Array.getLength(raw);
      Object[] values = new Object[length];
      for (int i = 0; i < length; i++) {
        values[i] = Array.get(raw, i);
      }
      return values;
    }
    throw FrameErrors.unsupportedRowShape(raw, partitionId);
  }

  /** Partition of the running task, or -1 outside of a task. */
  public static int currentPartitionId() {
    TaskContext context = TaskContext.get();
    return context == null ? -1 : context.partitionId();
  }
}
