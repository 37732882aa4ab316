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

package org.sparkframe.frame.ops;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;

import org.sparkframe.frame.FrameState;
import org.sparkframe.frame.FrameTransform;
import org.sparkframe.frame.schema.Schema;
import org.sparkframe.internal.LogKeys;
import org.sparkframe.internal.Logger;
import org.sparkframe.internal.LoggerFactory;
import org.sparkframe.internal.MDC;

/**
 * Renames columns. Pairs are applied one after the other, in the iteration order of the given
 * map, each against the schema produced by the previous pair: {@code {a->b, b->c}} renames
 * column a to c when no other column is called b, and fails with DUPLICATE_COLUMN_NAME when
 * one is. Only the schema changes; the rows are shared with the input state.
 */
public final class RenameColumns implements FrameTransform {

  private static final Logger logger = LoggerFactory.getLogger(RenameColumns.class);

  private final Map<String, String> names;

  /**
   * @param names old name to new name; use a {@link LinkedHashMap} to control the order
   */
  public RenameColumns(Map<String, String> names) {
    Preconditions.checkArgument(names != null, "names parameter is required.");
    this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
  }

  public Map<String, String> names() {
    return names;
  }

  @Override
  public FrameState work(FrameState state) {
    Schema schema = state.schema();
    for (Map.Entry<String, String> rename : names.entrySet()) {
      schema = schema.renameColumn(rename.getKey(), rename.getValue());
      logger.info("Renamed column {} to {}",
        MDC.of(LogKeys.COLUMN_NAME, rename.getKey()),
        MDC.of(LogKeys.NEW_COLUMN_NAME, rename.getValue()));
    }
    return state.withSchema(schema);
  }
}
