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

package org.sparkframe.frame.schema;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import org.sparkframe.frame.row.RawRowAdapter;

/**
 * Infers a schema from sample rows. Each column takes the most general type seen among its
 * non-null sample values (see {@link DataTypes#merge}); a column with only nulls is str.
 */
public final class SchemaInference {

  private SchemaInference() {}

  /**
   * @param rows raw rows, each a list or an array; only the first {@code sampleSize} are read
   * @param columnNames names for the columns, or null to generate C0, C1, ...
   * @param sampleSize how many rows to inspect
   */
  public static Schema infer(List<?> rows, List<String> columnNames, int sampleSize) {
    Preconditions.checkNotNull(rows, "rows");
    Preconditions.checkArgument(sampleSize > 0, "sampleSize must be positive, got %s",
      sampleSize);
    int sampled = Math.min(sampleSize, rows.size());
    List<DataType> types = new ArrayList<>();
    for (int r = 0; r < sampled; r++) {
      Object[] row = RawRowAdapter.toArray(rows.get(r));
      for (int i = 0; i < row.length; i++) {
        DataType seen = DataTypes.inferFrom(row[i]);
        if (i < types.size()) {
          types.set(i, DataTypes.merge(types.get(i), seen));
        } else {
          types.add(seen);
        }
      }
    }
    int width = columnNames == null ? types.size() : Math.max(types.size(), columnNames.size());
    List<Column> columns = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      String name = columnNames != null && i < columnNames.size() ? columnNames.get(i) : "C" + i;
      DataType type = i < types.size() && types.get(i) != null ? types.get(i) : DataTypes.STRING;
      columns.add(Column.of(name, type));
    }
    return new Schema(columns);
  }
}
