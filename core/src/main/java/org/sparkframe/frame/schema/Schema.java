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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import org.sparkframe.frame.errors.FrameErrors;

/**
 * Ordered, immutable list of uniquely named columns. Column positions bind to row values:
 * the value at index i of a row belongs to {@code column(i)}.
 * <p>
 * Schemas are shared read-only between concurrently running partition tasks.
 */
public final class Schema implements Serializable, Iterable<Column> {

  private final List<Column> columns;
  private final Map<String, Integer> indexByName;

  public Schema(List<Column> columns) {
    Preconditions.checkNotNull(columns, "columns");
    this.columns = List.copyOf(columns);
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < this.columns.size(); i++) {
      String name = this.columns.get(i).name();
      if (index.putIfAbsent(name, i) != null) {
        throw FrameErrors.duplicateColumnName(name, namesOf(this.columns.subList(0, i)));
      }
    }
    this.indexByName = Collections.unmodifiableMap(index);
  }

  public static Schema of(Column... columns) {
    return new Schema(Arrays.asList(columns));
  }

  public int size() {
    return columns.size();
  }

  public List<Column> columns() {
    return columns;
  }

  public List<String> columnNames() {
    return namesOf(columns);
  }

  public List<DataType> columnDataTypes() {
    List<DataType> types = new ArrayList<>(columns.size());
    columns.forEach(c -> types.add(c.dataType()));
    return types;
  }

  public Column column(int index) {
    if (index < 0 || index >= columns.size()) {
      throw FrameErrors.columnIndexOutOfRange(index, columns.size());
    }
    return columns.get(index);
  }

  public Column column(String name) {
    return columns.get(columnIndex(name));
  }

  public boolean hasColumn(String name) {
    return indexByName.containsKey(name);
  }

  public int columnIndex(String name) {
    Integer index = indexByName.get(name);
    if (index == null) {
      throw FrameErrors.columnNotFound(name, columnNames());
    }
    return index;
  }

  /** Returns a new schema with the column appended. */
  public Schema addColumn(String name, DataType dataType) {
    if (hasColumn(name)) {
      throw FrameErrors.duplicateColumnName(name, columnNames());
    }
    List<Column> added = new ArrayList<>(columns);
    added.add(Column.of(name, dataType));
    return new Schema(added);
  }

  /**
   * Returns a new schema where {@code oldName} is called {@code newName}. The position and type
   * of the column are unchanged. Renaming a column to its current name returns this schema.
   */
  public Schema renameColumn(String oldName, String newName) {
    int index = columnIndex(oldName);
    if (oldName.equals(newName)) {
      return this;
    }
    if (hasColumn(newName)) {
      throw FrameErrors.duplicateColumnName(newName, columnNames());
    }
    List<Column> renamed = new ArrayList<>(columns);
    renamed.set(index, columns.get(index).withName(newName));
    return new Schema(renamed);
  }

  @Override
  public Iterator<Column> iterator() {
    return columns.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Schema && ((Schema) o).columns.equals(columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "Schema" + columns;
  }

  private static List<String> namesOf(List<Column> columns) {
    List<String> names = new ArrayList<>(columns.size());
    columns.forEach(c -> names.add(c.name()));
    return Collections.unmodifiableList(names);
  }
}
