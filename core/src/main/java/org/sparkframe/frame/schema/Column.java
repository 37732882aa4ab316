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

import com.google.common.base.Preconditions;

/**
 * A named, typed column of a {@link Schema}.
 */
public record Column(String name, DataType dataType) implements Serializable {

  public Column {
    Preconditions.checkArgument(name != null && !name.trim().isEmpty(),
      "Column name must be a non-empty string, got '%s'", name);
    Preconditions.checkNotNull(dataType, "Data type of column %s", name);
  }

  public static Column of(String name, DataType dataType) {
    return new Column(name, dataType);
  }

  public Column withName(String newName) {
    return new Column(newName, dataType);
  }

  @Override
  public String toString() {
    return name + ":" + dataType.typeName();
  }
}
