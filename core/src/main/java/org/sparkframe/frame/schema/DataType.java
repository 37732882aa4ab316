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

/**
 * A column data type. The set of types is closed: instances are obtained from
 * {@link DataTypes}. Types are immutable and compared by name.
 */
public abstract class DataType implements Serializable {

  DataType() {}

  /** Name used in schemas, persisted metadata and error messages, e.g. "int32". */
  public abstract String typeName();

  /** The class of the canonical (already parsed) values of this type. */
  public abstract Class<?> javaClass();

  /**
   * Converts a raw value, either an instance of the canonical class or a value needing
   * coercion, to the canonical representation. A null raw value parses to null.
   */
  public abstract ParseOutcome parse(Object raw);

  /** True if {@code value} is null or already in canonical form for this type. */
  public boolean isValid(Object value) {
    return value == null || javaClass().isInstance(value);
  }

  public boolean isNumerical() {
    return false;
  }

  @Override
  public final boolean equals(Object o) {
    return o instanceof DataType && ((DataType) o).typeName().equals(typeName());
  }

  @Override
  public final int hashCode() {
    return typeName().hashCode();
  }

  @Override
  public String toString() {
    return typeName();
  }
}
