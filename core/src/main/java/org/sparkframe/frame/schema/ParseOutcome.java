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
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Result of parsing one raw cell: either a canonical value (possibly null) or the reason the
 * raw value could not be converted. A failure is never represented by a null value, so callers
 * can tell a malformed cell from a missing one.
 */
public final class ParseOutcome implements Serializable {

  private static final ParseOutcome NULL = new ParseOutcome(null, null);

  private final Object value;
  private final String failure;

  private ParseOutcome(Object value, String failure) {
    this.value = value;
    this.failure = failure;
  }

  public static ParseOutcome ok(Object value) {
    return value == null ? NULL : new ParseOutcome(value, null);
  }

  public static ParseOutcome failed(String reason) {
    Preconditions.checkNotNull(reason, "reason");
    return new ParseOutcome(null, reason);
  }

  public boolean isOk() {
    return failure == null;
  }

  /** The parsed value; only meaningful when {@link #isOk()}. */
  public Object value() {
    Preconditions.checkState(isOk(), "No value, parse failed: %s", failure);
    return value;
  }

  public String failureReason() {
    Preconditions.checkState(!isOk(), "Parse succeeded");
    return failure;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ParseOutcome)) return false;
    ParseOutcome that = (ParseOutcome) o;
    return Objects.equals(value, that.value) && Objects.equals(failure, that.failure);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, failure);
  }

  @Override
  public String toString() {
    return isOk() ? "Ok(" + value + ")" : "Failed(" + failure + ")";
  }
}
