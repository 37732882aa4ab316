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

package org.sparkframe;

import java.util.Map;

import org.sparkframe.annotation.Evolving;

/**
 * Interface mixed into the exceptions thrown by the library. Every error carries a condition
 * name registered in {@code error/error-conditions.json} plus the parameters used to render its
 * message, so callers can branch on the condition instead of parsing messages.
 */
@Evolving
public interface FrameThrowable {
  // Succinct, human-readable, unique and stable name of the error, e.g. COLUMN_NOT_FOUND
  String getCondition();

  default Map<String, String> getMessageParameters() {
    return Map.of();
  }

  // How far the failure reaches: CELL, ROW, PARTITION, CALLER or PERSISTENCE
  default String getScope() {
    return FrameThrowableHelper.getScope(getCondition());
  }
}
