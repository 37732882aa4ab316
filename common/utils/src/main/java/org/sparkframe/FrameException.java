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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unchecked exception carrying an error condition. Build instances through the factory methods
 * of the module raising them rather than directly.
 */
public class FrameException extends RuntimeException implements FrameThrowable {

  private final String condition;
  private final Map<String, String> messageParameters;

  public FrameException(String condition, Map<String, String> messageParameters) {
    this(condition, messageParameters, null);
  }

  public FrameException(
      String condition,
      Map<String, String> messageParameters,
      Throwable cause) {
    super(FrameThrowableHelper.getMessage(condition, messageParameters), cause);
    this.condition = condition;
    this.messageParameters = Collections.unmodifiableMap(new LinkedHashMap<>(messageParameters));
  }

  @Override
  public String getCondition() {
    return condition;
  }

  @Override
  public Map<String, String> getMessageParameters() {
    return messageParameters;
  }
}
