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

package org.sparkframe.internal;

/**
 * Process-wide switch for structured logging. When enabled, {@link Logger} publishes the
 * {@link MDC} key/value pairs of each call to the Log4j 2 thread context so that a JSON layout
 * can emit them as fields.
 * <p>
 * The initial state comes from the system property
 * {@code sparkframe.log.structuredLogging.enabled}.
 */
public final class StructuredLogging {

  public static final String ENABLED_PROPERTY = "sparkframe.log.structuredLogging.enabled";

  private static volatile boolean enabled = Boolean.getBoolean(ENABLED_PROPERTY);

  private StructuredLogging() {}

  public static boolean isEnabled() {
    return enabled;
  }

  public static void enable() {
    enabled = true;
  }

  public static void disable() {
    enabled = false;
  }
}
