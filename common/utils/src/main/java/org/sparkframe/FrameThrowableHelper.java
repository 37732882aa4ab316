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

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

import org.sparkframe.annotation.Private;

/**
 * Renders error messages from the condition definitions in
 * {@code error/error-conditions.json}. A definition looks like
 * <pre>
 *   "COLUMN_NOT_FOUND" : {
 *     "message" : [ "Column <columnName> does not exist." ],
 *     "scope" : "CALLER"
 *   }
 * </pre>
 * and placeholders in angle brackets are replaced by the message parameters.
 */
@Private
public final class FrameThrowableHelper {

  static final String ERROR_CONDITIONS_RESOURCE = "error/error-conditions.json";

  private static final Pattern PARAMETER = Pattern.compile("<([a-zA-Z0-9_-]+)>");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private FrameThrowableHelper() {}

  public record ErrorInfo(List<String> message, String scope) {
    String messageTemplate() {
      return String.join("\n", message);
    }
  }

  // Lazy initialization holder class idiom for thread-safe lazy loading of the definitions
  private static class ConditionsHolder {
    static final Map<String, ErrorInfo> CONDITIONS = loadConditions(
        FrameThrowableHelper.class.getClassLoader().getResource(ERROR_CONDITIONS_RESOURCE));
  }

  public static boolean isDefined(String condition) {
    return ConditionsHolder.CONDITIONS.containsKey(condition);
  }

  public static String getScope(String condition) {
    return errorInfo(condition).scope();
  }

  /**
   * Returns "[CONDITION] rendered message". Every placeholder of the template must have a
   * parameter.
   */
  public static String getMessage(String condition, Map<String, String> parameters) {
    String template = errorInfo(condition).messageTemplate();
    Matcher matcher = PARAMETER.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      Preconditions.checkArgument(parameters.containsKey(name),
        "Missing parameter %s for error condition %s.", name, condition);
      matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(parameters.get(name))));
    }
    matcher.appendTail(sb);
    return "[" + condition + "] " + sb;
  }

  private static ErrorInfo errorInfo(String condition) {
    ErrorInfo info = ConditionsHolder.CONDITIONS.get(condition);
    Preconditions.checkArgument(info != null, "Undefined error condition %s.", condition);
    return info;
  }

  static Map<String, ErrorInfo> loadConditions(URL resource) {
    if (resource == null) {
      throw new AssertionError("Error conditions not found on classpath: " +
        ERROR_CONDITIONS_RESOURCE);
    }
    try (InputStream in = resource.openStream()) {
      Map<String, ErrorInfo> conditions =
        MAPPER.readValue(in, new TypeReference<Map<String, ErrorInfo>>() {});
      return Collections.unmodifiableMap(conditions);
    } catch (IOException e) {
      throw new AssertionError("Failed to load error conditions from " + resource, e);
    }
  }
}
