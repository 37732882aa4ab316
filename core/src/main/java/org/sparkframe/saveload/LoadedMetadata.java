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

package org.sparkframe.saveload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import org.sparkframe.frame.schema.Schema;

/**
 * What {@link SaveLoad#load} read back.
 *
 * @param schema the saved schema, or null if none was saved
 */
public record LoadedMetadata(String formatId, int formatVersion, Schema schema, JsonNode data) {

  /** Binds the saved data to a Java type with the same mapper used for saving. */
  public <T> T dataAs(Class<T> type) {
    try {
      return SaveLoad.MAPPER.treeToValue(data, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot read " + formatId + " metadata as " +
        type.getName(), e);
    }
  }
}
