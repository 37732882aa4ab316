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

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;

import org.sparkframe.frame.schema.Column;
import org.sparkframe.frame.schema.DataTypes;
import org.sparkframe.frame.schema.Schema;

/**
 * JSON form of a schema: {@code [{"name": "id", "dataType": "int64"}, ...]}.
 */
public final class SchemaJson {

  private SchemaJson() {}

  public static ArrayNode toJson(Schema schema) {
    ArrayNode columns = JsonNodeFactory.instance.arrayNode();
    for (Column column : schema) {
      ObjectNode node = columns.addObject();
      node.put("name", column.name());
      node.put("dataType", column.dataType().typeName());
    }
    return columns;
  }

  public static Schema fromJson(JsonNode json) {
    Preconditions.checkArgument(json != null && json.isArray(),
      "Expected a JSON array of columns but got %s", json);
    List<Column> columns = new ArrayList<>(json.size());
    for (JsonNode node : json) {
      JsonNode name = node.get("name");
      JsonNode dataType = node.get("dataType");
      Preconditions.checkArgument(name != null && name.isTextual() &&
          dataType != null && dataType.isTextual(),
        "Column entries need textual 'name' and 'dataType' fields: %s", node);
      columns.add(Column.of(name.asText(), DataTypes.fromName(dataType.asText())));
    }
    return new Schema(columns);
  }
}
