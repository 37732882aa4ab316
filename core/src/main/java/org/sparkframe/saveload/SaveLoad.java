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

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import org.apache.spark.api.java.JavaSparkContext;

import org.sparkframe.frame.errors.FrameErrors;
import org.sparkframe.frame.schema.Schema;
import org.sparkframe.internal.LogKeys;
import org.sparkframe.internal.Logger;
import org.sparkframe.internal.LoggerFactory;
import org.sparkframe.internal.MDC;

/**
 * Saves and loads the metadata of persisted objects (models, frames). Every artifact is tagged
 * with a format id and an integer format version. Loading checks both before anything else is
 * read, so a layout the reader does not know is rejected instead of guessed at.
 * <p>
 * The metadata is one JSON document written with Spark under {@code <path>/metadata}:
 * <pre>
 *   {"formatId": "...", "formatVersion": 1, "schema": [...], "data": {...}}
 * </pre>
 */
public final class SaveLoad {

  static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String METADATA_DIR = "metadata";

  private static final Logger logger = LoggerFactory.getLogger(SaveLoad.class);

  private SaveLoad() {}

  /**
   * @param schema schema to store alongside the data, or null
   * @param data any value Jackson can serialize
   */
  public static void save(
      JavaSparkContext sc,
      String path,
      String formatId,
      int formatVersion,
      Schema schema,
      Object data) {
    Preconditions.checkArgument(formatId != null && !formatId.isEmpty(), "formatId is required");
    Preconditions.checkArgument(formatVersion > 0, "formatVersion must be positive, got %s",
      formatVersion);
    ObjectNode root = MAPPER.createObjectNode();
    root.put("formatId", formatId);
    root.put("formatVersion", formatVersion);
    if (schema != null) {
      root.set("schema", SchemaJson.toJson(schema));
    }
    root.set("data", MAPPER.valueToTree(data));
    String json;
    try {
      json = MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize metadata of " + formatId, e);
    }
    sc.parallelize(List.of(json), 1).saveAsTextFile(metadataPath(path));
    logger.info("Saved {} version {} to {}",
      MDC.of(LogKeys.FORMAT_ID, formatId),
      MDC.of(LogKeys.FORMAT_VERSION, formatVersion),
      MDC.of(LogKeys.PATH, path));
  }

  /** Loads metadata of any format and version. */
  public static LoadedMetadata load(JavaSparkContext sc, String path) {
    return toLoadedMetadata(readMetadata(sc, path), path);
  }

  /**
   * Loads metadata and checks it was written as {@code formatId} in one of
   * {@code validVersions}; the schema and data are only parsed once the version is accepted.
   */
  public static LoadedMetadata load(
      JavaSparkContext sc,
      String path,
      String formatId,
      int... validVersions) {
    JsonNode root = readMetadata(sc, path);
    String savedId = root.path("formatId").asText(null);
    Preconditions.checkArgument(formatId.equals(savedId),
      "Metadata at %s has format %s, expected %s", path, savedId, formatId);
    JsonNode version = root.get("formatVersion");
    Preconditions.checkArgument(version != null && version.canConvertToInt(),
      "Metadata at %s has no format version", path);
    validateFormatVersion(formatId, version.intValue(), validVersions);
    return toLoadedMetadata(root, path);
  }

  public static void validateFormatVersion(String formatId, int version, int... validVersions) {
    if (Arrays.stream(validVersions).noneMatch(v -> v == version)) {
      throw FrameErrors.unsupportedFormatVersion(formatId, version, validVersions);
    }
  }

  private static LoadedMetadata toLoadedMetadata(JsonNode root, String path) {
    JsonNode formatId = root.get("formatId");
    JsonNode formatVersion = root.get("formatVersion");
    Preconditions.checkArgument(formatId != null && formatId.isTextual() &&
        formatVersion != null && formatVersion.canConvertToInt(),
      "Metadata at %s has no format id or version", path);
    JsonNode schema = root.get("schema");
    return new LoadedMetadata(formatId.asText(), formatVersion.intValue(),
      schema == null || schema.isNull() ? null : SchemaJson.fromJson(schema),
      root.get("data"));
  }

  private static JsonNode readMetadata(JavaSparkContext sc, String path) {
    List<String> lines = sc.textFile(metadataPath(path)).filter(l -> !l.isEmpty()).collect();
    Preconditions.checkArgument(lines.size() == 1,
      "Expected one metadata document at %s but found %s", path, lines.size());
    try {
      return MAPPER.readTree(lines.get(0));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed metadata at " + path, e);
    }
  }

  private static String metadataPath(String path) {
    Preconditions.checkArgument(path != null && !path.isEmpty(), "path is required");
    return path.endsWith("/") ? path + METADATA_DIR : path + "/" + METADATA_DIR;
  }
}
