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

package org.sparkframe.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.spark.SparkConf;
import org.apache.spark.network.util.ConfigProvider;
import scala.Tuple2;

/** ConfigProvider reading from a {@link SparkConf}. */
public class SparkConfigProvider extends ConfigProvider {

  private final SparkConf conf;

  public SparkConfigProvider(SparkConf conf) {
    this.conf = conf;
  }

  @Override
  public String get(String name) {
    // SparkConf.get throws NoSuchElementException for missing keys
    return conf.get(name);
  }

  @Override
  public String get(String name, String defaultValue) {
    return conf.get(name, defaultValue);
  }

  @Override
  public Iterable<Map.Entry<String, String>> getAll() {
    List<Map.Entry<String, String>> entries = new ArrayList<>();
    for (Tuple2<String, String> kv : conf.getAll()) {
      entries.add(Map.entry(kv._1(), kv._2()));
    }
    return entries;
  }
}
