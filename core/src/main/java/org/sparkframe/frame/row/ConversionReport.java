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

package org.sparkframe.frame.row;

/**
 * Dataset-level outcome of a row conversion, aggregated over all partitions.
 *
 * @param convertedRows rows emitted
 * @param droppedRows rows dropped because their length did not match the schema
 * @param nulledCells cells replaced by null because they could not be parsed
 */
public record ConversionReport(long convertedRows, long droppedRows, long nulledCells) {

  public boolean isClean() {
    return droppedRows == 0 && nulledCells == 0;
  }
}
