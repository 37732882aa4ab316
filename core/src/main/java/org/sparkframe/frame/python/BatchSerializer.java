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

package org.sparkframe.frame.python;

import java.io.IOException;
import java.io.Serializable;
import java.util.List;

import org.sparkframe.annotation.Evolving;

/**
 * Wire format of one batch of untyped rows exchanged with the Python runtime. Element order
 * within a row and row order within a batch must survive a dumps/loads round trip.
 */
@Evolving
public interface BatchSerializer extends Serializable {

  byte[] dumps(List<?> rows) throws IOException;

  /**
   * Reads one batch back. Each element is one row, a list or an array of values.
   *
   * @throws IOException if the bytes are not a well-formed batch
   */
  List<?> loads(byte[] batch) throws IOException;
}
