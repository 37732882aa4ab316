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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import org.sparkframe.FrameException;

import static org.junit.jupiter.api.Assertions.*;

public class RawRowAdapterTest {

  @Test
  public void objectArraysAreCopied() {
    Object[] raw = {1, "a"};
    Object[] values = RawRowAdapter.toArray(raw);
    assertArrayEquals(raw, values);
    assertNotSame(raw, values);
  }

  @Test
  public void typedArraysBecomeObjectArrays() {
    Object[] values = RawRowAdapter.toArray(new String[] {"a", "b"});
    assertEquals(Object[].class, values.getClass());
    values[0] = 1;
    assertEquals(1, values[0]);
  }

  @Test
  public void listsAndPrimitiveArrays() {
    assertArrayEquals(new Object[] {1, null}, RawRowAdapter.toArray(Arrays.asList(1, null)));
    assertArrayEquals(new Object[] {1.5, 2.5}, RawRowAdapter.toArray(new double[] {1.5, 2.5}));
    assertArrayEquals(new Object[] {3L}, RawRowAdapter.toArray(new long[] {3L}));
    assertArrayEquals(new Object[0], RawRowAdapter.toArray(List.of()));
  }

  @Test
  public void unsupportedShapes() {
    for (Object raw : new Object[] {"abc", 5, new byte[] {1}, null}) {
      FrameException e = assertThrows(FrameException.class, () -> RawRowAdapter.toArray(raw, 3));
      assertEquals("UNSUPPORTED_ROW_SHAPE", e.getCondition());
      assertEquals("3", e.getMessageParameters().get("partitionId"));
    }
  }

  @Test
  public void noPartitionOutsideOfTasks() {
    assertEquals(-1, RawRowAdapter.currentPartitionId());
  }
}
