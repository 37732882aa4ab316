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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AutoBatchedPicklerTest {

  /** Ten bytes per row, and remembers every batch it was given. */
  private static class SizedSerializer implements BatchSerializer {
    final List<List<Object>> batches = new ArrayList<>();

    @Override
    public byte[] dumps(List<?> rows) {
      batches.add(new ArrayList<>(rows));
      return new byte[rows.size() * 10];
    }

    @Override
    public List<?> loads(byte[] batch) {
      throw new UnsupportedOperationException();
    }
  }

  private static List<Integer> range(int n) {
    return IntStream.range(0, n).boxed().collect(Collectors.toList());
  }

  private static List<Integer> batchSizes(SizedSerializer serializer) {
    return serializer.batches.stream().map(List::size).collect(Collectors.toList());
  }

  @Test
  public void growsWhileBatchesAreSmall() {
    SizedSerializer serializer = new SizedSerializer();
    AutoBatchedPickler pickler =
      new AutoBatchedPickler(range(20).iterator(), serializer, 1, 35, 100);
    assertEquals(1, pickler.batchSize());
    pickler.next();
    assertEquals(2, pickler.batchSize());
    pickler.forEachRemaining(bytes -> { });
    assertEquals(List.of(1, 2, 4, 4, 4, 4, 1), batchSizes(serializer));
  }

  @Test
  public void shrinksWhileBatchesAreLarge() {
    SizedSerializer serializer = new SizedSerializer();
    AutoBatchedPickler pickler =
      new AutoBatchedPickler(range(20).iterator(), serializer, 8, 10, 25);
    pickler.forEachRemaining(bytes -> { });
    assertEquals(List.of(8, 4, 2, 2, 2, 2), batchSizes(serializer));
  }

  @Test
  public void neverShrinksBelowOneRow() {
    SizedSerializer serializer = new SizedSerializer();
    AutoBatchedPickler pickler =
      new AutoBatchedPickler(range(3).iterator(), serializer, 1, 1, 5);
    pickler.forEachRemaining(bytes -> { });
    assertEquals(List.of(1, 1, 1), batchSizes(serializer));
  }

  @Test
  public void rowsKeepTheirOrder() throws IOException {
    List<Integer> rows = range(100);
    AutoBatchedPickler pickler = new AutoBatchedPickler(
      rows.iterator(), PickleBatchSerializer.INSTANCE, 1, 64, 1024);
    List<Object> read = new ArrayList<>();
    int batches = 0;
    while (pickler.hasNext()) {
      read.addAll(PickleBatchSerializer.INSTANCE.loads(pickler.next()));
      batches++;
    }
    assertEquals(rows, read);
    assertTrue(batches < 100);
  }

  @Test
  public void emptyPartition() {
    AutoBatchedPickler pickler = new AutoBatchedPickler(
      List.of().iterator(), PickleBatchSerializer.INSTANCE, 1, 1, 10);
    assertFalse(pickler.hasNext());
  }

  @Test
  public void serializationFailures() {
    BatchSerializer failing = new BatchSerializer() {
      @Override
      public byte[] dumps(List<?> rows) throws IOException {
        throw new IOException("unpicklable");
      }

      @Override
      public List<?> loads(byte[] batch) {
        throw new UnsupportedOperationException();
      }
    };
    AutoBatchedPickler pickler = new AutoBatchedPickler(range(1).iterator(), failing, 1, 1, 10);
    UncheckedIOException e = assertThrows(UncheckedIOException.class, pickler::next);
    assertEquals("unpicklable", e.getCause().getMessage());
  }

  @Test
  public void invalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new AutoBatchedPickler(
      range(1).iterator(), PickleBatchSerializer.INSTANCE, 0, 1, 10));
    assertThrows(IllegalArgumentException.class, () -> new AutoBatchedPickler(
      range(1).iterator(), PickleBatchSerializer.INSTANCE, 1, 10, 1));
  }
}
