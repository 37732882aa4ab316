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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LoggerTest {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggerTest.class);

  private CapturingAppender appender;
  private org.apache.logging.log4j.core.Logger coreLogger;

  @BeforeEach
  public void setUp() {
    appender = new CapturingAppender();
    appender.start();
    coreLogger = (org.apache.logging.log4j.core.Logger) LogManager.getLogger(LoggerTest.class);
    coreLogger.addAppender(appender);
    coreLogger.setLevel(Level.TRACE);
  }

  @AfterEach
  public void tearDown() {
    coreLogger.removeAppender(appender);
    appender.stop();
    StructuredLogging.disable();
  }

  @Test
  public void testBasicMessage() {
    LOGGER.info("This is a log message");
    assertEquals(1, appender.events.size());
    LogEvent event = appender.events.get(0);
    assertEquals(Level.INFO, event.getLevel());
    assertEquals("This is a log message", event.getMessage().getFormattedMessage());
  }

  @Test
  public void testMdcValuesAreInlined() {
    LOGGER.warn("Dropped row of length {} in partition {}",
      MDC.of(LogKeys.ROW_LENGTH, 3), MDC.of(LogKeys.PARTITION_ID, 7));
    LogEvent event = appender.events.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertEquals("Dropped row of length 3 in partition 7",
      event.getMessage().getFormattedMessage());
    assertTrue(event.getContextData().isEmpty());
  }

  @Test
  public void testNullMdcValue() {
    LOGGER.error("Lost column {}.", MDC.of(LogKeys.COLUMN_NAME, null));
    assertEquals("Lost column null.", appender.events.get(0).getMessage().getFormattedMessage());
  }

  @Test
  public void testStructuredLoggingPublishesContext() {
    StructuredLogging.enable();
    LOGGER.info("Renamed column {} to {}",
      MDC.of(LogKeys.COLUMN_NAME, "a"), MDC.of(LogKeys.NEW_COLUMN_NAME, "b"));
    LogEvent event = appender.events.get(0);
    assertEquals("Renamed column a to b", event.getMessage().getFormattedMessage());
    assertEquals("a", event.getContextData().getValue("column_name"));
    assertEquals("b", event.getContextData().getValue("new_column_name"));
  }

  @Test
  public void testThrowableIsForwarded() {
    Throwable exception = new RuntimeException("OOM");
    LOGGER.warn("Failed batch {}", exception, MDC.of(LogKeys.BATCH_SIZE, 16));
    LOGGER.warn("Failed batch", exception);
    assertEquals(2, appender.events.size());
    assertSame(exception, appender.events.get(0).getThrown());
    assertSame(exception, appender.events.get(1).getThrown());
    assertEquals("Failed batch 16", appender.events.get(0).getMessage().getFormattedMessage());
  }

  @Test
  public void testDisabledLevelSkipsFormatting() {
    coreLogger.setLevel(Level.ERROR);
    LOGGER.info("Not logged {}", MDC.of(LogKeys.NUM_ROWS, 1));
    LOGGER.debug("Not logged either {}", 2);
    assertTrue(appender.events.isEmpty());
  }

  private static final class CapturingAppender extends AbstractAppender {
    private final List<LogEvent> events = new CopyOnWriteArrayList<>();

    CapturingAppender() {
      super("capture", null, null, true, Property.EMPTY_ARRAY);
    }

    @Override
    public void append(LogEvent event) {
      events.add(event.toImmutable());
    }
  }
}
