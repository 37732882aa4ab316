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

package org.sparkframe.frame.schema;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

import org.sparkframe.FrameException;
import org.sparkframe.frame.errors.FrameErrors;

/**
 * The supported column types and the rules for converting raw values into them.
 * <p>
 * Canonical representations: int32 is {@link Integer}, int64 is {@link Long}, float32 is
 * {@link Float}, float64 is {@link Double}, str is {@link String}, datetime is a {@link Long}
 * holding milliseconds since the epoch (UTC) and vector(n) is an immutable {@code List<Double>}
 * of exactly n entries.
 */
public final class DataTypes {

  public static final DataType INT32 =
    new IntegralType("int32", Integer.class, 0, Integer.MIN_VALUE, Integer.MAX_VALUE);
  public static final DataType INT64 =
    new IntegralType("int64", Long.class, 1, Long.MIN_VALUE, Long.MAX_VALUE);
  public static final DataType FLOAT32 = new FractionalType("float32", Float.class, 2);
  public static final DataType FLOAT64 = new FractionalType("float64", Double.class, 3);
  public static final DataType STRING = new StringType();
  public static final DataType DATETIME = new DateTimeType();

  private static final List<DataType> SCALARS =
    List.of(INT32, INT64, FLOAT32, FLOAT64, STRING, DATETIME);

  private static final Pattern VECTOR_NAME = Pattern.compile("vector\\((\\d+)\\)");

  private DataTypes() {}

  public static DataType vector(int length) {
    Preconditions.checkArgument(length > 0, "Vector length must be positive, got %s", length);
    return new VectorType(length);
  }

  /**
   * Resolves a type from its name. Besides the canonical names, "string", "unicode", "str",
   * "int", "float" and "double" are accepted as aliases.
   */
  public static DataType fromName(String name) {
    Preconditions.checkNotNull(name, "name");
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "string":
      case "unicode":
      case "str":
        return STRING;
      case "int":
        return INT32;
      case "float":
      case "double":
        return FLOAT64;
      default:
        break;
    }
    for (DataType t : SCALARS) {
      if (t.typeName().equals(normalized)) {
        return t;
      }
    }
    Matcher m = VECTOR_NAME.matcher(normalized.replace(" ", ""));
    if (m.matches()) {
      int length;
      try {
        length = Integer.parseInt(m.group(1));
      } catch (NumberFormatException e) {
        throw unknownDataType(name);
      }
      if (length > 0) {
        return vector(length);
      }
    }
    throw unknownDataType(name);
  }

  private static FrameException unknownDataType(String name) {
    List<String> supported = new ArrayList<>();
    SCALARS.forEach(t -> supported.add(t.typeName()));
    supported.add("vector(n)");
    return FrameErrors.unknownDataType(name, supported);
  }

  /**
   * Returns the most general of two types: int32 < int64 < float32 < float64, and str for
   * anything that does not share a numeric lineage. A null argument is ignored.
   */
  public static DataType merge(DataType a, DataType b) {
    if (a == null) return b;
    if (b == null || a.equals(b)) return a;
    if (a instanceof NumericType && b instanceof NumericType) {
      return ((NumericType) a).rank >= ((NumericType) b).rank ? a : b;
    }
    return STRING;
  }

  /** The narrowest type whose canonical form can hold {@code value}; null for null. */
  public static DataType inferFrom(Object value) {
    if (value == null) {
      return null;
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return INT32;
    } else if (value instanceof Long) {
      return INT64;
    } else if (value instanceof BigInteger) {
      return ((BigInteger) value).bitLength() < 64 ? INT64 : STRING;
    } else if (value instanceof Float) {
      return FLOAT32;
    } else if (value instanceof Double || value instanceof BigDecimal) {
      return FLOAT64;
    } else if (value instanceof Calendar || value instanceof Date || value instanceof Instant) {
      return DATETIME;
    }
    List<Object> elements = elementsOf(value);
    if (elements != null && !elements.isEmpty() &&
        elements.stream().allMatch(e -> e instanceof Number)) {
      return vector(elements.size());
    }
    return STRING;
  }

  // Elements of a list or of an object or primitive array, null for anything else
  static List<Object> elementsOf(Object value) {
    if (value instanceof List) {
      return new ArrayList<>((List<?>) value);
    } else if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
      int length = Array.getLength(value);
      List<Object> elements = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        elements.add(Array.get(value, i));
      }
      return elements;
    }
    return null;
  }

  private static String describe(Object raw) {
    return raw.getClass().getSimpleName() + " '" + raw + "'";
  }

  private abstract static class NumericType extends DataType {
    private final String name;
    private final Class<?> javaClass;
    private final int rank;

    NumericType(String name, Class<?> javaClass, int rank) {
      this.name = name;
      this.javaClass = javaClass;
      this.rank = rank;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public Class<?> javaClass() {
      return javaClass;
    }

    @Override
    public boolean isNumerical() {
      return true;
    }
  }

  /** int32 and int64. Fractional numbers are truncated toward zero, like Python's int(). */
  private static final class IntegralType extends NumericType {
    private final long min;
    private final long max;

    IntegralType(String name, Class<?> javaClass, int rank, long min, long max) {
      super(name, javaClass, rank);
      this.min = min;
      this.max = max;
    }

    @Override
    public ParseOutcome parse(Object raw) {
      if (raw == null) {
        return ParseOutcome.ok(null);
      }
      long value;
      if (raw instanceof Integer || raw instanceof Long || raw instanceof Short ||
          raw instanceof Byte) {
        value = ((Number) raw).longValue();
      } else if (raw instanceof BigInteger || raw instanceof BigDecimal) {
        BigInteger big = raw instanceof BigDecimal ?
          ((BigDecimal) raw).toBigInteger() : (BigInteger) raw;
        if (big.bitLength() >= 64) {
          return ParseOutcome.failed(describe(raw) + " is out of range for " + typeName());
        }
        value = big.longValue();
      } else if (raw instanceof Double || raw instanceof Float) {
        double d = ((Number) raw).doubleValue();
        double truncated = d < 0 ? Math.ceil(d) : Math.floor(d);
        // (double) Long.MAX_VALUE rounds up to 2^63, so the upper bound must be exclusive
        if (Double.isNaN(d) || Double.isInfinite(d) ||
            truncated < min || truncated >= (double) max + 1.0) {
          return ParseOutcome.failed(describe(raw) + " is out of range for " + typeName());
        }
        value = (long) truncated;
      } else if (raw instanceof String) {
        try {
          value = Long.parseLong(((String) raw).trim());
        } catch (NumberFormatException e) {
          return ParseOutcome.failed(describe(raw) + " is not an integer");
        }
      } else {
        return ParseOutcome.failed("cannot convert " + describe(raw) + " to " + typeName());
      }
      if (value < min || value > max) {
        return ParseOutcome.failed(describe(raw) + " is out of range for " + typeName());
      }
      return ParseOutcome.ok(javaClass() == Integer.class ? (Object) (int) value : value);
    }
  }

  /** float32 and float64. */
  private static final class FractionalType extends NumericType {

    FractionalType(String name, Class<?> javaClass, int rank) {
      super(name, javaClass, rank);
    }

    @Override
    public ParseOutcome parse(Object raw) {
      if (raw == null) {
        return ParseOutcome.ok(null);
      }
      double value;
      if (raw instanceof Number) {
        value = ((Number) raw).doubleValue();
      } else if (raw instanceof String) {
        try {
          value = Double.parseDouble(((String) raw).trim());
        } catch (NumberFormatException e) {
          return ParseOutcome.failed(describe(raw) + " is not a number");
        }
      } else {
        return ParseOutcome.failed("cannot convert " + describe(raw) + " to " + typeName());
      }
      if (javaClass() == Double.class) {
        return ParseOutcome.ok(value);
      }
      float f = (float) value;
      if (Float.isInfinite(f) && !Double.isInfinite(value)) {
        return ParseOutcome.failed(describe(raw) + " is out of range for " + typeName());
      }
      return ParseOutcome.ok(f);
    }
  }

  private static final class StringType extends DataType {
    @Override
    public String typeName() {
      return "str";
    }

    @Override
    public Class<?> javaClass() {
      return String.class;
    }

    @Override
    public ParseOutcome parse(Object raw) {
      if (raw == null || raw instanceof String) {
        return ParseOutcome.ok(raw);
      } else if (raw instanceof byte[]) {
        return ParseOutcome.ok(new String((byte[]) raw, StandardCharsets.UTF_8));
      }
      return ParseOutcome.ok(raw.toString());
    }
  }

  /** Milliseconds since the epoch, UTC. Zone-less strings are read as UTC. */
  private static final class DateTimeType extends DataType {
    @Override
    public String typeName() {
      return "datetime";
    }

    @Override
    public Class<?> javaClass() {
      return Long.class;
    }

    @Override
    public ParseOutcome parse(Object raw) {
      if (raw == null) {
        return ParseOutcome.ok(null);
      } else if (raw instanceof Long) {
        return ParseOutcome.ok(raw);
      } else if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
        return ParseOutcome.ok(((Number) raw).longValue());
      } else if (raw instanceof Calendar) {
        return ParseOutcome.ok(((Calendar) raw).getTimeInMillis());
      } else if (raw instanceof Date) {
        return ParseOutcome.ok(((Date) raw).getTime());
      } else if (raw instanceof Instant) {
        return ParseOutcome.ok(((Instant) raw).toEpochMilli());
      } else if (raw instanceof String) {
        return parseText(((String) raw).trim());
      }
      return ParseOutcome.failed("cannot convert " + describe(raw) + " to " + typeName());
    }

    private ParseOutcome parseText(String text) {
      try {
        return ParseOutcome.ok(OffsetDateTime.parse(text).toInstant().toEpochMilli());
      } catch (DateTimeParseException e) {
        // fall through to zone-less forms
      }
      try {
        return ParseOutcome.ok(
          LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toEpochMilli());
      } catch (DateTimeParseException e) {
        // fall through to a plain date
      }
      try {
        return ParseOutcome.ok(
          LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli());
      } catch (DateTimeParseException e) {
        return ParseOutcome.failed("'" + text + "' is not an ISO-8601 date-time");
      }
    }
  }

  private static final class VectorType extends DataType {
    private static final Splitter ELEMENT_SPLITTER = Splitter.on(',').trimResults();

    private final int length;

    VectorType(int length) {
      this.length = length;
    }

    @Override
    public String typeName() {
      return "vector(" + length + ")";
    }

    @Override
    public Class<?> javaClass() {
      return List.class;
    }

    @Override
    public boolean isValid(Object value) {
      return value == null || (value instanceof List && ((List<?>) value).size() == length &&
        ((List<?>) value).stream().allMatch(e -> e instanceof Double));
    }

    @Override
    public ParseOutcome parse(Object raw) {
      if (raw == null) {
        return ParseOutcome.ok(null);
      }
      List<?> elements;
      if (raw instanceof String) {
        String text = ((String) raw).trim();
        if (text.startsWith("[") && text.endsWith("]")) {
          text = text.substring(1, text.length() - 1);
        }
        elements = text.isEmpty() ? List.of() : ELEMENT_SPLITTER.splitToList(text);
      } else {
        elements = elementsOf(raw);
        if (elements == null) {
          return ParseOutcome.failed("cannot convert " + describe(raw) + " to " + typeName());
        }
      }
      if (elements.size() != length) {
        return ParseOutcome.failed("expected " + length + " elements but found " +
          elements.size());
      }
      Double[] values = new Double[length];
      for (int i = 0; i < length; i++) {
        Object element = elements.get(i);
        ParseOutcome parsed = element == null ?
          ParseOutcome.failed("null element at index " + i) : FLOAT64.parse(element);
        if (!parsed.isOk()) {
          return ParseOutcome.failed("element " + i + ": " + parsed.failureReason());
        }
        values[i] = (Double) parsed.value();
      }
      return ParseOutcome.ok(List.of(values));
    }
  }
}
