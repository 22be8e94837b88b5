// This file is part of OpenTSDB.
// Copyright (C) 2018  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timequery.data;

import java.util.Objects;

/**
 * An immutable, tagged value. Exactly one of the backing fields is
 * meaningful depending on {@link #type()}. Booleans are stored in the long
 * slot as 1 or 0.
 * 
 * @since 3.0
 */
public final class Value implements Comparable<Value> {
  
  private final ValueType type;
  private final long long_value;
  private final double double_value;
  private final String string_value;
  
  private Value(final ValueType type, 
                final long long_value, 
                final double double_value, 
                final String string_value) {
    this.type = type;
    this.long_value = long_value;
    this.double_value = double_value;
    this.string_value = string_value;
  }
  
  public static Value ofLong(final long value) {
    return new Value(ValueType.INTEGER, value, 0, null);
  }
  
  public static Value ofDouble(final double value) {
    return new Value(ValueType.FLOAT, 0, value, null);
  }
  
  public static Value ofString(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("String value cannot be null.");
    }
    return new Value(ValueType.STRING, 0, 0, value);
  }
  
  public static Value ofBoolean(final boolean value) {
    return new Value(ValueType.BOOLEAN, value ? 1 : 0, 0, null);
  }
  
  /**
   * Converts a plain Java object into a value.
   * @param object The object, may be null.
   * @return The value or null if the object was null.
   * @throws IllegalArgumentException if the object type isn't supported.
   */
  public static Value fromObject(final Object object) {
    if (object == null) {
      return null;
    }
    if (object instanceof Value) {
      return (Value) object;
    }
    if (object instanceof Double || object instanceof Float) {
      return ofDouble(((Number) object).doubleValue());
    }
    if (object instanceof Number) {
      return ofLong(((Number) object).longValue());
    }
    if (object instanceof String) {
      return ofString((String) object);
    }
    if (object instanceof Boolean) {
      return ofBoolean((Boolean) object);
    }
    throw new IllegalArgumentException("Unsupported value class: " 
        + object.getClass());
  }
  
  /** @return The non-null type of this value. */
  public ValueType type() {
    return type;
  }
  
  public boolean isNumeric() {
    return type.isNumeric();
  }
  
  public boolean isInteger() {
    return type == ValueType.INTEGER;
  }
  
  /**
   * @return The value as a long. Floats are truncated.
   * @throws IllegalStateException if the value is a string.
   */
  public long longValue() {
    switch (type) {
    case INTEGER:
    case BOOLEAN:
      return long_value;
    case FLOAT:
      return (long) double_value;
    case STRING:
    default:
      throw new IllegalStateException("Not a numeric value: " + this);
    }
  }
  
  /**
   * @return The value as a double.
   * @throws IllegalStateException if the value is a string.
   */
  public double toDouble() {
    switch (type) {
    case INTEGER:
    case BOOLEAN:
      return (double) long_value;
    case FLOAT:
      return double_value;
    case STRING:
    default:
      throw new IllegalStateException("Not a numeric value: " + this);
    }
  }
  
  public String stringValue() {
    if (type != ValueType.STRING) {
      throw new IllegalStateException("Not a string value: " + this);
    }
    return string_value;
  }
  
  public boolean booleanValue() {
    if (type != ValueType.BOOLEAN) {
      throw new IllegalStateException("Not a boolean value: " + this);
    }
    return long_value != 0;
  }
  
  /** @return The boxed Java representation for result rows. */
  public Object toObject() {
    switch (type) {
    case FLOAT:
      return double_value;
    case INTEGER:
      return long_value;
    case STRING:
      return string_value;
    case BOOLEAN:
      return long_value != 0;
    default:
      throw new IllegalStateException("Unhandled type: " + type);
    }
  }
  
  /**
   * Orders numerics by magnitude (integers and floats compare with each 
   * other), strings lexicographically and booleans false before true. 
   * Values of different families order by type ordinal.
   */
  @Override
  public int compareTo(final Value other) {
    if (isNumeric() && other.isNumeric()) {
      if (type == ValueType.INTEGER && other.type == ValueType.INTEGER) {
        return Long.compare(long_value, other.long_value);
      }
      return Double.compare(toDouble(), other.toDouble());
    }
    if (type != other.type) {
      return Integer.compare(type.ordinal(), other.type.ordinal());
    }
    switch (type) {
    case STRING:
      return string_value.compareTo(other.string_value);
    case BOOLEAN:
      return Long.compare(long_value, other.long_value);
    default:
      throw new IllegalStateException("Unhandled type: " + type);
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Value)) {
      return false;
    }
    final Value other = (Value) o;
    return type == other.type 
        && long_value == other.long_value
        && Double.compare(double_value, other.double_value) == 0
        && Objects.equals(string_value, other.string_value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(type, long_value, double_value, string_value);
  }
  
  @Override
  public String toString() {
    return String.valueOf(toObject());
  }
}
