package com.edareport.analyzer.dto.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named, read-only sequence of cells sharing one declared {@link ColumnType}. Cells are
 * normalized on construction: integers to {@link Long}, decimals to {@link Double}, text and
 * categories to {@link String}. {@code null} and {@code NaN} cells count as missing.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "values")
public final class DataColumn {

  private final String name;
  private final ColumnType type;
  private final List<Object> values;

  public DataColumn(String name, ColumnType type, List<?> values) {
    this.name = Objects.requireNonNull(name, "Column name must not be null");
    this.type = Objects.requireNonNull(type, "Column type must not be null");
    Objects.requireNonNull(values, "Column values must not be null");

    List<Object> normalized = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      normalized.add(normalize(values.get(i), i));
    }
    this.values = Collections.unmodifiableList(normalized);
  }

  public static DataColumn of(String name, ColumnType type, Object... values) {
    List<Object> cells = new ArrayList<>(values.length);
    Collections.addAll(cells, values);
    return new DataColumn(name, type, cells);
  }

  public int size() {
    return values.size();
  }

  public Object get(int row) {
    return values.get(row);
  }

  public boolean isMissing(int row) {
    return isMissingValue(values.get(row));
  }

  public static boolean isMissingValue(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Double) {
      return ((Double) value).isNaN();
    }
    if (value instanceof Float) {
      return ((Float) value).isNaN();
    }
    return false;
  }

  public long missingCount() {
    return values.stream().filter(DataColumn::isMissingValue).count();
  }

  public List<Object> nonMissingValues() {
    List<Object> present = new ArrayList<>();
    for (Object value : values) {
      if (!isMissingValue(value)) {
        present.add(value);
      }
    }
    return present;
  }

  /** Non-missing cells as doubles, in row order. Only meaningful for numeric columns. */
  public double[] numericValues() {
    return nonMissingValues().stream().mapToDouble(v -> ((Number) v).doubleValue()).toArray();
  }

  private Object normalize(Object value, int row) {
    if (isMissingValue(value)) {
      return value instanceof Float ? Double.NaN : value;
    }
    switch (type) {
      case INTEGER:
        if (value instanceof Byte
            || value instanceof Short
            || value instanceof Integer
            || value instanceof Long) {
          return ((Number) value).longValue();
        }
        if (value instanceof Number) {
          double d = ((Number) value).doubleValue();
          // 2^63 is the first double a long cannot hold; the cast would saturate
          if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) {
            return (long) d;
          }
        }
        throw cellTypeMismatch(value, row);
      case DECIMAL:
        if (value instanceof Number) {
          return ((Number) value).doubleValue();
        }
        throw cellTypeMismatch(value, row);
      case BOOLEAN:
        if (value instanceof Boolean) {
          return value;
        }
        throw cellTypeMismatch(value, row);
      case TEXT:
      case CATEGORY:
        return value.toString();
      default:
        return value;
    }
  }

  private IllegalArgumentException cellTypeMismatch(Object value, int row) {
    return new IllegalArgumentException(
        String.format(
            "Row %d of column '%s' holds %s, which is not a valid %s value",
            row, name, value.getClass().getSimpleName(), type.toValue()));
  }
}
