package com.edareport.analyzer.service.data_processing;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.table.ColumnType;
import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.dto.table.DataTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns loosely typed cells (CSV strings, JSON scalars) into typed {@link DataColumn}s.
 *
 * <p>A column's type is inferred from its non-missing cells: all integers gives {@code INTEGER},
 * all numbers {@code DECIMAL}, all {@code true}/{@code false} {@code BOOLEAN}, all ISO-8601 dates
 * {@code DATETIME}, anything else {@code TEXT}. A column with no present cell is {@code DECIMAL}.
 * An explicitly declared type always wins over inference.
 */
@Slf4j
@Service
public class ColumnTypeInferenceService {

  static final Set<String> MISSING_MARKERS =
      Set.of("", "NA", "N/A", "n/a", "NaN", "nan", "null", "NULL", "None");

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL_PATTERN =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(inf|Infinity)");

  public DataTable buildTable(
      String tableName,
      List<String> columns,
      List<Map<String, Object>> rows,
      Map<String, String> columnTypes) {
    Map<String, ColumnType> declared = parseDeclaredTypes(columns, columnTypes);

    Set<String> seen = new HashSet<>();
    List<DataColumn> dataColumns = new ArrayList<>(columns.size());
    for (String column : columns) {
      if (column == null || !seen.add(column)) {
        throw new IllegalArgumentException("Column names must be non-null and unique: " + column);
      }
      List<Object> cells = new ArrayList<>(rows.size());
      for (Map<String, Object> row : rows) {
        cells.add(row != null ? row.get(column) : null);
      }
      dataColumns.add(toColumn(column, cells, declared.get(column)));
    }
    return new DataTable(tableName, dataColumns);
  }

  /**
   * Builds a typed column from raw cells.
   *
   * @param declaredType the caller's type, or {@code null} to infer one
   * @throws IllegalArgumentException if a present cell cannot be read as the column's type
   */
  public DataColumn toColumn(String name, List<?> cells, ColumnType declaredType) {
    ColumnType type = declaredType != null ? declaredType : inferType(cells);
    List<Object> typed = new ArrayList<>(cells.size());
    for (Object cell : cells) {
      typed.add(isMissing(cell) ? null : convert(name, cell, type));
    }
    log.debug(
        "Column '{}' read as {} ({})", name, type, declaredType != null ? "declared" : "inferred");
    return new DataColumn(name, type, typed);
  }

  public ColumnType inferType(List<?> cells) {
    boolean anyPresent = false;
    boolean allIntegers = true;
    boolean allNumbers = true;
    boolean allBooleans = true;
    boolean allDates = true;

    for (Object cell : cells) {
      if (isMissing(cell)) {
        continue;
      }
      anyPresent = true;
      allIntegers = allIntegers && isInteger(cell);
      allNumbers = allNumbers && isNumber(cell);
      allBooleans = allBooleans && isBoolean(cell);
      allDates = allDates && isDate(cell);
      if (!allIntegers && !allNumbers && !allBooleans && !allDates) {
        return ColumnType.TEXT;
      }
    }

    if (!anyPresent || (allNumbers && !allIntegers)) {
      return ColumnType.DECIMAL;
    }
    if (allIntegers) {
      return ColumnType.INTEGER;
    }
    if (allBooleans) {
      return ColumnType.BOOLEAN;
    }
    return allDates ? ColumnType.DATETIME : ColumnType.TEXT;
  }

  public static boolean isMissing(Object cell) {
    if (cell instanceof String) {
      return MISSING_MARKERS.contains(((String) cell).trim());
    }
    return DataColumn.isMissingValue(cell);
  }

  private Map<String, ColumnType> parseDeclaredTypes(
      List<String> columns, Map<String, String> columnTypes) {
    Map<String, ColumnType> declared = new LinkedHashMap<>();
    if (columnTypes == null) {
      return declared;
    }
    for (Map.Entry<String, String> entry : columnTypes.entrySet()) {
      if (!columns.contains(entry.getKey())) {
        throw new IllegalArgumentException(
            "column_types names an unknown column: " + entry.getKey());
      }
      declared.put(entry.getKey(), ColumnType.fromName(entry.getValue()));
    }
    return declared;
  }

  private Object convert(String column, Object cell, ColumnType type) {
    switch (type) {
      case INTEGER:
        if (cell instanceof Number) {
          return cell;
        }
        if (isInteger(cell)) {
          return Long.parseLong(stripPlus(cell.toString().trim()));
        }
        throw invalidCell(column, cell, type);
      case DECIMAL:
        if (cell instanceof Number) {
          return cell;
        }
        if (isNumber(cell)) {
          return parseDecimal(cell.toString().trim());
        }
        throw invalidCell(column, cell, type);
      case BOOLEAN:
        if (cell instanceof Boolean) {
          return cell;
        }
        if (isBoolean(cell)) {
          return Boolean.parseBoolean(cell.toString().trim());
        }
        throw invalidCell(column, cell, type);
      default:
        return cell;
    }
  }

  private boolean isInteger(Object cell) {
    if (cell instanceof Byte
        || cell instanceof Short
        || cell instanceof Integer
        || cell instanceof Long) {
      return true;
    }
    if (!(cell instanceof String)) {
      return false;
    }
    String text = ((String) cell).trim();
    // 19 digits is the longest that can fit a long; longer values stay decimal
    return INTEGER_PATTERN.matcher(text).matches() && text.replaceAll("[+-]", "").length() < 19;
  }

  private boolean isNumber(Object cell) {
    if (cell instanceof Number) {
      return true;
    }
    return cell instanceof String && DECIMAL_PATTERN.matcher(((String) cell).trim()).matches();
  }

  private boolean isBoolean(Object cell) {
    if (cell instanceof Boolean) {
      return true;
    }
    if (!(cell instanceof String)) {
      return false;
    }
    String text = ((String) cell).trim();
    return "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text);
  }

  private boolean isDate(Object cell) {
    if (!(cell instanceof String)) {
      return false;
    }
    String text = ((String) cell).trim();
    try {
      if (text.length() <= 10) {
        LocalDate.parse(text);
      } else if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
        OffsetDateTime.parse(text);
      } else {
        LocalDateTime.parse(text);
      }
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  private static double parseDecimal(String text) {
    String unsigned = stripPlus(text);
    if (unsigned.equals("inf") || unsigned.equals("Infinity")) {
      return Double.POSITIVE_INFINITY;
    }
    if (unsigned.equals("-inf") || unsigned.equals("-Infinity")) {
      return Double.NEGATIVE_INFINITY;
    }
    return Double.parseDouble(unsigned);
  }

  private static String stripPlus(String text) {
    return text.startsWith("+") ? text.substring(1) : text;
  }

  private IllegalArgumentException invalidCell(String column, Object cell, ColumnType type) {
    return new IllegalArgumentException(
        String.format(
            "Value '%s' in column '%s' is not a valid %s", cell, column, type.toValue()));
  }
}
