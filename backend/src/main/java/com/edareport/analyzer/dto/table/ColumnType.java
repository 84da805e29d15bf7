package com.edareport.analyzer.dto.table;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Declared element type of a {@link DataColumn}. */
public enum ColumnType {
  INTEGER,
  DECIMAL,
  BOOLEAN,
  TEXT,
  CATEGORY,
  DATETIME,
  OBJECT;

  @JsonCreator
  public static ColumnType fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Column type must not be blank");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    switch (normalized) {
      case "INT":
      case "LONG":
        return INTEGER;
      case "FLOAT":
      case "DOUBLE":
      case "NUMBER":
        return DECIMAL;
      case "BOOL":
        return BOOLEAN;
      case "STRING":
        return TEXT;
      default:
        try {
          return ColumnType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Unknown column type: " + name, e);
        }
    }
  }

  @JsonValue
  public String toValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
