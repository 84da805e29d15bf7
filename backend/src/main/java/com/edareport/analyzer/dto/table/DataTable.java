package com.edareport.analyzer.dto.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.edareport.analyzer.exception.InputShapeException;

import lombok.Getter;
import lombok.ToString;

/**
 * Ordered collection of equally long {@link DataColumn}s. Owned by the caller and read-only to the
 * report pipeline.
 */
@Getter
@ToString
public final class DataTable {

  private final String name;
  private final List<DataColumn> columns;
  private final int rowCount;

  public DataTable(String name, List<DataColumn> columns) {
    this.name = name != null && !name.isBlank() ? name : "unnamed_table";
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rowCount = validateShape(this.columns);
  }

  public static DataTable of(String name, DataColumn... columns) {
    List<DataColumn> list = new ArrayList<>(columns.length);
    Collections.addAll(list, columns);
    return new DataTable(name, list);
  }

  public int getColumnCount() {
    return columns.size();
  }

  public DataColumn getColumn(int index) {
    return columns.get(index);
  }

  public List<String> getColumnNames() {
    return columns.stream().map(DataColumn::getName).collect(Collectors.toList());
  }

  /** Cells of one row across all columns, in column order. */
  public List<Object> row(int index) {
    List<Object> cells = new ArrayList<>(columns.size());
    for (DataColumn column : columns) {
      cells.add(column.get(index));
    }
    return cells;
  }

  private static int validateShape(List<DataColumn> columns) {
    if (columns.isEmpty()) {
      return 0;
    }
    int expected = columns.get(0).size();
    for (DataColumn column : columns) {
      if (column.size() != expected) {
        throw new InputShapeException(
            String.format(
                "Column '%s' has %d rows but column '%s' has %d",
                column.getName(), column.size(), columns.get(0).getName(), expected));
      }
    }
    return expected;
  }
}
