package com.edareport.analyzer.fixtures;

import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.ColumnType;
import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.dto.table.DataTable;

/** Small tables shared by the pipeline tests. */
public final class TestTables {

  private TestTables() {}

  public static ReportOptions defaultOptions() {
    return ReportOptions.defaults();
  }

  /** age = [23, missing, 27, 25], city = [A, B, A, C]. */
  public static DataTable ageAndCity() {
    return DataTable.of(
        "people",
        DataColumn.of("age", ColumnType.DECIMAL, 23.0, null, 27.0, 25.0),
        DataColumn.of("city", ColumnType.TEXT, "A", "B", "A", "C"));
  }

  /** x = [1, 2, 3, 4], y = [4, 3, 2, 1]. */
  public static DataTable antiCorrelated() {
    return DataTable.of(
        "xy",
        DataColumn.of("x", ColumnType.INTEGER, 1, 2, 3, 4),
        DataColumn.of("y", ColumnType.INTEGER, 4, 3, 2, 1));
  }

  public static DataTable emptyWithColumns() {
    return DataTable.of(
        "empty",
        DataColumn.of("amount", ColumnType.DECIMAL),
        DataColumn.of("label", ColumnType.TEXT),
        DataColumn.of("created", ColumnType.DATETIME));
  }

  public static DataTable constantColumn() {
    return DataTable.of("constant", DataColumn.of("v", ColumnType.INTEGER, 5, 5, 5));
  }

  /** Mixed table touching every column class, with a duplicated row. */
  public static DataTable mixed() {
    return DataTable.of(
        "mixed",
        DataColumn.of("id", ColumnType.INTEGER, 1, 2, 3, 3, 5, 6),
        DataColumn.of("price", ColumnType.DECIMAL, 9.5, 12.0, Double.NaN, Double.NaN, 7.25, 30.0),
        DataColumn.of("size", ColumnType.CATEGORY, "S", "M", "L", "L", "M", "XL"),
        DataColumn.of("active", ColumnType.BOOLEAN, true, false, true, true, null, true),
        DataColumn.of(
            "created",
            ColumnType.DATETIME,
            "2024-01-01",
            "2024-01-02",
            "2024-01-03",
            "2024-01-03",
            "2024-01-05",
            "2024-01-06"));
  }
}
