package com.edareport.analyzer.service.summary;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.profile.ColumnMissingCount;
import com.edareport.analyzer.dto.profile.ColumnProfile;
import com.edareport.analyzer.dto.profile.DatasetSummary;
import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.dto.table.DataTable;

/** Whole-table metadata: shape, duplicate rows and missing values. */
@Service
public class DatasetSummarizer {

  /**
   * @param profiles one profile per column in table order; their missing counts are reused
   */
  public DatasetSummary summarize(DataTable table, List<ColumnProfile> profiles) {
    DatasetSummary.DatasetSummaryBuilder builder =
        DatasetSummary.builder()
            .rowCount(table.getRowCount())
            .columnCount(table.getColumnCount())
            .duplicateRowCount(countDuplicateRows(table));

    long totalMissing = 0;
    for (ColumnProfile profile : profiles) {
      builder.missingCount(
          new ColumnMissingCount(profile.getColumnName(), profile.getMissingCount()));
      totalMissing += profile.getMissingCount();
    }
    return builder.totalMissingCount(totalMissing).build();
  }

  /**
   * Rows identical to an earlier row across all columns. Missing cells ({@code null} or {@code
   * NaN}) compare equal to each other.
   */
  long countDuplicateRows(DataTable table) {
    if (table.getColumnCount() == 0) {
      return 0;
    }
    Set<List<Object>> seen = new HashSet<>();
    long duplicates = 0;
    for (int row = 0; row < table.getRowCount(); row++) {
      List<Object> key = table.row(row);
      key.replaceAll(cell -> DataColumn.isMissingValue(cell) ? null : cell);
      if (!seen.add(key)) {
        duplicates++;
      }
    }
    return duplicates;
  }
}
