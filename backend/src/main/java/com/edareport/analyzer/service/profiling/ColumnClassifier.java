package com.edareport.analyzer.service.profiling;

import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.profile.ColumnClass;
import com.edareport.analyzer.dto.table.ColumnType;
import com.edareport.analyzer.dto.table.DataColumn;

/**
 * Decides the {@link ColumnClass} of a column from its declared type. Cell contents are not
 * inspected, so a column without any non-missing value is still classified.
 */
@Service
public class ColumnClassifier {

  public ColumnClass classify(DataColumn column) {
    return classify(column.getType());
  }

  public ColumnClass classify(ColumnType type) {
    switch (type) {
      case INTEGER:
      case DECIMAL:
        return ColumnClass.NUMERIC;
      case TEXT:
      case BOOLEAN:
      case CATEGORY:
        return ColumnClass.CATEGORICAL;
      default:
        return ColumnClass.UNSUPPORTED;
    }
  }
}
