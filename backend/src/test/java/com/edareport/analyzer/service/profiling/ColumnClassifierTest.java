package com.edareport.analyzer.service.profiling;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.edareport.analyzer.dto.profile.ColumnClass;
import com.edareport.analyzer.dto.table.ColumnType;
import com.edareport.analyzer.dto.table.DataColumn;

class ColumnClassifierTest {

  private final ColumnClassifier classifier = new ColumnClassifier();

  @ParameterizedTest
  @CsvSource({
    "INTEGER, NUMERIC",
    "DECIMAL, NUMERIC",
    "TEXT, CATEGORICAL",
    "CATEGORY, CATEGORICAL",
    "BOOLEAN, CATEGORICAL",
    "DATETIME, UNSUPPORTED",
    "OBJECT, UNSUPPORTED"
  })
  void shouldClassifyByDeclaredType(ColumnType type, ColumnClass expected) {
    assertThat(classifier.classify(type)).isEqualTo(expected);
  }

  @Test
  void shouldClassifyColumnWithoutValues() {
    DataColumn allMissing = DataColumn.of("empty", ColumnType.DECIMAL, null, null);

    assertThat(classifier.classify(allMissing)).isEqualTo(ColumnClass.NUMERIC);
  }
}
