package com.edareport.analyzer.service.data_processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.edareport.analyzer.dto.table.ColumnType;
import com.edareport.analyzer.dto.table.DataTable;

class CsvParsingServiceTest {

  private CsvParsingService csvParsingService;

  @BeforeEach
  void setUp() {
    csvParsingService = new CsvParsingService(new ColumnTypeInferenceService());
  }

  @Test
  void shouldParseFixtureWithInferredTypes() throws Exception {
    try (InputStream csv = getClass().getResourceAsStream("/fixtures/people.csv")) {
      DataTable table = csvParsingService.parseCsv(csv, "people.csv");

      assertThat(table.getName()).isEqualTo("people");
      assertThat(table.getRowCount()).isEqualTo(4);
      assertThat(table.getColumnNames()).containsExactly("name", "age", "city", "score", "member");
      assertThat(table.getColumn(0).getType()).isEqualTo(ColumnType.TEXT);
      assertThat(table.getColumn(1).getType()).isEqualTo(ColumnType.INTEGER);
      assertThat(table.getColumn(3).getType()).isEqualTo(ColumnType.DECIMAL);
      assertThat(table.getColumn(4).getType()).isEqualTo(ColumnType.BOOLEAN);

      assertThat(table.getColumn(1).get(0)).isEqualTo(23L);
      assertThat(table.getColumn(1).isMissing(1)).isTrue();
      assertThat(table.getColumn(3).isMissing(3)).isTrue();
      assertThat(table.getColumn(4).get(1)).isEqualTo(false);
    }
  }

  @Test
  void shouldSkipRowsWithWrongFieldCount() throws Exception {
    DataTable table = parse("a,b\n1,2\n3\n4,5,6\n7,8", "rows.csv");

    assertThat(table.getRowCount()).isEqualTo(2);
    assertThat(table.getColumn(0).nonMissingValues()).containsExactly(1L, 7L);
  }

  @Test
  void shouldAcceptHeaderOnlyFile() throws Exception {
    DataTable table = parse("amount,label\n", "empty.csv");

    assertThat(table.getRowCount()).isZero();
    assertThat(table.getColumnCount()).isEqualTo(2);
    assertThat(table.getColumn(0).getType()).isEqualTo(ColumnType.DECIMAL);
  }

  @Test
  void shouldRejectFileWithoutHeaders() {
    assertThatThrownBy(() -> parse("", "blank.csv"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("CSV file has no headers");
  }

  @Test
  void shouldStripByteOrderMarkAndNameBlankHeaders() throws Exception {
    DataTable table = parse("\uFEFFid, ,value\n1,x,2.5", "bom.csv");

    assertThat(table.getColumnNames()).containsExactly("id", "Unnamed: 1", "value");
  }

  @Test
  void shouldExtractTableNameFromFileName() {
    assertThat(csvParsingService.extractTableName("customer_data.csv")).isEqualTo("customer_data");
    assertThat(csvParsingService.extractTableName("archive.tar.csv")).isEqualTo("archive.tar");
    assertThat(csvParsingService.extractTableName("noextension")).isEqualTo("noextension");
    assertThat(csvParsingService.extractTableName(".hidden")).isEqualTo(".hidden");
    assertThat(csvParsingService.extractTableName(null)).isEqualTo("unnamed_table");
  }

  private DataTable parse(String content, String fileName) throws Exception {
    return csvParsingService.parseCsv(
        new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), fileName);
  }
}
