package com.edareport.analyzer.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.dto.table.DataTable;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Reads a CSV stream with a header row into a {@link DataTable} with inferred column types. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvParsingService {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final ColumnTypeInferenceService typeInferenceService;

  public DataTable parseCsv(InputStream csvStream, String fileName) throws IOException {
    String[] headers;
    List<List<String>> cells = new ArrayList<>();
    int skipped = 0;

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {
      headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new IllegalArgumentException("CSV file has no headers");
      }
      headers = normalizeHeaders(headers);
      for (int i = 0; i < headers.length; i++) {
        cells.add(new ArrayList<>());
      }

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length != headers.length) {
          log.debug(
              "Skipping row with incorrect column count: {} vs {}", row.length, headers.length);
          skipped++;
          continue;
        }
        for (int i = 0; i < row.length; i++) {
          cells.get(i).add(row[i]);
        }
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Malformed CSV: " + e.getMessage(), e);
    }

    if (skipped > 0) {
      log.warn("Skipped {} malformed row(s) in {}", skipped, fileName);
    }

    List<DataColumn> columns = new ArrayList<>(headers.length);
    for (int i = 0; i < headers.length; i++) {
      columns.add(typeInferenceService.toColumn(headers[i], cells.get(i), null));
    }
    DataTable table = new DataTable(extractTableName(fileName), columns);
    log.info(
        "Parsed {} into {} rows and {} columns",
        fileName,
        table.getRowCount(),
        table.getColumnCount());
    return table;
  }

  /** Strips a leading byte order mark and names blank headers {@code Unnamed: <index>}. */
  private String[] normalizeHeaders(String[] headers) {
    String[] normalized = new String[headers.length];
    for (int i = 0; i < headers.length; i++) {
      String header = headers[i] != null ? headers[i] : "";
      if (i == 0 && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
        header = header.substring(1);
      }
      normalized[i] = header.isBlank() ? "Unnamed: " + i : header.trim();
    }
    return normalized;
  }

  String extractTableName(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return "unnamed_table";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
  }
}
