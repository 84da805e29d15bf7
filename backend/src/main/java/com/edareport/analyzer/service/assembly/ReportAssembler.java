package com.edareport.analyzer.service.assembly;

import static com.edareport.analyzer.service.assembly.StatisticFormatter.format;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.text.StringEscapeUtils;
import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.profile.CategoricalStatistics;
import com.edareport.analyzer.dto.profile.CategoryFrequency;
import com.edareport.analyzer.dto.profile.ChartArtifact;
import com.edareport.analyzer.dto.profile.ColumnMissingCount;
import com.edareport.analyzer.dto.profile.ColumnProfile;
import com.edareport.analyzer.dto.profile.ColumnReport;
import com.edareport.analyzer.dto.profile.CorrelationMatrix;
import com.edareport.analyzer.dto.profile.CorrelationResult;
import com.edareport.analyzer.dto.profile.DatasetSummary;
import com.edareport.analyzer.dto.profile.NumericStatistics;
import com.edareport.analyzer.dto.profile.QuantileValue;
import com.edareport.analyzer.exception.ReportAssemblyException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Composes the summary, column sections and correlation section into one hermetic HTML document.
 * Stylesheet and navigation script are inlined and every chart is a data URI, so the document has
 * no external references.
 *
 * <p>Section ids are generated from the column position ({@code column-0}, {@code column-1}, ...)
 * and the navigation script only reads them from {@code data-target} attributes. Column names
 * appear in the document solely as escaped text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportAssembler {

  static final String CORRELATION_SECTION_ID = "correlation";

  private final ReportTemplateService templateService;

  public String assemble(
      String title,
      DatasetSummary summary,
      List<ColumnReport> columns,
      CorrelationResult correlation) {
    try {
      Map<String, String> slots = new HashMap<>();
      slots.put("TITLE", escape(title));
      slots.put("STYLES", templateService.loadTemplate(ReportTemplateService.STYLESHEET));
      slots.put("SCRIPT", templateService.loadTemplate(ReportTemplateService.NAVIGATION_SCRIPT));
      slots.put("SUMMARY", renderSummary(summary));
      slots.put("NAVIGATION", renderNavigation(columns));
      slots.put("SECTIONS", renderColumnSections(columns));
      slots.put("CORRELATION", renderCorrelation(correlation, columns.isEmpty()));

      String html =
          templateService.render(
              templateService.loadTemplate(ReportTemplateService.PAGE_TEMPLATE), slots);
      log.debug("Assembled report '{}' ({} characters)", title, html.length());
      return html;
    } catch (IOException | RuntimeException e) {
      throw new ReportAssemblyException("Failed to assemble report: " + e.getMessage(), e);
    }
  }

  private String renderSummary(DatasetSummary summary) {
    StringBuilder html = new StringBuilder();
    html.append("<section class=\"summary\" id=\"summary\">\n")
        .append("<h2>Dataset's General Information</h2>\n")
        .append("<table class=\"stats\">\n<tbody>\n");
    row(
        html,
        "Shape",
        summary.getRowCount() + " rows, " + summary.getColumnCount() + " columns",
        false);
    row(html, "Number of duplicated lines", format(summary.getDuplicateRowCount()), true);
    row(html, "Number of missing values (NaN/Null)", format(summary.getTotalMissingCount()), true);
    html.append("</tbody>\n</table>\n");

    if (!summary.getMissingCounts().isEmpty()) {
      html.append("<h3>Missing values per column</h3>\n")
          .append("<table class=\"stats missing-values\">\n")
          .append("<thead><tr><th>Column</th><th>Missing</th></tr></thead>\n<tbody>\n");
      for (ColumnMissingCount missing : summary.getMissingCounts()) {
        row(html, missing.getColumnName(), format(missing.getMissingCount()), true);
      }
      html.append("</tbody>\n</table>\n");
    }
    return html.append("</section>").toString();
  }

  private String renderNavigation(List<ColumnReport> columns) {
    StringBuilder html = new StringBuilder();
    for (ColumnReport column : columns) {
      navItem(
          html, sectionId(column), column.getProfile().getColumnName(), column.getIndex() == 0);
    }
    navItem(html, CORRELATION_SECTION_ID, "Correlation Analysis", columns.isEmpty());
    return html.toString();
  }

  private void navItem(StringBuilder html, String target, String label, boolean active) {
    html.append("<button type=\"button\" class=\"nav-item")
        .append(active ? " active" : "")
        .append("\" role=\"tab\" data-target=\"")
        .append(target)
        .append("\" aria-selected=\"")
        .append(active)
        .append("\">")
        .append(escape(label))
        .append("</button>\n");
  }

  private String renderColumnSections(List<ColumnReport> columns) {
    StringBuilder html = new StringBuilder();
    for (ColumnReport column : columns) {
      ColumnProfile profile = column.getProfile();
      html.append("<section class=\"report-section\" id=\"")
          .append(sectionId(column))
          .append("\" role=\"tabpanel\"")
          .append(column.getIndex() == 0 ? "" : " hidden")
          .append(">\n")
          .append("<h2>Analysis for column: ")
          .append(escape(profile.getColumnName()))
          .append("</h2>\n")
          .append("<p class=\"column-meta\">Type: ")
          .append(profile.getColumnType().toValue())
          .append(" &middot; Class: ")
          .append(profile.getColumnClass().name().toLowerCase(Locale.ROOT))
          .append("</p>\n");

      renderStatistics(html, profile);

      if (profile.getNote() != null) {
        notice(html, profile.getNote());
      }
      if (column.getChart() != null) {
        figure(html, column.getChart());
      } else if (column.getChartNote() != null) {
        notice(html, column.getChartNote());
      }
      html.append("</section>\n");
    }
    return html.toString();
  }

  private void renderStatistics(StringBuilder html, ColumnProfile profile) {
    html.append("<table class=\"stats column-stats\">\n<tbody>\n");
    if (profile.getNumeric() != null) {
      NumericStatistics numeric = profile.getNumeric();
      row(html, "Count", format(numeric.getCount()), true);
      row(html, "Mean", format(numeric.getMean()), true);
      row(html, "Standard Deviation", format(numeric.getStandardDeviation()), true);
      row(html, "Min", format(numeric.getMin()), true);
      for (QuantileValue quantile : numeric.getQuantiles()) {
        String label = StatisticFormatter.percentLabel(quantile.getPercent());
        if (quantile.getPercent() == 50.0) {
          label = "Median (" + label + ")";
        }
        row(html, label, format(quantile.getValue()), true);
      }
      row(html, "Max", format(numeric.getMax()), true);
    } else if (profile.getCategorical() != null) {
      CategoricalStatistics categorical = profile.getCategorical();
      row(html, "Count", format(categorical.getCount()), true);
      row(html, "Unique", format(categorical.getDistinctCount()), true);
      row(
          html,
          "Top",
          categorical.getTopValue() != null
              ? categorical.getTopValue()
              : StatisticFormatter.NOT_APPLICABLE,
          false);
      row(
          html,
          "Frequency of Top",
          categorical.getTopFrequency() != null
              ? format(categorical.getTopFrequency())
              : StatisticFormatter.NOT_APPLICABLE,
          true);
    } else {
      row(html, "Count", format(profile.getNonMissingCount()), true);
    }
    row(html, "Missing Values (NaN/Null)", format(profile.getMissingCount()), true);
    html.append("</tbody>\n</table>\n");

    if (profile.getCategorical() != null && !profile.getCategorical().getCategories().isEmpty()) {
      renderFrequencies(html, profile.getCategorical());
    }
  }

  private void renderFrequencies(StringBuilder html, CategoricalStatistics categorical) {
    html.append("<table class=\"stats frequencies\">\n")
        .append("<thead><tr><th>Value</th><th>Count</th><th>Share</th></tr></thead>\n<tbody>\n");
    for (CategoryFrequency frequency : categorical.getCategories()) {
      frequencyRow(html, frequency.getValue(), frequency.getCount(), categorical.getCount());
    }
    if (categorical.hasOtherBucket()) {
      frequencyRow(
          html,
          CategoricalStatistics.OTHER_LABEL
              + " ("
              + categorical.getOtherDistinctCount()
              + " values)",
          categorical.getOtherBucket().getCount(),
          categorical.getCount());
    }
    html.append("</tbody>\n</table>\n");
  }

  private void frequencyRow(StringBuilder html, String value, long count, long total) {
    html.append("<tr><td>")
        .append(escape(value))
        .append("</td><td class=\"number\">")
        .append(format(count))
        .append("</td><td class=\"number\">")
        .append(StatisticFormatter.share(count, total))
        .append("</td></tr>\n");
  }

  private String renderCorrelation(CorrelationResult correlation, boolean visible) {
    StringBuilder html = new StringBuilder();
    html.append("<section class=\"report-section\" id=\"")
        .append(CORRELATION_SECTION_ID)
        .append("\" role=\"tabpanel\"")
        .append(visible ? "" : " hidden")
        .append(">\n<h2>Correlation Analysis</h2>\n");

    if (!correlation.isComputed()) {
      notice(
          html,
          "Insufficient numeric columns: correlation analysis needs at least two numeric"
              + " columns, found "
              + correlation.getNumericColumnCount()
              + ".");
      return html.append("</section>").toString();
    }

    if (correlation.getHeatmap() != null) {
      figure(html, correlation.getHeatmap());
    } else if (correlation.getHeatmapNote() != null) {
      notice(html, correlation.getHeatmapNote());
    }

    CorrelationMatrix matrix = correlation.getMatrix();
    html.append("<div class=\"matrix-wrapper\">\n<table class=\"stats correlation-matrix\">\n")
        .append("<thead><tr><th></th>");
    for (String name : matrix.getColumnNames()) {
      html.append("<th>").append(escape(name)).append("</th>");
    }
    html.append("</tr></thead>\n<tbody>\n");
    for (int i = 0; i < matrix.size(); i++) {
      html.append("<tr><th>").append(escape(matrix.getColumnNames().get(i))).append("</th>");
      for (int j = 0; j < matrix.size(); j++) {
        html.append("<td class=\"number\">")
            .append(StatisticFormatter.formatCoefficient(matrix.get(i, j)))
            .append("</td>");
      }
      html.append("</tr>\n");
    }
    html.append("</tbody>\n</table>\n</div>\n");
    return html.append("</section>").toString();
  }

  private void row(StringBuilder html, String label, String value, boolean numeric) {
    html.append("<tr><th>")
        .append(escape(label))
        .append("</th><td")
        .append(numeric ? " class=\"number\"" : "")
        .append('>')
        .append(escape(value))
        .append("</td></tr>\n");
  }

  private void figure(StringBuilder html, ChartArtifact chart) {
    html.append("<figure>\n<img src=\"")
        .append(chart.toDataUri())
        .append("\" alt=\"")
        .append(escape(chart.getCaption()))
        .append("\">\n<figcaption>")
        .append(escape(chart.getCaption()))
        .append("</figcaption>\n</figure>\n");
  }

  private void notice(StringBuilder html, String text) {
    html.append("<p class=\"notice\">").append(escape(text)).append("</p>\n");
  }

  private static String sectionId(ColumnReport column) {
    return "column-" + column.getIndex();
  }

  private static String escape(String text) {
    return StringEscapeUtils.escapeHtml4(text);
  }
}
