package com.edareport.analyzer.service.rendering;

import java.util.Locale;

import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.profile.ChartArtifact;
import com.edareport.analyzer.dto.profile.CorrelationMatrix;
import com.edareport.analyzer.exception.ChartRenderingException;
import com.edareport.analyzer.service.rendering.SvgCanvas.Anchor;

/** Renders a correlation matrix as an annotated heatmap on a diverging scale centered at zero. */
@Service
public class HeatmapRenderer {

  static final String TITLE = "Correlation Heatmap";

  private static final int CELL = 56;
  private static final int MARGIN_TOP = 50;
  private static final int LEGEND_WIDTH = 90;
  private static final int LABEL_CHARS = 22;
  private static final int MAX_COLUMNS = 200;
  private static final String MISSING_COLOR = "#f4f4f4";
  private static final String TEXT_COLOR = "#222222";

  public ChartArtifact render(CorrelationMatrix matrix) throws ChartRenderingException {
    int n = matrix.size();
    if (n == 0 || n > MAX_COLUMNS) {
      throw new ChartRenderingException(
          "Heatmap supports between 1 and " + MAX_COLUMNS + " columns, got " + n);
    }

    int longestLabel = 0;
    for (String name : matrix.getColumnNames()) {
      longestLabel = Math.max(longestLabel, Math.min(name.length(), LABEL_CHARS));
    }
    int labelSpace = 20 + longestLabel * 7;
    int width = labelSpace + n * CELL + LEGEND_WIDTH;
    int height = MARGIN_TOP + n * CELL + labelSpace;

    SvgCanvas canvas = new SvgCanvas(width, height);
    canvas.text(
        labelSpace + n * CELL / 2.0, 28, TITLE, Anchor.MIDDLE, 16, "#111111", 0, true);

    for (int row = 0; row < n; row++) {
      double y = MARGIN_TOP + row * CELL;
      canvas.text(
          labelSpace - 8,
          y + CELL / 2.0 + 4,
          SvgCanvas.shorten(matrix.getColumnNames().get(row), LABEL_CHARS),
          Anchor.END,
          11,
          TEXT_COLOR);
      for (int col = 0; col < n; col++) {
        double x = labelSpace + col * CELL;
        Double value = matrix.get(row, col);
        String fill = value == null ? MISSING_COLOR : ColorScale.diverging(value);
        canvas.rect(x, y, CELL, CELL, fill, "#ffffff");
        String annotation =
            value == null ? "N/A" : String.format(Locale.ROOT, "%.2f", value);
        String annotationColor = value != null && Math.abs(value) > 0.6 ? "#ffffff" : TEXT_COLOR;
        canvas.text(
            x + CELL / 2.0, y + CELL / 2.0 + 4, annotation, Anchor.MIDDLE, 11, annotationColor);
      }
    }

    double bottom = MARGIN_TOP + n * CELL;
    for (int col = 0; col < n; col++) {
      double x = labelSpace + col * CELL + CELL / 2.0 + 4;
      canvas.text(
          x,
          bottom + 8,
          SvgCanvas.shorten(matrix.getColumnNames().get(col), LABEL_CHARS),
          Anchor.END,
          11,
          TEXT_COLOR,
          -90,
          false);
    }

    drawLegend(canvas, labelSpace + n * CELL + 24, Math.max(n * CELL, 120));
    return new ChartArtifact(ChartArtifact.SVG_MEDIA_TYPE, canvas.toBytes(), TITLE);
  }

  private void drawLegend(SvgCanvas canvas, double x, double legendHeight) {
    int steps = 20;
    double stepHeight = legendHeight / steps;
    for (int i = 0; i < steps; i++) {
      double value = 1.0 - (i + 0.5) * 2.0 / steps;
      canvas.rect(x, MARGIN_TOP + i * stepHeight, 16, stepHeight, ColorScale.diverging(value), null);
    }
    canvas.text(x + 22, MARGIN_TOP + 10, "1", Anchor.START, 11, TEXT_COLOR);
    canvas.text(x + 22, MARGIN_TOP + legendHeight / 2 + 4, "0", Anchor.START, 11, TEXT_COLOR);
    canvas.text(x + 22, MARGIN_TOP + legendHeight, "-1", Anchor.START, 11, TEXT_COLOR);
  }
}
