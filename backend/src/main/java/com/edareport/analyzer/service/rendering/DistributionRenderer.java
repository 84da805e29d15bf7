package com.edareport.analyzer.service.rendering;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.util.FastMath;
import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.profile.CategoricalStatistics;
import com.edareport.analyzer.dto.profile.CategoryFrequency;
import com.edareport.analyzer.dto.profile.ChartArtifact;
import com.edareport.analyzer.dto.profile.ColumnProfile;
import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.exception.ChartRenderingException;
import com.edareport.analyzer.service.rendering.SvgCanvas.Anchor;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Draws the distribution of a profiled column: an equal-width histogram for numeric columns and
 * a bar chart of the most frequent values for categorical ones. Unsupported and empty columns get
 * no chart.
 */
@Slf4j
@Service
public class DistributionRenderer {

  static final int MAX_BINS = 1000;

  private static final int WIDTH = 800;
  private static final int HEIGHT = 480;
  private static final int MARGIN_LEFT = 70;
  private static final int MARGIN_RIGHT = 20;
  private static final int MARGIN_TOP = 50;
  private static final int HISTOGRAM_MARGIN_BOTTOM = 70;
  private static final int BAR_CHART_MARGIN_BOTTOM = 170;
  private static final int Y_TICKS = 4;
  private static final int KDE_POINTS = 200;
  private static final String KDE_COLOR = "#1f3b73";
  // density() needs no random source
  private static final NormalDistribution KERNEL = new NormalDistribution(null, 0.0, 1.0);
  private static final String AXIS_COLOR = "#333333";
  private static final String GRID_COLOR = "#e5e5e5";
  private static final String HISTOGRAM_COLOR = "#4c72b0";
  private static final String OTHER_COLOR = "#9e9e9e";

  public Optional<ChartArtifact> render(
      ColumnProfile profile, DataColumn column, ReportOptions options)
      throws ChartRenderingException {
    switch (profile.getColumnClass()) {
      case NUMERIC:
        if (profile.getNonMissingCount() == 0) {
          return Optional.empty();
        }
        return Optional.of(
            renderHistogram(profile.getColumnName(), column.numericValues(), options));
      case CATEGORICAL:
        if (profile.getCategorical() == null || profile.getCategorical().getCount() == 0) {
          return Optional.empty();
        }
        return Optional.of(
            renderBarChart(profile.getColumnName(), profile.getCategorical(), options));
      default:
        return Optional.empty();
    }
  }

  ChartArtifact renderHistogram(String columnName, double[] values, ReportOptions options)
      throws ChartRenderingException {
    Histogram histogram = bin(values, options.getHistogramBins());
    long[] counts = histogram.getCounts();
    double[] edges = histogram.getEdges();

    SvgCanvas canvas = new SvgCanvas(WIDTH, HEIGHT);
    double plotWidth = WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
    double plotHeight = HEIGHT - MARGIN_TOP - HISTOGRAM_MARGIN_BOTTOM;
    double baseline = MARGIN_TOP + plotHeight;
    double binWidth = (edges[edges.length - 1] - edges[0]) / counts.length;
    DensityCurve density = densityCurve(values, edges[0], edges[edges.length - 1], binWidth);
    double peak = density != null ? max(density.getCounts()) : 0.0;
    long yMax = niceCeiling(Math.max(max(counts), (long) Math.ceil(peak)));

    String title = "Histogram of " + columnName;
    drawFrame(canvas, title, columnName, plotHeight, yMax, HISTOGRAM_MARGIN_BOTTOM);

    double barWidth = plotWidth / counts.length;
    for (int i = 0; i < counts.length; i++) {
      double barHeight = plotHeight * counts[i] / yMax;
      canvas.rect(
          MARGIN_LEFT + i * barWidth,
          baseline - barHeight,
          barWidth,
          barHeight,
          HISTOGRAM_COLOR,
          "#ffffff");
    }

    if (density != null) {
      double[] xs = new double[KDE_POINTS];
      double[] ys = new double[KDE_POINTS];
      double range = edges[edges.length - 1] - edges[0];
      for (int i = 0; i < KDE_POINTS; i++) {
        xs[i] = MARGIN_LEFT + plotWidth * (density.getPoints()[i] - edges[0]) / range;
        ys[i] = baseline - plotHeight * density.getCounts()[i] / yMax;
      }
      canvas.polyline(xs, ys, KDE_COLOR, 2);
    }

    if (counts.length == 1) {
      canvas.text(
          MARGIN_LEFT + plotWidth / 2,
          baseline + 18,
          SvgCanvas.tickLabel(edges[0]),
          Anchor.MIDDLE,
          11,
          AXIS_COLOR);
    } else {
      int labelStep = Math.max(1, counts.length / 5);
      for (int i = 0; i <= counts.length; i += labelStep) {
        canvas.line(MARGIN_LEFT + i * barWidth, baseline, MARGIN_LEFT + i * barWidth, baseline + 5,
            AXIS_COLOR);
        canvas.text(
            MARGIN_LEFT + i * barWidth,
            baseline + 18,
            SvgCanvas.tickLabel(edges[i]),
            Anchor.MIDDLE,
            11,
            AXIS_COLOR);
      }
      if (counts.length % labelStep != 0) {
        canvas.text(
            MARGIN_LEFT + plotWidth,
            baseline + 18,
            SvgCanvas.tickLabel(edges[counts.length]),
            Anchor.MIDDLE,
            11,
            AXIS_COLOR);
      }
    }

    return new ChartArtifact(ChartArtifact.SVG_MEDIA_TYPE, canvas.toBytes(), title);
  }

  ChartArtifact renderBarChart(
      String columnName, CategoricalStatistics statistics, ReportOptions options) {
    List<CategoryFrequency> bars = new ArrayList<>(statistics.getCategories());
    if (statistics.hasOtherBucket()) {
      bars.add(statistics.getOtherBucket());
    }

    SvgCanvas canvas = new SvgCanvas(WIDTH, HEIGHT);
    double plotWidth = WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
    double plotHeight = HEIGHT - MARGIN_TOP - BAR_CHART_MARGIN_BOTTOM;
    double baseline = MARGIN_TOP + plotHeight;
    long yMax = niceCeiling(bars.stream().mapToLong(CategoryFrequency::getCount).max().orElse(0));

    String title =
        "Bar Chart of " + columnName + " (Top " + options.getMaxCategories() + " categories)";
    drawFrame(canvas, title, columnName, plotHeight, yMax, BAR_CHART_MARGIN_BOTTOM);

    double slot = plotWidth / bars.size();
    double barWidth = slot * 0.8;
    int named = statistics.getCategories().size();
    for (int i = 0; i < bars.size(); i++) {
      CategoryFrequency bar = bars.get(i);
      boolean other = i >= named;
      double barHeight = plotHeight * bar.getCount() / yMax;
      double x = MARGIN_LEFT + i * slot + (slot - barWidth) / 2;
      String fill = other ? OTHER_COLOR : ColorScale.viridis(named > 1 ? (double) i / (named - 1) : 0);
      canvas.rect(x, baseline - barHeight, barWidth, barHeight, fill, null);

      String label =
          other
              ? CategoricalStatistics.OTHER_LABEL + " (" + statistics.getOtherDistinctCount() + ")"
              : bar.getValue();
      double labelX = x + barWidth / 2 + 4;
      canvas.text(
          labelX, baseline + 8, SvgCanvas.shorten(label, 24), Anchor.END, 11, AXIS_COLOR, -90,
          false);
    }

    return new ChartArtifact(ChartArtifact.SVG_MEDIA_TYPE, canvas.toBytes(), title);
  }

  /**
   * Gaussian kernel density estimate over [min, max], scaled to expected counts per bin (density
   * times sample size times bin width) so it overlays the histogram bars. Bandwidth follows
   * Scott's rule, {@code sd * n^(-1/5)}. Returns {@code null} when there is no spread to
   * estimate: fewer than two values, a zero range or a zero standard deviation.
   */
  DensityCurve densityCurve(double[] values, double min, double max, double binWidth) {
    if (values.length < 2 || !(max > min)) {
      return null;
    }
    double sd = new StandardDeviation().evaluate(values);
    double bandwidth = sd * FastMath.pow(values.length, -0.2);
    if (!(bandwidth > 0.0) || !Double.isFinite(bandwidth)) {
      return null;
    }

    double scale = binWidth / bandwidth;
    double[] points = new double[KDE_POINTS];
    double[] expected = new double[KDE_POINTS];
    for (int i = 0; i < KDE_POINTS; i++) {
      double x = min + (max - min) * i / (KDE_POINTS - 1);
      double sum = 0.0;
      for (double value : values) {
        sum += KERNEL.density((x - value) / bandwidth);
      }
      points[i] = x;
      expected[i] = sum * scale;
    }
    return new DensityCurve(points, expected);
  }

  /**
   * Partitions values into {@code bins} equal-width bins over [min, max]. The maximum falls into
   * the last bin; a zero range yields a single bin holding every value.
   */
  Histogram bin(double[] values, int bins) throws ChartRenderingException {
    if (bins < 1 || bins > MAX_BINS) {
      throw new ChartRenderingException(
          "Histogram bin count must be between 1 and " + MAX_BINS + ", got " + bins);
    }
    if (values.length == 0) {
      throw new ChartRenderingException("No values to bin");
    }

    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double value : values) {
      if (!Double.isFinite(value)) {
        throw new ChartRenderingException("Cannot bin non-finite value " + value);
      }
      min = Math.min(min, value);
      max = Math.max(max, value);
    }

    double range = max - min;
    if (!Double.isFinite(range)) {
      throw new ChartRenderingException("Value range overflows: [" + min + ", " + max + "]");
    }
    if (range == 0.0) {
      return new Histogram(new double[] {min, max}, new long[] {values.length});
    }

    long[] counts = new long[bins];
    for (double value : values) {
      int index = (int) Math.floor((value - min) / range * bins);
      counts[Math.min(Math.max(index, 0), bins - 1)]++;
    }
    double[] edges = new double[bins + 1];
    for (int i = 0; i <= bins; i++) {
      edges[i] = i == bins ? max : min + range * i / bins;
    }
    return new Histogram(edges, counts);
  }

  private void drawFrame(
      SvgCanvas canvas,
      String title,
      String xLabel,
      double plotHeight,
      long yMax,
      int marginBottom) {
    double plotWidth = WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
    double baseline = MARGIN_TOP + plotHeight;

    canvas.text(WIDTH / 2.0, 28, SvgCanvas.shorten(title, 90), Anchor.MIDDLE, 16, "#111111", 0,
        true);

    for (int i = 0; i <= Y_TICKS; i++) {
      double y = baseline - plotHeight * i / Y_TICKS;
      long tick = yMax * i / Y_TICKS;
      canvas.line(MARGIN_LEFT, y, MARGIN_LEFT + plotWidth, y, GRID_COLOR);
      canvas.text(MARGIN_LEFT - 8, y + 4, Long.toString(tick), Anchor.END, 11, AXIS_COLOR);
    }
    canvas.line(MARGIN_LEFT, MARGIN_TOP, MARGIN_LEFT, baseline, AXIS_COLOR);
    canvas.line(MARGIN_LEFT, baseline, MARGIN_LEFT + plotWidth, baseline, AXIS_COLOR);

    canvas.text(
        MARGIN_LEFT + plotWidth / 2,
        HEIGHT - 12,
        SvgCanvas.shorten(xLabel, 60),
        Anchor.MIDDLE,
        13,
        AXIS_COLOR);
    canvas.text(18, MARGIN_TOP + plotHeight / 2, "Frequency", Anchor.MIDDLE, 13, AXIS_COLOR, -90,
        false);
  }

  private static double max(double[] values) {
    double max = 0.0;
    for (double value : values) {
      max = Math.max(max, value);
    }
    return max;
  }

  private static long max(long[] counts) {
    long max = 0;
    for (long count : counts) {
      max = Math.max(max, count);
    }
    return max;
  }

  /** Top of the y axis: {@value #Y_TICKS} ticks of a 1-2-2.5-5 step covering {@code value}. */
  static long niceCeiling(long value) {
    long step = Math.max(1, (value + Y_TICKS - 1) / Y_TICKS);
    long magnitude = 1;
    while (magnitude * 10 <= step) {
      magnitude *= 10;
    }
    long[] candidates = {
      magnitude, 2 * magnitude, magnitude >= 10 ? magnitude / 2 * 5 : 5, 5 * magnitude
    };
    for (long candidate : candidates) {
      if (candidate >= step) {
        return candidate * Y_TICKS;
      }
    }
    return 10 * magnitude * Y_TICKS;
  }

  @Value
  static class Histogram {
    double[] edges;
    long[] counts;
  }

  /** Kernel density sampled at evenly spaced points, in expected counts per bin. */
  @Value
  static class DensityCurve {
    double[] points;
    double[] counts;
  }
}
