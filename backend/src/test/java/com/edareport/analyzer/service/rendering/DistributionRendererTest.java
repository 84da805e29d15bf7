package com.edareport.analyzer.service.rendering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.edareport.analyzer.dto.profile.ChartArtifact;
import com.edareport.analyzer.dto.profile.ColumnClass;
import com.edareport.analyzer.dto.profile.ColumnProfile;
import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.ColumnType;
import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.exception.ChartRenderingException;
import com.edareport.analyzer.service.profiling.ColumnProfiler;

@DisplayName("Distribution Renderer")
class DistributionRendererTest {

  private final DistributionRenderer renderer = new DistributionRenderer();
  private final ColumnProfiler profiler = new ColumnProfiler();
  private final ReportOptions options = ReportOptions.defaults();

  @Nested
  @DisplayName("Binning")
  class Binning {

    @Test
    void shouldPlaceMaximumInLastBin() throws Exception {
      double[] values = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

      DistributionRenderer.Histogram histogram = renderer.bin(values, 5);

      assertThat(histogram.getCounts()).containsExactly(2, 2, 2, 2, 3);
      assertThat(histogram.getEdges()).containsExactly(0.0, 2.0, 4.0, 6.0, 8.0, 10.0);
    }

    @Test
    void shouldUseSingleBinForZeroRange() throws Exception {
      DistributionRenderer.Histogram histogram = renderer.bin(new double[] {5, 5, 5}, 20);

      assertThat(histogram.getCounts()).containsExactly(3);
      assertThat(histogram.getEdges()).containsExactly(5.0, 5.0);
    }

    @Test
    void shouldRejectInvalidBinCounts() {
      assertThatThrownBy(() -> renderer.bin(new double[] {1, 2}, 0))
          .isInstanceOf(ChartRenderingException.class)
          .hasMessageContaining("between 1 and 1000");
      assertThatThrownBy(() -> renderer.bin(new double[] {1, 2}, 1001))
          .isInstanceOf(ChartRenderingException.class);
    }

    @Test
    void shouldRejectNonFiniteValues() {
      assertThatThrownBy(() -> renderer.bin(new double[] {1, Double.POSITIVE_INFINITY}, 10))
          .isInstanceOf(ChartRenderingException.class)
          .hasMessageContaining("non-finite");
    }
  }

  @Nested
  @DisplayName("Density overlay")
  class DensityOverlay {

    @Test
    void shouldSampleCurveAcrossHistogramRange() {
      double[] values = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

      DistributionRenderer.DensityCurve curve = renderer.densityCurve(values, 0.0, 10.0, 2.0);

      assertThat(curve).isNotNull();
      assertThat(curve.getPoints()).hasSize(200);
      assertThat(curve.getPoints()[0]).isEqualTo(0.0);
      assertThat(curve.getPoints()[199]).isEqualTo(10.0);
      assertThat(Arrays.stream(curve.getCounts()).min().orElseThrow()).isPositive();
      assertThat(Arrays.stream(curve.getCounts()).max().orElseThrow()).isLessThan(11.0);
      // Uniform data peaks near the middle, not at the edges.
      assertThat(curve.getCounts()[100]).isGreaterThan(curve.getCounts()[0]);
    }

    @Test
    void shouldSkipCurveForZeroRangeOrSingleValue() {
      assertThat(renderer.densityCurve(new double[] {5, 5, 5}, 5.0, 5.0, 0.0)).isNull();
      assertThat(renderer.densityCurve(new double[] {5}, 4.0, 6.0, 1.0)).isNull();
    }

    @Test
    void shouldDrawCurveOverHistogramWithSpread() throws Exception {
      DataColumn values = DataColumn.of("v", ColumnType.DECIMAL, 1.5, 2.25, 9.0, 4.0, 4.0, 6.5);
      ColumnProfile profile = profiler.profile(values, ColumnClass.NUMERIC, options);

      ChartArtifact first = renderer.render(profile, values, options).orElseThrow();
      ChartArtifact second = renderer.render(profile, values, options).orElseThrow();

      assertThat(svg(first)).contains("<polyline", "stroke=\"#1f3b73\"");
      assertThat(first.getContent()).isEqualTo(second.getContent());
    }

    @Test
    void shouldOmitCurveForConstantColumn() throws Exception {
      DataColumn constant = DataColumn.of("c", ColumnType.DECIMAL, 3.0, 3.0, 3.0);
      ColumnProfile profile = profiler.profile(constant, ColumnClass.NUMERIC, options);

      ChartArtifact chart = renderer.render(profile, constant, options).orElseThrow();

      assertThat(svg(chart)).contains("<rect").doesNotContain("<polyline");
    }
  }

  @Test
  void shouldRoundAxisTopToReadableTicks() {
    assertThat(DistributionRenderer.niceCeiling(0)).isEqualTo(4);
    assertThat(DistributionRenderer.niceCeiling(7)).isEqualTo(8);
    assertThat(DistributionRenderer.niceCeiling(100)).isEqualTo(100);
    assertThat(DistributionRenderer.niceCeiling(101)).isEqualTo(200);
  }

  @Test
  void shouldRenderHistogramForNumericColumn() throws Exception {
    DataColumn age = DataColumn.of("age", ColumnType.DECIMAL, 23.0, null, 27.0, 25.0);
    ColumnProfile profile = profiler.profile(age, ColumnClass.NUMERIC, options);

    Optional<ChartArtifact> chart = renderer.render(profile, age, options);

    assertThat(chart).isPresent();
    assertThat(chart.get().getMediaType()).isEqualTo("image/svg+xml");
    assertThat(chart.get().getCaption()).isEqualTo("Histogram of age");
    assertThat(svg(chart.get())).startsWith("<svg").contains("Histogram of age", "Frequency");
    assertThat(chart.get().toDataUri()).startsWith("data:image/svg+xml;base64,");
  }

  @Test
  void shouldRenderBarChartWithOtherBar() throws Exception {
    DataColumn letters = DataColumn.of("letters", ColumnType.TEXT, "a", "a", "b", "c", "d");
    ReportOptions capped = options.toBuilder().maxCategories(2).build();
    ColumnProfile profile = profiler.profile(letters, ColumnClass.CATEGORICAL, capped);

    ChartArtifact chart = renderer.render(profile, letters, capped).orElseThrow();

    assertThat(chart.getCaption()).isEqualTo("Bar Chart of letters (Top 2 categories)");
    assertThat(svg(chart)).contains(">a</text>", ">b</text>", ">Other (2)</text>", "#9e9e9e");
  }

  @Test
  void shouldEscapeMarkupInLabels() throws Exception {
    DataColumn column = DataColumn.of("<b>", ColumnType.TEXT, "x & y");
    ColumnProfile profile = profiler.profile(column, ColumnClass.CATEGORICAL, options);

    ChartArtifact chart = renderer.render(profile, column, options).orElseThrow();

    assertThat(svg(chart)).contains("&lt;b&gt;", "x &amp; y").doesNotContain("<b>");
  }

  @Test
  void shouldSkipColumnsWithoutValuesOrClass() throws Exception {
    DataColumn empty = DataColumn.of("e", ColumnType.DECIMAL, null, null);
    DataColumn dates = DataColumn.of("d", ColumnType.DATETIME, "2024-01-01");

    assertThat(
            renderer.render(profiler.profile(empty, ColumnClass.NUMERIC, options), empty, options))
        .isEmpty();
    assertThat(
            renderer.render(
                profiler.profile(dates, ColumnClass.UNSUPPORTED, options), dates, options))
        .isEmpty();
  }

  @Test
  void shouldProduceIdenticalBytesForIdenticalInput() throws Exception {
    DataColumn values = DataColumn.of("v", ColumnType.DECIMAL, 1.5, 2.25, 9.0, 4.0, 4.0);
    ColumnProfile profile = profiler.profile(values, ColumnClass.NUMERIC, options);

    ChartArtifact first = renderer.render(profile, values, options).orElseThrow();
    ChartArtifact second = renderer.render(profile, values, options).orElseThrow();

    assertThat(first.getContent()).isEqualTo(second.getContent());
  }

  private static String svg(ChartArtifact chart) {
    return new String(chart.getContent(), StandardCharsets.UTF_8);
  }
}
