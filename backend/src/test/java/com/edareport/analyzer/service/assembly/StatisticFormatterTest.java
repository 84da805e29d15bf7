package com.edareport.analyzer.service.assembly;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StatisticFormatterTest {

  @Test
  void shouldFormatDecimalsWithoutLocaleOrNoise() {
    assertThat(StatisticFormatter.format(25.0)).isEqualTo("25.0");
    assertThat(StatisticFormatter.format(0.0)).isEqualTo("0.0");
    assertThat(StatisticFormatter.format(100.0)).isEqualTo("100.0");
    assertThat(StatisticFormatter.format(2.5)).isEqualTo("2.5");
    assertThat(StatisticFormatter.format(1.0 / 3.0)).isEqualTo("0.333333");
    assertThat(StatisticFormatter.format(-1234567.125)).isEqualTo("-1234567.125");
  }

  @Test
  void shouldFormatUndefinedValuesAsNotApplicable() {
    assertThat(StatisticFormatter.format((Double) null)).isEqualTo("N/A");
    assertThat(StatisticFormatter.format(Double.NaN)).isEqualTo("N/A");
    assertThat(StatisticFormatter.formatCoefficient(null)).isEqualTo("N/A");
    assertThat(StatisticFormatter.share(1, 0)).isEqualTo("N/A");
  }

  @Test
  void shouldFormatInfinities() {
    assertThat(StatisticFormatter.format(Double.POSITIVE_INFINITY)).isEqualTo("inf");
    assertThat(StatisticFormatter.format(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
  }

  @Test
  void shouldFormatLabelsAndShares() {
    assertThat(StatisticFormatter.percentLabel(25.0)).isEqualTo("25%");
    assertThat(StatisticFormatter.percentLabel(12.5)).isEqualTo("12.5%");
    assertThat(StatisticFormatter.formatCoefficient(-1.0)).isEqualTo("-1.0000");
    assertThat(StatisticFormatter.share(1, 3)).isEqualTo("33.3%");
    assertThat(StatisticFormatter.format(42L)).isEqualTo("42");
  }
}
