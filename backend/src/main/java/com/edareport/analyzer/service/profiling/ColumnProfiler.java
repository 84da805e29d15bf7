package com.edareport.analyzer.service.profiling;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.profile.CategoricalStatistics;
import com.edareport.analyzer.dto.profile.CategoryFrequency;
import com.edareport.analyzer.dto.profile.ColumnClass;
import com.edareport.analyzer.dto.profile.ColumnProfile;
import com.edareport.analyzer.dto.profile.NumericStatistics;
import com.edareport.analyzer.dto.profile.QuantileValue;
import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.DataColumn;

import lombok.extern.slf4j.Slf4j;

/**
 * Computes descriptive statistics for one column according to its {@link ColumnClass}.
 *
 * <p>Conventions: the standard deviation is the sample standard deviation (n - 1 denominator) and
 * is not applicable below two values; a column of two or more identical values has a standard
 * deviation of exactly 0. Quantiles interpolate linearly between order statistics (R-7, the rule
 * used by numpy and pandas).
 */
@Slf4j
@Service
public class ColumnProfiler {

  public ColumnProfile profile(DataColumn column, ColumnClass columnClass, ReportOptions options) {
    long rowCount = column.size();
    long missingCount = column.missingCount();

    ColumnProfile.ColumnProfileBuilder builder =
        ColumnProfile.builder()
            .columnName(column.getName())
            .columnType(column.getType())
            .columnClass(columnClass)
            .rowCount(rowCount)
            .missingCount(missingCount)
            .nonMissingCount(rowCount - missingCount);

    switch (columnClass) {
      case NUMERIC:
        builder.numeric(profileNumeric(column, options.getQuantiles()));
        break;
      case CATEGORICAL:
        builder.categorical(profileCategorical(column, options.getMaxCategories()));
        break;
      default:
        builder.note(
            "No further analysis applies to " + column.getType().toValue() + " columns.");
        break;
    }

    ColumnProfile profile = builder.build();
    log.debug(
        "Profiled column '{}' as {} ({} present, {} missing)",
        column.getName(),
        columnClass,
        profile.getNonMissingCount(),
        missingCount);
    return profile;
  }

  NumericStatistics profileNumeric(DataColumn column, List<Double> quantiles) {
    double[] values = column.numericValues();
    NumericStatistics.NumericStatisticsBuilder builder =
        NumericStatistics.builder().count(values.length);

    if (values.length == 0) {
      quantiles.forEach(q -> builder.quantile(new QuantileValue(q, null)));
      return builder.build();
    }

    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    double min = stats.getMin();
    double max = stats.getMax();
    Double mean = nanToNull(stats.getMean());
    if (mean != null && min <= max) {
      // rounding in the mean can land one ulp outside the observed range
      mean = Math.min(max, Math.max(min, mean));
    }

    builder
        .min(min)
        .max(max)
        .mean(mean)
        .standardDeviation(values.length >= 2 ? nanToNull(stats.getStandardDeviation()) : null);

    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    percentile.setData(values);
    for (Double q : quantiles) {
      builder.quantile(new QuantileValue(q, nanToNull(percentile.evaluate(q))));
    }
    return builder.build();
  }

  CategoricalStatistics profileCategorical(DataColumn column, int maxCategories) {
    Map<String, Long> frequencies = new LinkedHashMap<>();
    for (Object value : column.nonMissingValues()) {
      frequencies.merge(value.toString(), 1L, Long::sum);
    }

    // List.sort is stable, so equal counts keep first-appearance order
    List<Map.Entry<String, Long>> ranked = new ArrayList<>(frequencies.entrySet());
    ranked.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));

    CategoricalStatistics.CategoricalStatisticsBuilder builder =
        CategoricalStatistics.builder()
            .count(column.size() - column.missingCount())
            .distinctCount(ranked.size());

    if (!ranked.isEmpty()) {
      builder.topValue(ranked.get(0).getKey()).topFrequency(ranked.get(0).getValue());
    }

    int kept = Math.min(maxCategories, ranked.size());
    for (Map.Entry<String, Long> entry : ranked.subList(0, kept)) {
      builder.category(new CategoryFrequency(entry.getKey(), entry.getValue()));
    }

    if (ranked.size() > maxCategories) {
      List<Map.Entry<String, Long>> tail = ranked.subList(maxCategories, ranked.size());
      long otherCount = tail.stream().mapToLong(Map.Entry::getValue).sum();
      builder
          .otherBucket(new CategoryFrequency(CategoricalStatistics.OTHER_LABEL, otherCount))
          .otherDistinctCount(tail.size());
    }
    return builder.build();
  }

  private static Double nanToNull(double value) {
    return Double.isNaN(value) ? null : value;
  }
}
