package eu.devmetrics.app.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Utility class with the descriptive statistics shared by the metric algorithms.
 * All methods accept empty input and return 0 in that case.
 */
public class Statistics {

    private Statistics() {
    }

    /**
     * Rounds half-up to the given number of decimal places.
     *
     * @param value  The value to round
     * @param places Number of decimal places
     * @return The rounded value, or the input unchanged when it is not finite
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    public static double sum(Collection<? extends Number> values) {
        double total = 0.0;
        for (Number value : values) {
            total += value.doubleValue();
        }
        return total;
    }

    public static double mean(Collection<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        return sum(values) / values.size();
    }

    /**
     * Median with the usual even/odd midpoint. The input does not need to be sorted.
     */
    public static double median(Collection<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = sorted(values);
        int n = sorted.size();
        if (n % 2 == 0) {
            return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
        }
        return sorted.get(n / 2);
    }

    /**
     * Nearest-rank percentile over an ascending list: index = round(p / 100 * (n - 1)).
     *
     * @param sortedValues Values sorted ascending
     * @param percentile   Percentile in [0, 100]
     * @return The value at the computed index, or 0 for an empty list
     */
    public static double percentile(List<? extends Number> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.round(percentile / 100.0 * (sortedValues.size() - 1));
        index = Math.max(0, Math.min(index, sortedValues.size() - 1));
        return sortedValues.get(index).doubleValue();
    }

    /**
     * Population variance.
     */
    public static double variance(Collection<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (Number value : values) {
            double diff = value.doubleValue() - mean;
            squares += diff * diff;
        }
        return squares / values.size();
    }

    public static double standardDeviation(Collection<? extends Number> values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Standard deviation divided by mean; 0 when the mean is 0.
     */
    public static double coefficientOfVariation(Collection<? extends Number> values) {
        double mean = mean(values);
        if (mean == 0.0) {
            return 0.0;
        }
        return standardDeviation(values) / mean;
    }

    /**
     * Percentage of {@code part} in {@code total}, 0 when the total is 0.
     */
    public static double percentage(double part, double total) {
        if (total == 0.0) {
            return 0.0;
        }
        return part / total * 100.0;
    }

    public static List<Double> sorted(Collection<? extends Number> values) {
        List<Double> result = new ArrayList<>(values.size());
        for (Number value : values) {
            result.add(value.doubleValue());
        }
        Collections.sort(result);
        return result;
    }

    /**
     * Key with the highest count; ties go to the key met first. Null for an empty map.
     */
    public static <K> K firstMaxKey(Map<K, Integer> counts) {
        K best = null;
        int bestCount = Integer.MIN_VALUE;
        for (Map.Entry<K, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
