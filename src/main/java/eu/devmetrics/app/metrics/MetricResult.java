package eu.devmetrics.app.metrics;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Uniform envelope around a metric outcome. Either {@code value} or
 * {@code error} is set, never both.
 */
@Value
@Builder
public class MetricResult {

    public static final String CATEGORY = "category";
    public static final String DATA_POINTS = "data_points";
    public static final String DATA_POINTS_LABEL = "data_points_label";
    public static final String COMPUTED_AT = "computed_at";
    public static final String OPTIONS_USED = "options_used";
    public static final String EXECUTION_TIME = "execution_time";
    public static final String ERROR_CLASS = "error_class";

    String metricName;
    MetricValue value;
    String repository;
    TimeWindow timeWindow;
    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();
    String error;

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailed() {
        return error != null;
    }

    public int getDataPoints() {
        Object dataPoints = metadata.get(DATA_POINTS);
        return dataPoints instanceof Number number ? number.intValue() : 0;
    }

    public String summaryLine() {
        if (isFailed()) {
            return metricName + ": failed (" + metadata.get(ERROR_CLASS) + ": " + error + ")";
        }
        return metricName + ": " + value.describe() + " from " + getDataPoints() + " "
                + metadata.getOrDefault(DATA_POINTS_LABEL, "records");
    }
}
