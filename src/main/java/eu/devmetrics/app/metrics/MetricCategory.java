package eu.devmetrics.app.metrics;

public enum MetricCategory {
    COMMIT_ACTIVITY("commit_activity"),
    CODE_CHURN("code_churn"),
    RELIABILITY("reliability"),
    FLOW("flow");

    private final String key;

    MetricCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
