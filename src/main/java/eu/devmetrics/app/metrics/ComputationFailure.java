package eu.devmetrics.app.metrics;

/**
 * Error captured from a metric computation.
 *
 * @param errorClass Simple name of the exception class
 * @param message    Human readable message
 */
public record ComputationFailure(String errorClass, String message) {

    public static ComputationFailure from(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ComputationFailure(error.getClass().getSimpleName(), message);
    }
}
