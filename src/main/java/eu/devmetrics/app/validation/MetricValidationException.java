package eu.devmetrics.app.validation;

/**
 * Exception thrown when the inputs of an analysis are invalid.
 * Raised before any metric computation begins and never converted
 * into a failed metric result.
 */
public class MetricValidationException extends RuntimeException {

    private final ValidationErrorCode errorCode;

    public MetricValidationException(ValidationErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MetricValidationException(ValidationErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ValidationErrorCode getErrorCode() {
        return errorCode;
    }

    public enum ValidationErrorCode {
        MISSING_REPOSITORY,
        INVALID_REPOSITORY,
        MISSING_TIME_WINDOW,
        INVALID_TIME_WINDOW,
        MISSING_INPUT
    }
}
