package prayer.devotions_be.web;

import org.springframework.http.HttpStatus;

/**
 * Business error raised by services and rendered by {@link GlobalExceptionHandler}.
 *
 * <p>{@code details} is a stable machine-readable reason such as {@code time_format_invalid}.
 */
public class ApiException extends RuntimeException {
    private final String code;
    private final HttpStatus status;
    private final String details;

    private ApiException(String code, String message, String details, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
        this.details = details;
    }

    public static ApiException validation(String message, String details) {
        return new ApiException("VALIDATION", message, details, HttpStatus.BAD_REQUEST);
    }

    public static ApiException notFound(String message, String details) {
        return new ApiException("NOT_FOUND", message, details, HttpStatus.NOT_FOUND);
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDetails() {
        return details;
    }
}
