package ledgerlink.sheets.exceptions;

/**
 * Exception thrown when a fetch request fails input validation (missing or malformed spreadsheet reference).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request by the fetch resource.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
