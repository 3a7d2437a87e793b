package ledgerlink.sheets.exceptions;

/**
 * Exception thrown when the public CSV export returns no content or content too short to be a real sheet.
 */
public class EmptyDataException extends RuntimeException {

    public EmptyDataException(String message) {
        super(message);
    }

    public EmptyDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
