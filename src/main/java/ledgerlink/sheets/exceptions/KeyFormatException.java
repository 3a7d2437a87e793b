package ledgerlink.sheets.exceptions;

/**
 * Exception thrown when a service account private key is not a usable PEM block (missing BEGIN/END markers, or a
 * key file without the expected fields).
 *
 * <p>
 * This is a configuration problem rather than a transient fault, so callers surface it as HTTP 500 with the message
 * intact.
 */
public class KeyFormatException extends RuntimeException {

    public KeyFormatException(String message) {
        super(message);
    }

    public KeyFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
