package ledgerlink.sheets.exceptions;

/**
 * Exception thrown when the Sheets values endpoint or the public CSV export answers with a non-success status.
 *
 * <p>
 * The message is already user-facing (not found vs access denied vs generic). The upstream status is returned to the
 * caller as the HTTP status of the error response.
 */
public class UpstreamFetchException extends RuntimeException {

    private final int status;
    private final String spreadsheetId;

    public UpstreamFetchException(String message, int status) {
        this(message, status, null);
    }

    public UpstreamFetchException(String message, int status, String spreadsheetId) {
        super(message);
        this.status = status;
        this.spreadsheetId = spreadsheetId;
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.spreadsheetId = null;
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return spreadsheet ID echoed back to the caller, or {@code null} when not reported
     */
    public String getSpreadsheetId() {
        return spreadsheetId;
    }
}
