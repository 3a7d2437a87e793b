package ledgerlink.sheets.exceptions;

/**
 * Exception thrown when the OAuth2 token endpoint rejects a JWT-bearer assertion or cannot be reached.
 *
 * <p>
 * The upstream response body is kept verbatim so the caller can see Google's own diagnostic (e.g.
 * {@code invalid_grant}, clock skew).
 */
public class TokenExchangeException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public TokenExchangeException(int status, String responseBody) {
        super("Failed to get access token: " + responseBody);
        this.status = status;
        this.responseBody = responseBody;
    }

    public TokenExchangeException(String message) {
        super(message);
        this.status = 0;
        this.responseBody = null;
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.responseBody = null;
    }

    /**
     * @return upstream HTTP status, or 0 when no response was received
     */
    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
