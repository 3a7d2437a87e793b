package ledgerlink.sheets.exceptions;

/**
 * Exception thrown when the decoded key material cannot be used to sign a JWT assertion (invalid base64, not PKCS8,
 * not an RSA key, or rejected by the signer).
 */
public class SigningException extends RuntimeException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
