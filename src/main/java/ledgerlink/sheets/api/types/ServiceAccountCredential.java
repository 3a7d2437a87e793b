package ledgerlink.sheets.api.types;

/**
 * Service account identity used to sign a JWT assertion. Lives for one request and is never persisted.
 *
 * @param clientEmail
 *            service account email, becomes the {@code iss} claim
 * @param privateKeyPem
 *            PKCS8 RSA private key in PEM form, in whatever formatting the caller supplied
 */
public record ServiceAccountCredential(String clientEmail, String privateKeyPem) {

    @Override
    public String toString() {
        // keep key material out of logs and error details
        return "ServiceAccountCredential[clientEmail=" + clientEmail + "]";
    }
}
