package ledgerlink.sheets.services;

import java.util.Locale;

/**
 * Credential source chosen for a fetch request, in resolution order.
 */
public enum AuthStrategy {

    /** Service account supplied in the request body (separate fields or key file). */
    REQUEST_CREDENTIAL,

    /** Deployment default service account from configuration. */
    CONFIGURED_CREDENTIAL,

    /** No credential: unauthenticated public CSV export of the first tab. */
    PUBLIC_EXPORT;

    /**
     * @return lowercase tag value for logs and metrics
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
