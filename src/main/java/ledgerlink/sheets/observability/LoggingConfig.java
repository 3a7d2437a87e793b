package ledgerlink.sheets.observability;

import org.jboss.logging.MDC;

/**
 * Standard MDC field names for spreadsheet fetch logging.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code spreadsheet_id} - spreadsheet being fetched</li>
 * <li>{@code auth_strategy} - credential source chosen for the request</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> MDC is ThreadLocal. {@link #clearMDC()} must run at the end of every request so pooled worker
 * threads do not carry stale fields.
 */
public final class LoggingConfig {

    public static final String MDC_SPREADSHEET_ID = "spreadsheet_id";

    public static final String MDC_AUTH_STRATEGY = "auth_strategy";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    public static void setSpreadsheetId(String spreadsheetId) {
        if (spreadsheetId != null) {
            MDC.put(MDC_SPREADSHEET_ID, spreadsheetId);
        }
    }

    public static void setAuthStrategy(String authStrategy) {
        if (authStrategy != null) {
            MDC.put(MDC_AUTH_STRATEGY, authStrategy);
        }
    }

    public static void clearMDC() {
        MDC.remove(MDC_SPREADSHEET_ID);
        MDC.remove(MDC_AUTH_STRATEGY);
    }
}
