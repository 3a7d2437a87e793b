package ledgerlink.sheets.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import ledgerlink.sheets.api.types.ServiceAccountCredential;
import ledgerlink.sheets.api.types.SheetValuesType;
import ledgerlink.sheets.api.types.SheetsFetchRequestType;
import ledgerlink.sheets.exceptions.TokenExchangeException;
import ledgerlink.sheets.exceptions.ValidationException;
import ledgerlink.sheets.integration.google.GoogleSheetsValuesClient;
import ledgerlink.sheets.integration.google.GoogleTokenClient;
import ledgerlink.sheets.integration.google.PublicCsvExportClient;
import ledgerlink.sheets.observability.LoggingConfig;
import ledgerlink.sheets.observability.SheetsFetchMetrics;

/**
 * Retrieves spreadsheet values for import, authenticated when a service account is available and through the public
 * CSV export otherwise.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Extract the spreadsheet ID from the request (bare ID or URL)</li>
 * <li>Resolve the credential source via {@link AuthStrategyResolver}</li>
 * <li>With a credential: sign assertion, exchange for access token, read the values range</li>
 * <li>Without: download and split the public CSV export</li>
 * </ol>
 *
 * <p>
 * Steps run sequentially on the calling thread. Nothing is cached or retried, so two identical requests perform two
 * full chains against the upstream services.
 */
@ApplicationScoped
public class SpreadsheetFetchService {

    private static final Logger LOG = Logger.getLogger(SpreadsheetFetchService.class);

    /** Metric tag for failures raised while resolving credentials, before a strategy is known. */
    static final String UNRESOLVED_STRATEGY = "unresolved";

    private final AuthStrategyResolver resolver;
    private final GoogleTokenClient tokenClient;
    private final GoogleSheetsValuesClient valuesClient;
    private final PublicCsvExportClient csvExportClient;
    private final SheetsFetchMetrics metrics;
    private final ObjectMapper objectMapper;

    @Inject
    public SpreadsheetFetchService(AuthStrategyResolver resolver, GoogleTokenClient tokenClient,
            GoogleSheetsValuesClient valuesClient, PublicCsvExportClient csvExportClient, SheetsFetchMetrics metrics,
            ObjectMapper objectMapper) {
        this.resolver = resolver;
        this.tokenClient = tokenClient;
        this.valuesClient = valuesClient;
        this.csvExportClient = csvExportClient;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetch the values of a spreadsheet.
     *
     * @param request
     *            fetch request with a spreadsheet reference and optional credential overrides
     * @return JSON document with a {@code values} array of rows
     * @throws ValidationException
     *             if the spreadsheet reference is missing or malformed
     * @throws ledgerlink.sheets.exceptions.KeyFormatException
     *             if a supplied key file or private key is unusable
     */
    public JsonNode fetch(SheetsFetchRequestType request) {
        if (request == null || request.spreadsheetId() == null || request.spreadsheetId().isBlank()) {
            throw new ValidationException("spreadsheetId is required");
        }
        String spreadsheetId = SpreadsheetReferenceParser.parse(request.spreadsheetId());
        LoggingConfig.setSpreadsheetId(spreadsheetId);

        String strategy = UNRESOLVED_STRATEGY;
        try {
            AuthStrategyResolver.ResolvedAuth auth = resolver.resolve(request);
            strategy = auth.strategy().tag();
            LoggingConfig.setAuthStrategy(strategy);

            JsonNode result;
            if (auth.credential().isPresent()) {
                result = fetchAuthenticated(spreadsheetId, auth.credential().get());
            } else {
                result = fetchPublic(spreadsheetId);
            }
            metrics.incrementFetch(strategy, "success");
            return result;
        } catch (RuntimeException e) {
            metrics.incrementFetch(strategy, e.getClass().getSimpleName());
            throw e;
        }
    }

    private JsonNode fetchAuthenticated(String spreadsheetId, ServiceAccountCredential credential) {
        String accessToken;
        try {
            accessToken = tokenClient.getAccessToken(credential);
            metrics.incrementTokenExchange(true);
        } catch (TokenExchangeException e) {
            metrics.incrementTokenExchange(false);
            throw e;
        }

        LOG.infof("Fetching spreadsheet with service account: %s", spreadsheetId);
        JsonNode values = valuesClient.fetchValues(spreadsheetId, accessToken);
        LOG.info("Successfully fetched spreadsheet data");
        return values;
    }

    private JsonNode fetchPublic(String spreadsheetId) {
        SheetValuesType values = csvExportClient.fetchCsv(spreadsheetId);
        LOG.infof("Fetched public CSV export for %s: %d rows", spreadsheetId, values.values().size());
        return objectMapper.valueToTree(values);
    }
}
