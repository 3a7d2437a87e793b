package ledgerlink.sheets.integration.google;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import ledgerlink.sheets.config.SheetsConfig;
import ledgerlink.sheets.exceptions.UpstreamFetchException;

/**
 * HTTP client for the Google Sheets API v4 values endpoint.
 *
 * <p>
 * Reads a fixed range of the first sheet with a bearer token obtained from {@link GoogleTokenClient}. The JSON body
 * is passed through unchanged; it is already shaped as {@code {"range": ..., "majorDimension": "ROWS", "values":
 * [[...]]}}. Google omits {@code values} entirely for an empty range.
 */
@ApplicationScoped
public class GoogleSheetsValuesClient {

    private static final Logger LOG = Logger.getLogger(GoogleSheetsValuesClient.class);

    public static final String VALUES_RANGE = "A1:Z100000";

    private final SheetsConfig config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Inject
    public GoogleSheetsValuesClient(SheetsConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(config.httpTimeout()).build();
    }

    /**
     * Fetch the values of {@link #VALUES_RANGE} from a spreadsheet.
     *
     * @param spreadsheetId
     *            validated spreadsheet ID
     * @param accessToken
     *            bearer token with the spreadsheets.readonly scope
     * @return the upstream JSON document
     * @throws UpstreamFetchException
     *             on any non-success status (404 not found, 403 not shared, other with the upstream body)
     */
    public JsonNode fetchValues(String spreadsheetId, String accessToken) {
        String url = String.format("%s/v4/spreadsheets/%s/values/%s", config.sheetsApiBaseUri(), spreadsheetId,
                VALUES_RANGE);
        LOG.debugf("Fetching spreadsheet values: %s", url);

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(config.httpTimeout())
                .header("Authorization", "Bearer " + accessToken).GET().build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.errorf(e, "Sheets API unreachable for spreadsheet %s", spreadsheetId);
            throw new UpstreamFetchException("Failed to fetch spreadsheet: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("Spreadsheet fetch interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.warnf("Sheets API returned status %d for spreadsheet %s", status, spreadsheetId);
            throw new UpstreamFetchException(describeFailure(status, response.body()), status);
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new UpstreamFetchException("Sheets API returned unreadable JSON", e);
        }
    }

    static String describeFailure(int status, String body) {
        return switch (status) {
            case 404 -> "Spreadsheet not found. Check if the ID is correct.";
            case 403 -> "Access denied. Make sure the spreadsheet is shared with the service account email.";
            default -> "Failed to fetch spreadsheet: " + body;
        };
    }
}
