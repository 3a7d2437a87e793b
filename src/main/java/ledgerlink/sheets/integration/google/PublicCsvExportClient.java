package ledgerlink.sheets.integration.google;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import ledgerlink.sheets.api.types.SheetValuesType;
import ledgerlink.sheets.config.SheetsConfig;
import ledgerlink.sheets.exceptions.EmptyDataException;
import ledgerlink.sheets.exceptions.UpstreamFetchException;

/**
 * Unauthenticated fallback reader: downloads the public CSV export of a spreadsheet's first tab.
 *
 * <p>
 * Works only for sheets shared as "anyone with the link". Google answers the export URL with a redirect to
 * googleusercontent.com, which is followed.
 *
 * <p>
 * <b>Limitation:</b> the CSV is split on line breaks and commas only. Quoted fields are not understood, so a cell
 * containing a comma, a quote or a line break is split into several cells. Lines containing a double quote are
 * logged so the mis-parse is visible.
 */
@ApplicationScoped
public class PublicCsvExportClient {

    private static final Logger LOG = Logger.getLogger(PublicCsvExportClient.class);

    /** Bodies shorter than this are treated as an empty or invalid sheet rather than data. */
    public static final int MIN_CSV_LENGTH = 10;

    private final SheetsConfig config;
    private final HttpClient httpClient;

    @Inject
    public PublicCsvExportClient(SheetsConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder().connectTimeout(config.httpTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    /**
     * Download and split the first tab of a public spreadsheet.
     *
     * @param spreadsheetId
     *            validated spreadsheet ID
     * @return rows of cells in the same shape as the Sheets API values response
     * @throws UpstreamFetchException
     *             on a non-success status (404 not found, 401/403 not public, other generic)
     * @throws EmptyDataException
     *             if the body is shorter than {@link #MIN_CSV_LENGTH}
     */
    public SheetValuesType fetchCsv(String spreadsheetId) {
        String url = exportUrl(spreadsheetId);
        LOG.debugf("Fetching public CSV export: %s", url);

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(config.httpTimeout()).GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.errorf(e, "CSV export unreachable for spreadsheet %s", spreadsheetId);
            throw new UpstreamFetchException("Failed to fetch spreadsheet: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("Spreadsheet fetch interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.warnf("CSV export returned status %d for spreadsheet %s", status, spreadsheetId);
            throw new UpstreamFetchException(describeFailure(status), status, spreadsheetId);
        }

        String body = response.body();
        if (body == null || body.length() < MIN_CSV_LENGTH) {
            throw new EmptyDataException("Spreadsheet appears to be empty or invalid");
        }

        return new SheetValuesType(splitCsv(body));
    }

    /**
     * Export URL for the first tab (gid=0) of a spreadsheet.
     *
     * @param spreadsheetId
     *            spreadsheet ID
     * @return absolute export URL
     */
    public String exportUrl(String spreadsheetId) {
        return String.format("%s/spreadsheets/d/%s/export?format=csv&gid=0", config.exportBaseUri(), spreadsheetId);
    }

    /**
     * Split CSV text into rows and cells on line breaks and commas.
     *
     * <p>
     * Trailing blank lines are dropped; empty cells, including trailing ones, are kept.
     *
     * @param csv
     *            CSV text
     * @return rows of cells
     */
    static List<List<String>> splitCsv(String csv) {
        List<List<String>> rows = new ArrayList<>();
        for (String line : csv.split("\\r?\\n")) {
            if (line.indexOf('"') >= 0) {
                LOG.warnf("CSV line %d contains quotes; quoted fields are not supported and may be split",
                        rows.size() + 1);
            }
            rows.add(Arrays.asList(line.split(",", -1)));
        }
        return rows;
    }

    static String describeFailure(int status) {
        if (status == 404) {
            return "Spreadsheet not found. Check if the URL is correct.";
        }
        if (status == 403 || status == 401) {
            return "Access denied. Please provide service account credentials or make the spreadsheet public.";
        }
        return "Failed to fetch spreadsheet.";
    }
}
