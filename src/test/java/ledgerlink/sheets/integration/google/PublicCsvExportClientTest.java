package ledgerlink.sheets.integration.google;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import com.github.tomakehurst.wiremock.client.WireMock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ledgerlink.sheets.api.types.SheetValuesType;
import ledgerlink.sheets.config.TestSheetsConfigs;
import ledgerlink.sheets.exceptions.EmptyDataException;
import ledgerlink.sheets.exceptions.UpstreamFetchException;
import ledgerlink.sheets.testing.WireMockTestBase;

/**
 * Unit tests for {@link PublicCsvExportClient} against a stubbed export endpoint.
 */
class PublicCsvExportClientTest extends WireMockTestBase {

    private static final String SPREADSHEET_ID = "abc123";

    private PublicCsvExportClient client;

    @BeforeEach
    void setUp() {
        client = new PublicCsvExportClient(TestSheetsConfigs.pointingAt(baseUrl()));
    }

    @Test
    void testFetchCsv_success() {
        stubCsvExport(SPREADSHEET_ID, 200, "Date,Amount\n2025-01-01,10.00\n");

        SheetValuesType result = client.fetchCsv(SPREADSHEET_ID);

        assertEquals(List.of(List.of("Date", "Amount"), List.of("2025-01-01", "10.00")), result.values());
    }

    @Test
    void testFetchCsv_minimalTwoRowSheet() {
        stubCsvExport(SPREADSHEET_ID, 200, "a,b,c\n1,2,3");

        SheetValuesType result = client.fetchCsv(SPREADSHEET_ID);

        assertEquals(List.of(List.of("a", "b", "c"), List.of("1", "2", "3")), result.values());
    }

    @Test
    void testFetchCsv_crlfLineEndings() {
        stubCsvExport(SPREADSHEET_ID, 200, "Date,Amount\r\n2025-01-01,10.00\r\n");

        SheetValuesType result = client.fetchCsv(SPREADSHEET_ID);

        assertEquals(List.of(List.of("Date", "Amount"), List.of("2025-01-01", "10.00")), result.values());
    }

    @Test
    void testFetchCsv_redirectFollowed() {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(exportPath(SPREADSHEET_ID)))
                .willReturn(WireMock.aResponse().withStatus(307).withHeader("Location", "/export-content/abc123")));
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/export-content/abc123"))
                .willReturn(WireMock.aResponse().withStatus(200).withBody("Name,Total\nRent,1200\n")));

        SheetValuesType result = client.fetchCsv(SPREADSHEET_ID);

        assertEquals(List.of("Rent", "1200"), result.values().get(1));
    }

    @Test
    void testFetchCsv_forbidden() {
        stubCsvExport(SPREADSHEET_ID, 403, "");

        UpstreamFetchException e = assertThrows(UpstreamFetchException.class, () -> client.fetchCsv(SPREADSHEET_ID));

        assertEquals(403, e.getStatus());
        assertEquals(SPREADSHEET_ID, e.getSpreadsheetId());
        assertEquals("Access denied. Please provide service account credentials or make the spreadsheet public.",
                e.getMessage());
    }

    @Test
    void testFetchCsv_unauthorized() {
        stubCsvExport(SPREADSHEET_ID, 401, "");

        UpstreamFetchException e = assertThrows(UpstreamFetchException.class, () -> client.fetchCsv(SPREADSHEET_ID));

        assertEquals(401, e.getStatus());
        assertEquals("Access denied. Please provide service account credentials or make the spreadsheet public.",
                e.getMessage());
    }

    @Test
    void testFetchCsv_notFound() {
        stubCsvExport(SPREADSHEET_ID, 404, "");

        UpstreamFetchException e = assertThrows(UpstreamFetchException.class, () -> client.fetchCsv(SPREADSHEET_ID));

        assertEquals(404, e.getStatus());
        assertEquals("Spreadsheet not found. Check if the URL is correct.", e.getMessage());
    }

    @Test
    void testFetchCsv_serverErrorGenericMessage() {
        stubCsvExport(SPREADSHEET_ID, 500, "oops");

        UpstreamFetchException e = assertThrows(UpstreamFetchException.class, () -> client.fetchCsv(SPREADSHEET_ID));

        assertEquals(500, e.getStatus());
        assertEquals("Failed to fetch spreadsheet.", e.getMessage());
    }

    @Test
    void testFetchCsv_shortBodyIsEmptyData() {
        stubCsvExport(SPREADSHEET_ID, 200, "a,b");

        EmptyDataException e = assertThrows(EmptyDataException.class, () -> client.fetchCsv(SPREADSHEET_ID));

        assertEquals("Spreadsheet appears to be empty or invalid", e.getMessage());
    }

    @Test
    void testExportUrl() {
        assertEquals(baseUrl() + "/spreadsheets/d/abc123/export?format=csv&gid=0", client.exportUrl("abc123"));
    }

    @Test
    void testSplitCsv_keepsEmptyCellsAndDropsTrailingBlankLines() {
        List<List<String>> rows = PublicCsvExportClient.splitCsv("a,,c,\n,b,\n\n\n");

        assertEquals(List.of(List.of("a", "", "c", ""), List.of("", "b", "")), rows);
    }

    @Test
    void testSplitCsv_quotedCommaIsSplit() {
        List<List<String>> rows = PublicCsvExportClient.splitCsv("\"Coffee, large\",4.50");

        assertEquals(List.of(List.of("\"Coffee", " large\"", "4.50")), rows);
    }
}
