package ledgerlink.sheets.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import ledgerlink.sheets.api.types.ServiceAccountCredential;

/**
 * Unit tests for {@link SheetsConfig}.
 */
class SheetsConfigTest {

    @Test
    void testDefaultCredential_bothConfigured() {
        SheetsConfig config = TestSheetsConfigs.withDefaultCredential("sa@example.iam.gserviceaccount.com", "KEY");

        Optional<ServiceAccountCredential> credential = config.defaultCredential();

        assertTrue(credential.isPresent());
        assertEquals("sa@example.iam.gserviceaccount.com", credential.get().clientEmail());
        assertEquals("KEY", credential.get().privateKeyPem());
    }

    @Test
    void testDefaultCredential_emptyWhenKeyMissing() {
        SheetsConfig config = TestSheetsConfigs.withDefaultCredential("sa@example.iam.gserviceaccount.com", null);

        assertFalse(config.defaultCredential().isPresent());
    }

    @Test
    void testDefaultCredential_emptyWhenEmailBlank() {
        SheetsConfig config = TestSheetsConfigs.withDefaultCredential("   ", "KEY");

        assertFalse(config.defaultCredential().isPresent());
    }

    @Test
    void testDefaults() {
        SheetsConfig config = new SheetsConfig();

        assertEquals(SheetsConfig.DEFAULT_TOKEN_URI, config.tokenUri());
        assertEquals("https://sheets.googleapis.com", config.sheetsApiBaseUri());
        assertEquals("https://docs.google.com", config.exportBaseUri());
        assertEquals(Duration.ofSeconds(30), config.httpTimeout());
        assertFalse(config.defaultCredential().isPresent());
    }

    @Test
    void testBaseUris_trailingSlashStripped() {
        SheetsConfig config = TestSheetsConfigs.pointingAt("http://localhost:8089/");

        assertEquals("http://localhost:8089", config.sheetsApiBaseUri());
        assertEquals("http://localhost:8089", config.exportBaseUri());
    }
}
