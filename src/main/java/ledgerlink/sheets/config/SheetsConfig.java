package ledgerlink.sheets.config;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import ledgerlink.sheets.api.types.ServiceAccountCredential;

/**
 * Deployment-wide settings for spreadsheet acquisition.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code sheets.service-account.email} - default service account email (from GOOGLE_SERVICE_ACCOUNT_EMAIL)</li>
 * <li>{@code sheets.service-account.key} - default PEM private key (from GOOGLE_SERVICE_ACCOUNT_KEY)</li>
 * <li>{@code sheets.oauth.token-uri} - OAuth2 token endpoint (default: https://oauth2.googleapis.com/token)</li>
 * <li>{@code sheets.api.base-uri} - Sheets API host (default: https://sheets.googleapis.com)</li>
 * <li>{@code sheets.export.base-uri} - public export host (default: https://docs.google.com)</li>
 * <li>{@code sheets.http.timeout-seconds} - connect and request timeout (default: 30)</li>
 * </ul>
 *
 * <p>
 * The endpoint overrides exist so tests can point the clients at a stub server; production leaves them unset.
 */
@ApplicationScoped
public class SheetsConfig {

    public static final String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";

    @ConfigProperty(
            name = "sheets.service-account.email")
    Optional<String> serviceAccountEmail = Optional.empty();

    @ConfigProperty(
            name = "sheets.service-account.key")
    Optional<String> serviceAccountKey = Optional.empty();

    @ConfigProperty(
            name = "sheets.oauth.token-uri",
            defaultValue = DEFAULT_TOKEN_URI)
    String tokenUri = DEFAULT_TOKEN_URI;

    @ConfigProperty(
            name = "sheets.api.base-uri",
            defaultValue = "https://sheets.googleapis.com")
    String sheetsApiBaseUri = "https://sheets.googleapis.com";

    @ConfigProperty(
            name = "sheets.export.base-uri",
            defaultValue = "https://docs.google.com")
    String exportBaseUri = "https://docs.google.com";

    @ConfigProperty(
            name = "sheets.http.timeout-seconds",
            defaultValue = "30")
    int timeoutSeconds = 30;

    /**
     * Returns the deployment's default credential when both email and key are configured.
     *
     * @return configured credential, or empty when either half is missing or blank
     */
    public Optional<ServiceAccountCredential> defaultCredential() {
        String email = serviceAccountEmail.filter(value -> !value.isBlank()).orElse(null);
        String key = serviceAccountKey.filter(value -> !value.isBlank()).orElse(null);
        if (email == null || key == null) {
            return Optional.empty();
        }
        return Optional.of(new ServiceAccountCredential(email, key));
    }

    public String tokenUri() {
        return tokenUri;
    }

    public String sheetsApiBaseUri() {
        return stripTrailingSlash(sheetsApiBaseUri);
    }

    public String exportBaseUri() {
        return stripTrailingSlash(exportBaseUri);
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    private static String stripTrailingSlash(String uri) {
        return uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
    }
}
