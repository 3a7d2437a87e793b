package ledgerlink.sheets.integration.google;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import ledgerlink.sheets.api.types.GoogleTokenResponseType;
import ledgerlink.sheets.api.types.ServiceAccountCredential;
import ledgerlink.sheets.config.SheetsConfig;
import ledgerlink.sheets.exceptions.TokenExchangeException;

/**
 * Exchanges a signed JWT assertion for a short-lived Google access token.
 *
 * <p>
 * Calls POST https://oauth2.googleapis.com/token with form-encoded parameters:
 *
 * <ul>
 * <li>grant_type: urn:ietf:params:oauth:grant-type:jwt-bearer</li>
 * <li>assertion: the signed JWT</li>
 * </ul>
 *
 * <p>
 * Tokens are not cached: every call signs a new assertion and performs a new exchange.
 */
@ApplicationScoped
public class GoogleTokenClient {

    private static final Logger LOG = Logger.getLogger(GoogleTokenClient.class);

    public static final String JWT_BEARER_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";

    private final SheetsConfig config;
    private final ObjectMapper objectMapper;
    private final JwtAssertionBuilder assertionBuilder;
    private final HttpClient httpClient;

    @Inject
    public GoogleTokenClient(SheetsConfig config, ObjectMapper objectMapper, JwtAssertionBuilder assertionBuilder) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.assertionBuilder = assertionBuilder;
        this.httpClient = HttpClient.newBuilder().connectTimeout(config.httpTimeout()).build();
    }

    /**
     * Sign a fresh assertion for the credential and exchange it for an access token.
     *
     * @param credential
     *            service account email and private key
     * @return bearer access token
     */
    public String getAccessToken(ServiceAccountCredential credential) {
        String assertion = assertionBuilder.buildAssertion(credential);
        return exchange(assertion);
    }

    /**
     * Exchange a signed assertion for an access token.
     *
     * @param assertion
     *            compact signed JWT
     * @return the {@code access_token} field of the token response
     * @throws TokenExchangeException
     *             if the endpoint answers with a non-success status (body kept verbatim), returns no token, or cannot
     *             be reached
     */
    public String exchange(String assertion) {
        String form = "grant_type=" + URLEncoder.encode(JWT_BEARER_GRANT_TYPE, StandardCharsets.UTF_8) + "&assertion="
                + URLEncoder.encode(assertion, StandardCharsets.UTF_8);

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(config.tokenUri()))
                .timeout(config.httpTimeout()).header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form)).build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.errorf(e, "Token endpoint unreachable: %s", config.tokenUri());
            throw new TokenExchangeException("Failed to get access token: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenExchangeException("Token exchange interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            LOG.warnf("Token endpoint returned status %d", response.statusCode());
            throw new TokenExchangeException(response.statusCode(), response.body());
        }

        GoogleTokenResponseType token;
        try {
            token = objectMapper.readValue(response.body(), GoogleTokenResponseType.class);
        } catch (IOException e) {
            throw new TokenExchangeException("Token endpoint returned unreadable JSON", e);
        }

        if (token.accessToken() == null || token.accessToken().isBlank()) {
            throw new TokenExchangeException("Token endpoint response did not contain an access_token");
        }

        LOG.debugf("Obtained access token (expires_in=%d)", token.expiresIn());
        return token.accessToken();
    }
}
