package ledgerlink.sheets.services;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import ledgerlink.sheets.api.types.ServiceAccountCredential;
import ledgerlink.sheets.api.types.ServiceAccountKeyFileType;
import ledgerlink.sheets.api.types.SheetsFetchRequestType;
import ledgerlink.sheets.config.SheetsConfig;
import ledgerlink.sheets.exceptions.KeyFormatException;

/**
 * Chooses the credential source for a fetch request.
 *
 * <p>
 * Resolution order, first match wins:
 * <ol>
 * <li>Both {@code serviceAccountEmail} and {@code serviceAccountKey} in the request</li>
 * <li>A service account key file ({@code serviceAccountJson}) in the request</li>
 * <li>The default service account from {@link SheetsConfig}</li>
 * <li>No credential: public CSV export</li>
 * </ol>
 *
 * <p>
 * A caller can therefore override the deployment credential per call, and a deployment with nothing configured still
 * serves public sheets instead of failing.
 */
@ApplicationScoped
public class AuthStrategyResolver {

    private static final Logger LOG = Logger.getLogger(AuthStrategyResolver.class);

    private final SheetsConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public AuthStrategyResolver(SheetsConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Resolve the credential source for a request.
     *
     * @param request
     *            validated fetch request
     * @return chosen strategy with its credential (empty for {@link AuthStrategy#PUBLIC_EXPORT})
     * @throws KeyFormatException
     *             if a supplied key file is not valid JSON or lacks client_email/private_key
     */
    public ResolvedAuth resolve(SheetsFetchRequestType request) {
        if (request.hasInlineCredential()) {
            LOG.info("Using provided service account credentials");
            return new ResolvedAuth(AuthStrategy.REQUEST_CREDENTIAL, Optional.of(
                    new ServiceAccountCredential(request.serviceAccountEmail().trim(), request.serviceAccountKey())));
        }

        if (request.hasKeyFile()) {
            LOG.info("Using provided service account key file");
            return new ResolvedAuth(AuthStrategy.REQUEST_CREDENTIAL,
                    Optional.of(parseKeyFile(request.serviceAccountJson())));
        }

        Optional<ServiceAccountCredential> configured = config.defaultCredential();
        if (configured.isPresent()) {
            LOG.info("Using configured service account credentials");
            return new ResolvedAuth(AuthStrategy.CONFIGURED_CREDENTIAL, configured);
        }

        LOG.info("No service account credentials, falling back to public CSV export");
        return new ResolvedAuth(AuthStrategy.PUBLIC_EXPORT, Optional.empty());
    }

    /**
     * Read the email and private key out of a Google service account key file.
     *
     * @param json
     *            key file contents
     * @return credential from the file
     * @throws KeyFormatException
     *             if the JSON is malformed or the required fields are missing
     */
    ServiceAccountCredential parseKeyFile(String json) {
        ServiceAccountKeyFileType keyFile;
        try {
            keyFile = objectMapper.readValue(json, ServiceAccountKeyFileType.class);
        } catch (JsonProcessingException e) {
            throw new KeyFormatException("Invalid service account key file: not valid JSON", e);
        }

        if (isBlank(keyFile.clientEmail()) || isBlank(keyFile.privateKey())) {
            throw new KeyFormatException("Invalid service account key file: client_email and private_key are required");
        }
        if (keyFile.type() != null && !"service_account".equals(keyFile.type())) {
            LOG.warnf("Key file type is '%s', expected 'service_account'", keyFile.type());
        }

        return new ServiceAccountCredential(keyFile.clientEmail().trim(), keyFile.privateKey());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Outcome of credential resolution.
     *
     * @param strategy
     *            chosen strategy
     * @param credential
     *            credential to sign with; empty only for the public export
     */
    public record ResolvedAuth(AuthStrategy strategy, Optional<ServiceAccountCredential> credential) {
    }
}
