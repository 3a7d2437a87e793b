package ledgerlink.sheets.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import ledgerlink.sheets.config.SheetsConfig;
import ledgerlink.sheets.services.AuthStrategy;

/**
 * Liveness endpoint for the import UI and deployment checks.
 *
 * <p>
 * Also reports which strategy a request without its own credential will use, so an operator can tell whether the
 * deployment's default service account was picked up. The credential itself is never exposed.
 */
@Path("/api/health")
@Tag(
        name = "Health",
        description = "Service status and default credential availability")
public class HealthResource {

    private final SheetsConfig config;

    @Inject
    public HealthResource(SheetsConfig config) {
        this.config = config;
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Service status",
            description = "Reports that the service is up and whether a default service account is configured")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Service is running",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class)))})
    public HealthResponse health() {
        boolean configured = config.defaultCredential().isPresent();
        AuthStrategy fallback = configured ? AuthStrategy.CONFIGURED_CREDENTIAL : AuthStrategy.PUBLIC_EXPORT;
        return new HealthResponse("UP", configured, fallback.tag());
    }

    /**
     * @param status
     *            always "UP" when the service answers
     * @param defaultCredentialConfigured
     *            true when both the default service account email and key are set
     * @param defaultStrategy
     *            strategy tag used for requests that carry no credential
     */
    public record HealthResponse(String status, boolean defaultCredentialConfigured, String defaultStrategy) {
    }
}
