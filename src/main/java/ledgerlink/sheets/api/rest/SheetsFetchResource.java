package ledgerlink.sheets.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.RequestBody;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.inject.Inject;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import ledgerlink.sheets.api.types.ErrorResponseType;
import ledgerlink.sheets.api.types.SheetValuesType;
import ledgerlink.sheets.api.types.SheetsFetchRequestType;
import ledgerlink.sheets.exceptions.EmptyDataException;
import ledgerlink.sheets.exceptions.UpstreamFetchException;
import ledgerlink.sheets.exceptions.ValidationException;
import ledgerlink.sheets.observability.LoggingConfig;
import ledgerlink.sheets.services.SpreadsheetFetchService;

/**
 * REST endpoint the import UI calls to pull rows out of a Google spreadsheet.
 *
 * <p>
 * Every failure is turned into an {@link ErrorResponseType} here; nothing escapes as an unhandled exception:
 * <ul>
 * <li>body that is not a JSON request object (syntax error, wrong field type, other content type): 400 with
 * details</li>
 * <li>missing or malformed spreadsheet reference: 400</li>
 * <li>upstream not found / access denied / other: the upstream status</li>
 * <li>empty public export: 400</li>
 * <li>malformed key, signing failure, rejected assertion, anything unexpected: 500 with details</li>
 * </ul>
 *
 * <p>
 * The body is read as text and bound inside the handler, so binding failures produce the same error shape as every
 * other failure.
 *
 * <p>
 * CORS headers are added by {@link ledgerlink.sheets.api.filters.CorsResponseFilter}.
 */
@Path("/api/sheets/fetch")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Sheets",
        description = "Spreadsheet data acquisition for import")
public class SheetsFetchResource {

    private static final Logger LOG = Logger.getLogger(SheetsFetchResource.class);

    static final String INVALID_BODY_MESSAGE = "Invalid request body: expected a JSON object";

    @Inject
    SpreadsheetFetchService fetchService;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Fetch spreadsheet values.
     *
     * @param body
     *            JSON {@link SheetsFetchRequestType}: spreadsheet reference and optional service account override
     * @return values grid, or an error body
     */
    @POST
    @Operation(
            summary = "Fetch spreadsheet values",
            description = "Reads a spreadsheet with a service account when one is supplied or configured, otherwise "
                    + "through the public CSV export of the first tab")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Values fetched",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = SheetValuesType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid body, missing spreadsheetId or empty spreadsheet",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "403",
                            description = "Spreadsheet not shared with the service account, or not public",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Spreadsheet not found",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "500",
                            description = "Malformed credential, token exchange failure, or server error",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class)))})
    public Response fetch(@RequestBody(
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = SheetsFetchRequestType.class))) String body) {
        try {
            JsonNode values = fetchService.fetch(parseRequest(body));
            return Response.ok(values).build();
        } catch (JsonProcessingException e) {
            LOG.debugf("Unreadable fetch request body: %s", e.getOriginalMessage());
            return error(Response.Status.BAD_REQUEST.getStatusCode(),
                    new ErrorResponseType(INVALID_BODY_MESSAGE, null, null, e.toString()));
        } catch (ValidationException e) {
            LOG.debugf("Rejected fetch request: %s", e.getMessage());
            return error(Response.Status.BAD_REQUEST.getStatusCode(), ErrorResponseType.of(e.getMessage()));
        } catch (UpstreamFetchException e) {
            int status = e.getStatus() >= 400 && e.getStatus() < 600 ? e.getStatus()
                    : Response.Status.BAD_GATEWAY.getStatusCode();
            return error(status, new ErrorResponseType(e.getMessage(), e.getStatus() > 0 ? e.getStatus() : null,
                    e.getSpreadsheetId(), null));
        } catch (EmptyDataException e) {
            return error(Response.Status.BAD_REQUEST.getStatusCode(), ErrorResponseType.of(e.getMessage()));
        } catch (Exception e) {
            LOG.errorf(e, "Spreadsheet fetch failed");
            String message = e.getMessage() != null ? e.getMessage() : "Internal server error";
            return error(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                    new ErrorResponseType(message, null, null, e.toString()));
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * CORS pre-flight: answered with 200 and no body.
     */
    @OPTIONS
    public Response preflight() {
        return Response.ok().build();
    }

    /**
     * @return the bound request, or {@code null} for an empty body or a JSON {@code null}
     */
    private SheetsFetchRequestType parseRequest(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return null;
        }
        return objectMapper.readValue(body, SheetsFetchRequestType.class);
    }

    private Response error(int status, ErrorResponseType body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
