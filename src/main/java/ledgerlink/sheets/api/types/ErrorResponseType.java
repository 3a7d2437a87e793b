package ledgerlink.sheets.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned by the fetch endpoint. Optional fields are omitted when not set.
 *
 * @param error
 *            human readable reason (not found, access denied, malformed credential, ...)
 * @param status
 *            upstream HTTP status when the failure came from Google
 * @param spreadsheetId
 *            spreadsheet the failure refers to, when known
 * @param details
 *            string form of the underlying exception for unexpected failures
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseType(String error, Integer status, String spreadsheetId, String details) {

    public static ErrorResponseType of(String error) {
        return new ErrorResponseType(error, null, null, null);
    }
}
