package ledgerlink.sheets.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Request body for {@code POST /api/sheets/fetch}.
 *
 * @param spreadsheetId
 *            spreadsheet ID or full Google Sheets URL (required)
 * @param serviceAccountEmail
 *            optional service account email, used only together with {@code serviceAccountKey}
 * @param serviceAccountKey
 *            optional PEM private key, possibly with escaped newlines or collapsed onto one line
 * @param serviceAccountJson
 *            optional contents of a downloaded service account key file, alternative to the two fields above
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record SheetsFetchRequestType(String spreadsheetId, String serviceAccountEmail, String serviceAccountKey,
        String serviceAccountJson) {

    public SheetsFetchRequestType(String spreadsheetId) {
        this(spreadsheetId, null, null, null);
    }

    public SheetsFetchRequestType(String spreadsheetId, String serviceAccountEmail, String serviceAccountKey) {
        this(spreadsheetId, serviceAccountEmail, serviceAccountKey, null);
    }

    /**
     * @return true when both the email and key override fields carry text
     */
    public boolean hasInlineCredential() {
        return isPresent(serviceAccountEmail) && isPresent(serviceAccountKey);
    }

    public boolean hasKeyFile() {
        return isPresent(serviceAccountJson);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
