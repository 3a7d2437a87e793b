package ledgerlink.sheets.services;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ledgerlink.sheets.exceptions.ValidationException;

/**
 * Extracts a spreadsheet ID from either a bare ID or a Google Sheets URL
 * ({@code https://docs.google.com/spreadsheets/d/<id>/edit#gid=0}).
 *
 * <p>
 * The result is restricted to the ID alphabet so it can be placed in request paths without escaping.
 */
public final class SpreadsheetReferenceParser {

    private static final Pattern URL_ID_PATTERN = Pattern.compile("/d/([a-zA-Z0-9-_]+)");
    private static final Pattern BARE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9-_]+$");

    private SpreadsheetReferenceParser() {
    }

    /**
     * @param reference
     *            bare ID or URL, non-blank
     * @return spreadsheet ID
     * @throws ValidationException
     *             if the reference is neither
     */
    public static String parse(String reference) {
        String trimmed = reference.trim();

        Matcher matcher = URL_ID_PATTERN.matcher(trimmed);
        if (matcher.find()) {
            return matcher.group(1);
        }
        if (BARE_ID_PATTERN.matcher(trimmed).matches()) {
            return trimmed;
        }
        throw new ValidationException("Invalid Google Sheets URL or spreadsheet ID");
    }
}
