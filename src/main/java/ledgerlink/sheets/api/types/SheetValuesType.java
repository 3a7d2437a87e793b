package ledgerlink.sheets.api.types;

import java.util.List;

/**
 * Row/column grid returned to the import UI, shaped like the Sheets API values response.
 *
 * @param values
 *            rows of cell strings; rows may have different lengths
 */
public record SheetValuesType(List<List<String>> values) {
}
