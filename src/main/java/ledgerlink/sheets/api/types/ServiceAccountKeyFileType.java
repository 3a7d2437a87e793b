package ledgerlink.sheets.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of a Google service account key file (the JSON downloaded from the Cloud console) needed for signing.
 *
 * @param type
 *            key file type, "service_account" for usable files
 * @param clientEmail
 *            service account email
 * @param privateKey
 *            PEM private key with escaped newlines as stored in the file
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record ServiceAccountKeyFileType(String type, @JsonProperty("client_email") String clientEmail,
        @JsonProperty("private_key") String privateKey) {
}
