package ledgerlink.sheets.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Google OAuth 2.0 token response for the JWT-bearer grant.
 *
 * <p>
 * Returned by POST https://oauth2.googleapis.com/token. No refresh token is issued for this grant.
 *
 * @param accessToken
 *            the access token for Sheets API requests
 * @param expiresIn
 *            token lifetime in seconds (typically 3599)
 * @param tokenType
 *            token type (always "Bearer")
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record GoogleTokenResponseType(@JsonProperty("access_token") String accessToken,
        @JsonProperty("expires_in") int expiresIn, @JsonProperty("token_type") String tokenType) {
}
