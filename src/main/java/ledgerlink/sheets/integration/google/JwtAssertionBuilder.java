package ledgerlink.sheets.integration.google;

import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import ledgerlink.sheets.api.types.ServiceAccountCredential;
import ledgerlink.sheets.exceptions.SigningException;

/**
 * Builds the signed JWT assertion for the OAuth 2.0 JWT-bearer grant (RFC 7523).
 *
 * <p>
 * The JWT header is {@code {"typ":"JWT","alg":"RS256"}} and the claims are:
 *
 * <ul>
 * <li>iss: service account email</li>
 * <li>scope: https://www.googleapis.com/auth/spreadsheets.readonly</li>
 * <li>aud: https://oauth2.googleapis.com/token</li>
 * <li>iat: current Unix timestamp</li>
 * <li>exp: one hour after iat</li>
 * </ul>
 *
 * <p>
 * Google rejects assertions whose iat is outside a small clock-skew window, so a new assertion is signed for every
 * token exchange and iat is read from the clock at signing time.
 *
 * <p>
 * See: https://developers.google.com/identity/protocols/oauth2/service-account#authorizingrequests
 */
@ApplicationScoped
public class JwtAssertionBuilder {

    private static final Logger LOG = Logger.getLogger(JwtAssertionBuilder.class);

    public static final String SHEETS_READONLY_SCOPE = "https://www.googleapis.com/auth/spreadsheets.readonly";
    public static final String TOKEN_AUDIENCE = "https://oauth2.googleapis.com/token";
    public static final long ASSERTION_LIFETIME_SECONDS = 3600;

    private final PrivateKeyNormalizer normalizer;
    private final Clock clock;

    @Inject
    public JwtAssertionBuilder(PrivateKeyNormalizer normalizer) {
        this(normalizer, Clock.systemUTC());
    }

    JwtAssertionBuilder(PrivateKeyNormalizer normalizer, Clock clock) {
        this.normalizer = normalizer;
        this.clock = clock;
    }

    /**
     * Build and sign a JWT assertion for the given service account.
     *
     * @param credential
     *            service account email and PEM private key
     * @return compact JWS: base64url(header).base64url(claims).base64url(signature)
     * @throws ledgerlink.sheets.exceptions.KeyFormatException
     *             if the key has no PEM markers
     * @throws ledgerlink.sheets.exceptions.KeyTruncatedException
     *             if the key content is too short
     * @throws SigningException
     *             if the key material cannot be decoded, imported or used for RS256
     */
    public String buildAssertion(ServiceAccountCredential credential) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiration = now.plusSeconds(ASSERTION_LIFETIME_SECONDS);

        PrivateKey privateKey = decodePrivateKey(normalizer.normalize(credential.privateKeyPem()));

        try {
            String jwt = Jwts.builder().setHeaderParam("typ", "JWT").setIssuer(credential.clientEmail())
                    .claim("scope", SHEETS_READONLY_SCOPE).setAudience(TOKEN_AUDIENCE).setIssuedAt(Date.from(now))
                    .setExpiration(Date.from(expiration)).signWith(privateKey, SignatureAlgorithm.RS256).compact();

            LOG.debugf("Signed JWT assertion: iss=%s, iat=%s, exp=%s", credential.clientEmail(), now, expiration);

            return jwt;
        } catch (JwtException e) {
            LOG.errorf(e, "Failed to sign JWT assertion for %s", credential.clientEmail());
            throw new SigningException("Failed to sign JWT assertion: " + e.getMessage(), e);
        }
    }

    /**
     * Decode a normalized PEM block into an RSA private key.
     *
     * <p>
     * Strips the PEM markers and whitespace, decodes the base64 body to PKCS8 DER, and imports it with the RSA key
     * factory.
     *
     * @param pem
     *            normalized PEM text
     * @return RSA private key ready for RS256 signing
     * @throws SigningException
     *             if the body is not base64, not PKCS8, or not an RSA key
     */
    public PrivateKey decodePrivateKey(String pem) {
        String content = normalizer.extractContent(pem);

        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(content);
        } catch (IllegalArgumentException e) {
            throw new SigningException("Private key content is not valid base64", e);
        }
        LOG.debugf("Decoded private key DER length: %d", keyBytes.length);

        try {
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            return keyFactory.generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
        } catch (InvalidKeySpecException e) {
            throw new SigningException("Private key is not a PKCS8 RSA key: " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new SigningException("RSA key support unavailable", e);
        }
    }
}
