package portico.core.port.out;

import portico.core.model.auth.TokenValidationResult;

/**
 * Verifies the signature and expiry of a bearer token and extracts its claims.
 *
 * <p>Revocation is not checked here.
 */
public interface TokenVerifier {

    /**
     * @param token the raw compact token, without the {@code Bearer} prefix
     * @return {@code Valid} with the caller identity, or {@code Rejected}
     */
    TokenValidationResult verify(String token);
}
