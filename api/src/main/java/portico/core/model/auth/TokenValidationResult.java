package portico.core.model.auth;

/**
 * Result of validating a bearer token.
 */
public sealed interface TokenValidationResult {

    /**
     * Signature, expiry and revocation checks all passed.
     */
    record Valid(AuthContext context) implements TokenValidationResult {}

    /**
     * The token was rejected.
     *
     * @param reason why the token was rejected
     * @param detail human readable explanation, safe to return to the client
     */
    record Rejected(UnauthorizedReason reason, String detail) implements TokenValidationResult {
        public static Rejected of(UnauthorizedReason reason) {
            return new Rejected(reason, reason.defaultMessage());
        }
    }

    /**
     * The revocation list could not be consulted, so the token cannot be trusted.
     */
    record RevocationUnavailable(String detail) implements TokenValidationResult {}
}
