package portico.core.model.auth;

/**
 * Distinct reasons a request is rejected as unauthorized.
 */
public enum UnauthorizedReason {
    MISSING_TOKEN("Bearer token required"),
    INVALID_TOKEN("Bearer token is invalid"),
    EXPIRED_TOKEN("Bearer token has expired"),
    REVOKED_TOKEN("Bearer token has been revoked");

    private final String defaultMessage;

    UnauthorizedReason(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
