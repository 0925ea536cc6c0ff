package portico.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Caller identity derived from a verified bearer token.
 *
 * <p>Only exists for the duration of a request.
 *
 * @param userId    subject of the token
 * @param email     email claim, may be null
 * @param role      role claim, {@code user} when the token carries none
 * @param tokenId   the {@code jti} claim, may be null
 * @param expiresAt token expiry
 */
public record AuthContext(String userId, String email, String role, String tokenId, Instant expiresAt) {

    public static final String DEFAULT_ROLE = "user";

    public AuthContext {
        Objects.requireNonNull(userId, "userId must not be null");
        if (role == null || role.isBlank()) {
            role = DEFAULT_ROLE;
        }
    }

    public boolean hasRole(String expected) {
        return role.equalsIgnoreCase(expected);
    }
}
