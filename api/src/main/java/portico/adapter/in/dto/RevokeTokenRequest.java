package portico.adapter.in.dto;

import java.time.Instant;

/**
 * DTO for token revocation requests.
 *
 * @param expiresAt when the token expires (optional, defaults to the configured revocation TTL)
 */
public record RevokeTokenRequest(Instant expiresAt) {}
