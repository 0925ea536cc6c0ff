package portico.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Storage for revoked token identifiers.
 *
 * <p>Entries expire when the token they revoke would have expired.
 */
public interface TokenRevocationRepository {

    /**
     * Add a token identifier to the revocation list.
     *
     * @param jti       the token identifier
     * @param expiresAt when the revocation entry may be dropped
     */
    Uni<Void> revoke(String jti, Instant expiresAt);

    Uni<Boolean> isRevoked(String jti);
}
