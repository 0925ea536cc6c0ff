package portico.core.port.in;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Administrative revocation of issued tokens.
 */
public interface TokenRevocationManagement {

    /**
     * Revoke a token by its identifier until it would have expired anyway.
     *
     * @param jti       the token identifier
     * @param expiresAt when the token expires; the entry is kept until then
     */
    Uni<Void> revoke(String jti, Instant expiresAt);

    Uni<Boolean> isRevoked(String jti);
}
