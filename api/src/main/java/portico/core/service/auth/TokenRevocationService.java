package portico.core.service.auth;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.port.in.TokenRevocationManagement;
import portico.core.port.out.TokenRevocationRepository;

/**
 * Adds tokens to the revocation list.
 *
 * <p>Entries are kept until the token's own expiry, after which the token would be
 * rejected anyway.
 */
@ApplicationScoped
public class TokenRevocationService implements TokenRevocationManagement {

    private static final Logger LOG = Logger.getLogger(TokenRevocationService.class);

    private final TokenRevocationRepository repository;
    private final Clock clock;

    @Inject
    public TokenRevocationService(TokenRevocationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Uni<Void> revoke(String jti, Instant expiresAt) {
        if (jti == null || jti.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Token identifier is required"));
        }
        if (expiresAt == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("Token expiry is required"));
        }
        if (!expiresAt.isAfter(clock.instant())) {
            LOG.debugf("Skipping revocation of already-expired token %s", jti);
            return Uni.createFrom().voidItem();
        }
        return repository.revoke(jti, expiresAt).invoke(() -> LOG.infov("Revoked token {0} until {1}", jti, expiresAt));
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        return repository.isRevoked(jti);
    }
}
