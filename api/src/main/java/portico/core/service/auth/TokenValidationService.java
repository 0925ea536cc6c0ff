package portico.core.service.auth;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.auth.TokenValidationResult;
import portico.core.model.auth.UnauthorizedReason;
import portico.core.port.out.Metrics;
import portico.core.port.out.TokenRevocationRepository;
import portico.core.port.out.TokenVerifier;

/**
 * Validates bearer tokens from the {@code Authorization} header.
 *
 * <p>Signature and expiry are verified first; tokens carrying a {@code jti} are then
 * checked against the revocation list. If the revocation list cannot be consulted the
 * token is not trusted.
 */
@ApplicationScoped
public class TokenValidationService {

    private static final Logger LOG = Logger.getLogger(TokenValidationService.class);

    private static final String BEARER = "bearer";

    static final String FEATURE = "token-revocation";

    private final TokenVerifier verifier;
    private final TokenRevocationRepository revocationRepository;
    private final Metrics metrics;

    @Inject
    public TokenValidationService(
            TokenVerifier verifier, TokenRevocationRepository revocationRepository, Metrics metrics) {
        this.verifier = verifier;
        this.revocationRepository = revocationRepository;
        this.metrics = metrics;
    }

    /**
     * Validate the token carried by an {@code Authorization} header value.
     *
     * @param authorizationHeader the header value, may be null
     * @return the validation result; never a failed Uni
     */
    public Uni<TokenValidationResult> validate(String authorizationHeader) {
        var token = extractBearerToken(authorizationHeader);
        if (token == null) {
            return Uni.createFrom().item(reject(UnauthorizedReason.MISSING_TOKEN));
        }

        var verified = verifier.verify(token);
        if (!(verified instanceof TokenValidationResult.Valid valid)) {
            if (verified instanceof TokenValidationResult.Rejected rejected) {
                metrics.recordAuthFailure(rejected.reason().name());
            }
            return Uni.createFrom().item(verified);
        }

        var tokenId = valid.context().tokenId();
        if (tokenId == null || tokenId.isBlank()) {
            return Uni.createFrom().item(verified);
        }

        return revocationRepository
                .isRevoked(tokenId)
                .map(revoked -> {
                    if (Boolean.TRUE.equals(revoked)) {
                        LOG.debugf("Rejected revoked token %s for user %s", tokenId, valid.context().userId());
                        return reject(UnauthorizedReason.REVOKED_TOKEN);
                    }
                    return verified;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Revocation check failed, rejecting token: {0}", error.getMessage());
                    metrics.recordStoreFailure(FEATURE, "isRevoked");
                    return new TokenValidationResult.RevocationUnavailable("Token revocation list unavailable");
                });
    }

    private TokenValidationResult reject(UnauthorizedReason reason) {
        metrics.recordAuthFailure(reason.name());
        return TokenValidationResult.Rejected.of(reason);
    }

    static String extractBearerToken(String header) {
        if (header == null) {
            return null;
        }
        var trimmed = header.trim();
        var space = trimmed.indexOf(' ');
        if (space <= 0) {
            return null;
        }
        var scheme = trimmed.substring(0, space);
        if (!BEARER.equals(scheme.toLowerCase(Locale.ROOT))) {
            return null;
        }
        var token = trimmed.substring(space + 1).trim();
        return token.isEmpty() ? null : token;
    }
}
