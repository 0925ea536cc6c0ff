package portico.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import portico.config.GatewayConfig;
import portico.core.model.auth.AuthContext;
import portico.core.model.auth.TokenValidationResult;
import portico.core.model.auth.UnauthorizedReason;
import portico.core.port.out.TokenVerifier;

/**
 * Verifies HMAC-signed JWTs using jose4j.
 *
 * <p>Tokens must carry an {@code exp} claim and be signed with the configured algorithm.
 * The caller id is taken from {@code sub}, or from an {@code id} claim for tokens issued
 * by the auth service without a subject.
 */
@ApplicationScoped
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(JwtTokenVerifier.class);

    private static final Set<String> HMAC_ALGORITHMS = Set.of(
            AlgorithmIdentifiers.HMAC_SHA256, AlgorithmIdentifiers.HMAC_SHA384, AlgorithmIdentifiers.HMAC_SHA512);

    private static final int RECOMMENDED_SECRET_BYTES = 32;

    private final JwtConsumer consumer;

    @Inject
    public JwtTokenVerifier(GatewayConfig config) {
        this(config.jwt().secret(), config.jwt().algorithm(), config.jwt().issuer(), config.jwt().clockSkew());
    }

    public JwtTokenVerifier(String secret, String algorithm, Optional<String> issuer, Duration clockSkew) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("portico.jwt.secret must be set");
        }
        if (!HMAC_ALGORITHMS.contains(algorithm)) {
            throw new IllegalStateException(
                    "portico.jwt.algorithm must be one of " + HMAC_ALGORITHMS + ", got " + algorithm);
        }
        var keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < RECOMMENDED_SECRET_BYTES) {
            LOG.warnv(
                    "portico.jwt.secret is shorter than {0} bytes; use a longer secret in production",
                    RECOMMENDED_SECRET_BYTES);
        }

        var builder = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                .setVerificationKey(new HmacKey(keyBytes))
                .setRelaxVerificationKeyValidation()
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, algorithm))
                .setSkipDefaultAudienceValidation();
        issuer.ifPresent(builder::setExpectedIssuer);
        this.consumer = builder.build();
    }

    @Override
    public TokenValidationResult verify(String token) {
        try {
            var claims = consumer.processToClaims(token);
            return toResult(claims);
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            if (e.hasExpired()) {
                return TokenValidationResult.Rejected.of(UnauthorizedReason.EXPIRED_TOKEN);
            }
            return new TokenValidationResult.Rejected(UnauthorizedReason.INVALID_TOKEN, summarizeJwtError(e));
        }
    }

    private TokenValidationResult toResult(JwtClaims claims) {
        try {
            var userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                userId = claimAsString(claims, "id");
            }
            if (userId == null || userId.isBlank()) {
                return new TokenValidationResult.Rejected(UnauthorizedReason.INVALID_TOKEN, "Token has no subject");
            }
            var expiresAt = Instant.ofEpochMilli(claims.getExpirationTime().getValueInMillis());
            var context = new AuthContext(
                    userId, claimAsString(claims, "email"), claimAsString(claims, "role"), claims.getJwtId(), expiresAt);
            return new TokenValidationResult.Valid(context);
        } catch (MalformedClaimException e) {
            return new TokenValidationResult.Rejected(UnauthorizedReason.INVALID_TOKEN, "Malformed token claims");
        }
    }

    private static String claimAsString(JwtClaims claims, String name) {
        var value = claims.getClaimValue(name);
        return value != null ? value.toString() : null;
    }

    private static String summarizeJwtError(InvalidJwtException e) {
        var message = e.getMessage();
        if (message != null && message.contains("issuer")) {
            return "Invalid token issuer";
        }
        if (message != null && message.contains("signature")) {
            return "Invalid token signature";
        }
        return UnauthorizedReason.INVALID_TOKEN.defaultMessage();
    }
}
