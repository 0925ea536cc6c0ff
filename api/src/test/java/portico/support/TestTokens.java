package portico.support;

import java.nio.charset.StandardCharsets;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

/**
 * Builds signed HS256 tokens for tests.
 */
public final class TestTokens {

    public static final String SECRET = "test-secret-test-secret-test-secret-0123";

    private final JwtClaims claims = new JwtClaims();
    private String secret = SECRET;
    private String algorithm = AlgorithmIdentifiers.HMAC_SHA256;

    private TestTokens() {
        claims.setExpirationTimeMinutesInTheFuture(15);
        claims.setIssuedAtToNow();
    }

    public static TestTokens forUser(String userId) {
        var tokens = new TestTokens();
        tokens.claims.setSubject(userId);
        return tokens;
    }

    public static TestTokens withoutSubject() {
        return new TestTokens();
    }

    public TestTokens claim(String name, Object value) {
        claims.setClaim(name, value);
        return this;
    }

    public TestTokens email(String email) {
        return claim("email", email);
    }

    public TestTokens role(String role) {
        return claim("role", role);
    }

    public TestTokens jti(String jti) {
        claims.setJwtId(jti);
        return this;
    }

    public TestTokens issuer(String issuer) {
        claims.setIssuer(issuer);
        return this;
    }

    public TestTokens expiredSecondsAgo(long seconds) {
        var expiredAt = NumericDate.now().getValue() - seconds;
        claims.setIssuedAt(NumericDate.fromSeconds(expiredAt - 900));
        claims.setExpirationTime(NumericDate.fromSeconds(expiredAt));
        return this;
    }

    public TestTokens signedWith(String otherSecret) {
        this.secret = otherSecret;
        return this;
    }

    public TestTokens algorithm(String jwsAlgorithm) {
        this.algorithm = jwsAlgorithm;
        return this;
    }

    public String sign() {
        var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(algorithm);
        jws.setKey(new HmacKey(secret.getBytes(StandardCharsets.UTF_8)));
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Could not sign test token", e);
        }
    }

    public String bearer() {
        return "Bearer " + sign();
    }
}
