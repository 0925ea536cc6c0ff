package portico.adapter.in.rest;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.adapter.in.dto.RevokeTokenRequest;
import portico.adapter.in.dto.RevokeTokenResponse;
import portico.config.GatewayConfig;
import portico.core.port.in.TokenRevocationManagement;

/**
 * REST resource for token revocation administration.
 */
@Path("/admin/tokens")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class TokenRevocationResource {

    private static final Logger LOG = Logger.getLogger(TokenRevocationResource.class);

    private final TokenRevocationManagement revocationManagement;
    private final AdminAccess adminAccess;
    private final GatewayConfig config;
    private final Clock clock;

    @Inject
    public TokenRevocationResource(
            TokenRevocationManagement revocationManagement, AdminAccess adminAccess, GatewayConfig config, Clock clock) {
        this.revocationManagement = revocationManagement;
        this.adminAccess = adminAccess;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Revoke a specific token by JTI.
     *
     * <p>Without an {@code expiresAt} the entry is kept for the configured revocation TTL.
     *
     * @param jti the JWT ID to revoke
     * @param request optional request body with the token's expiry
     * @return 200 OK with the revocation entry
     */
    @POST
    @Path("/{jti}/revoke")
    public Uni<Response> revokeToken(
            @PathParam("jti") String jti,
            RevokeTokenRequest request,
            @Context ContainerRequestContext requestContext) {
        return adminAccess.requireAdmin(requestContext).flatMap(admin -> {
            var expiresAt = request != null && request.expiresAt() != null
                    ? request.expiresAt()
                    : clock.instant().plus(config.jwt().revocationTtl());
            LOG.infof("Revoking token: jti=%s, by=%s", jti, admin.userId());

            return revocationManagement.revoke(jti, expiresAt).map(v -> {
                LOG.infof("Token revoked: jti=%s", jti);
                return Response.ok(new RevokeTokenResponse(jti, "revoked", expiresAt.toString()))
                        .build();
            });
        });
    }
}
