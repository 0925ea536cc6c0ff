package portico.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.adapter.in.http.RequestIdFilter;
import portico.adapter.in.problem.GatewayProblem;
import portico.core.model.auth.AuthContext;
import portico.core.model.auth.TokenValidationResult;
import portico.core.service.auth.TokenValidationService;

/**
 * Guards the administrative endpoints: the caller needs a valid bearer token with role {@code admin}.
 */
@ApplicationScoped
public class AdminAccess {

    private static final Logger LOG = Logger.getLogger(AdminAccess.class);

    static final String ADMIN_ROLE = "admin";

    private final TokenValidationService tokenValidationService;

    @Inject
    public AdminAccess(TokenValidationService tokenValidationService) {
        this.tokenValidationService = tokenValidationService;
    }

    /**
     * Resolve the calling administrator.
     *
     * @return the caller's identity, or a failure carrying a 401, 403 or 503 problem
     */
    public Uni<AuthContext> requireAdmin(ContainerRequestContext requestContext) {
        var requestId = RequestIdFilter.resolve(requestContext.getHeaderString(RequestIdFilter.HEADER));
        return tokenValidationService
                .validate(requestContext.getHeaderString(HttpHeaders.AUTHORIZATION))
                .map(result -> {
                    if (result instanceof TokenValidationResult.Rejected rejected) {
                        throw GatewayProblem.unauthorized(rejected.reason(), rejected.detail(), requestId);
                    }
                    if (result instanceof TokenValidationResult.RevocationUnavailable) {
                        throw GatewayProblem.storeUnavailable("token-revocation", requestId);
                    }
                    var context = ((TokenValidationResult.Valid) result).context();
                    if (!context.hasRole(ADMIN_ROLE)) {
                        LOG.debugv("Admin access denied for user {0} with role {1}", context.userId(), context.role());
                        throw GatewayProblem.forbidden("Administrator role required", requestId);
                    }
                    return context;
                });
    }
}
