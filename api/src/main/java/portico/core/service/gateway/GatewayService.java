package portico.core.service.gateway;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.gateway.BackendFailure;
import portico.core.model.gateway.GatewayExchange;
import portico.core.model.gateway.GatewayRequest;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.StageOutcome;
import portico.core.port.in.GatewayUseCase;
import portico.core.port.out.Metrics;

/**
 * Handle gateway requests by running them through an ordered pipeline of stages:
 * <ol>
 *   <li>route matching</li>
 *   <li>rate limiting</li>
 *   <li>authentication</li>
 *   <li>proxy forwarding</li>
 * </ol>
 *
 * <p>Each stage either continues or halts with a terminal result. Any exception that
 * escapes a stage is logged with the request id and becomes a generic internal
 * {@link GatewayResult.BackendError}; the returned Uni never fails.
 */
@ApplicationScoped
public class GatewayService implements GatewayUseCase {

    private static final Logger LOG = Logger.getLogger(GatewayService.class);

    private final List<GatewayStage> stages;
    private final Metrics metrics;

    @Inject
    public GatewayService(
            RouteMatchStage routeMatchStage,
            RateLimitStage rateLimitStage,
            AuthenticationStage authenticationStage,
            ProxyForwardStage proxyForwardStage,
            Metrics metrics) {
        this(List.of(routeMatchStage, rateLimitStage, authenticationStage, proxyForwardStage), metrics);
    }

    public GatewayService(List<GatewayStage> stages, Metrics metrics) {
        this.stages = List.copyOf(stages);
        this.metrics = metrics;
    }

    @Override
    public Uni<GatewayResult> forward(GatewayRequest request) {
        return Uni.createFrom()
                .deferred(() -> run(0, GatewayExchange.start(request)))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(
                            error,
                            "Unhandled failure for {0} {1} [{2}]",
                            request.method(), request.path(), request.requestId());
                    return new GatewayResult.BackendError(null, BackendFailure.INTERNAL, "Internal gateway error");
                })
                .invoke(metrics::recordGatewayResult);
    }

    private Uni<GatewayResult> run(int index, GatewayExchange exchange) {
        if (index >= stages.size()) {
            return Uni.createFrom().failure(new IllegalStateException("Pipeline completed without a result"));
        }
        var stage = stages.get(index);
        return stage.apply(exchange).flatMap(outcome -> {
            if (outcome instanceof StageOutcome.Halt halt) {
                LOG.tracef("Stage %s halted request %s", stage.name(), exchange.request().requestId());
                return Uni.createFrom().item(halt.result());
            }
            return run(index + 1, ((StageOutcome.Continue) outcome).exchange());
        });
    }
}
