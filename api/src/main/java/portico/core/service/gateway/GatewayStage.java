package portico.core.service.gateway;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.GatewayExchange;
import portico.core.model.gateway.StageOutcome;

/**
 * One step of the request pipeline.
 *
 * <p>A stage either continues with a (possibly enriched) exchange or halts the
 * pipeline with a terminal result.
 */
public interface GatewayStage {

    Uni<StageOutcome> apply(GatewayExchange exchange);

    /**
     * Short name used in logs.
     */
    String name();
}
