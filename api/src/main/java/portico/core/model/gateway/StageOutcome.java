package portico.core.model.gateway;

/**
 * Result of a single pipeline stage: either continue with an updated exchange,
 * or stop with a terminal result.
 */
public sealed interface StageOutcome {

    record Continue(GatewayExchange exchange) implements StageOutcome {}

    record Halt(GatewayResult result) implements StageOutcome {}

    static StageOutcome proceed(GatewayExchange exchange) {
        return new Continue(exchange);
    }

    static StageOutcome halt(GatewayResult result) {
        return new Halt(result);
    }
}
