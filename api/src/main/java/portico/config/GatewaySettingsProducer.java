package portico.config;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import portico.core.model.ratelimit.RateLimitPolicies;
import portico.core.model.ratelimit.RateLimitPolicy;
import portico.core.model.resilience.CircuitBreakerSettings;
import portico.core.model.routing.BackendInstance;
import portico.core.model.routing.BackendService;
import portico.core.model.routing.Route;
import portico.core.service.common.ClientIpExtractor;
import portico.core.service.common.TrustedProxyValidator;
import portico.core.service.routing.BackendRegistry;
import portico.core.service.routing.RouteTable;

/**
 * Produces the immutable routing, rate limit and circuit breaker settings used by core services.
 * This bridges {@link GatewayConfig} to plain core types.
 *
 * <p>Configuration is validated here so that mistakes fail startup rather than requests:
 * unknown service names, malformed backend URLs, routes to services without instances,
 * duplicate prefixes and unknown rate limit groups are all rejected with the offending property.
 */
@ApplicationScoped
public class GatewaySettingsProducer {

    private static final Logger LOG = Logger.getLogger(GatewaySettingsProducer.class);

    private final GatewayConfig config;

    @Inject
    public GatewaySettingsProducer(GatewayConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public BackendRegistry backendRegistry() {
        var registry = new BackendRegistry(backendInstances(config.backends()), ThreadLocalRandom::current);
        for (var service : BackendService.values()) {
            LOG.infov("Backend {0}: {1}", service.id(), registry.instancesOf(service).stream()
                    .map(BackendInstance::baseUri)
                    .toList());
        }
        return registry;
    }

    @Produces
    @Singleton
    public RouteTable routeTable(BackendRegistry backendRegistry, RateLimitPolicies rateLimitPolicies) {
        var table = buildRouteTable(config.routes(), backendRegistry, rateLimitPolicies);
        for (var route : table.routes()) {
            LOG.infov(
                    "Route {0} -> {1} (rewrite={2}, access={3}, group={4})",
                    route.prefix(), route.service().id(), route.rewrite(), route.access(), route.rateLimitGroup());
        }
        return table;
    }

    @Produces
    @Singleton
    public RateLimitPolicies rateLimitPolicies() {
        return buildRateLimitPolicies(config.rateLimiting());
    }

    @Produces
    @Singleton
    public CircuitBreakerSettings circuitBreakerSettings() {
        var breaker = config.circuitBreaker();
        if (breaker.failureThreshold() < 1) {
            throw new IllegalStateException(
                    "portico.circuit-breaker.failure-threshold must be at least 1, got " + breaker.failureThreshold());
        }
        return new CircuitBreakerSettings(breaker.failureThreshold(), breaker.resetTimeout());
    }

    @Produces
    @Singleton
    public ClientIpExtractor clientIpExtractor() {
        return new ClientIpExtractor(buildTrustedProxies(config.trustedProxies()));
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    static Map<BackendService, List<BackendInstance>> backendInstances(Map<String, GatewayConfig.BackendConfig> backends) {
        var instances = new EnumMap<BackendService, List<BackendInstance>>(BackendService.class);
        for (var entry : backends.entrySet()) {
            var property = "portico.backends." + entry.getKey() + ".urls";
            var service = BackendService.fromId(entry.getKey())
                    .orElseThrow(() -> new IllegalStateException("Unknown backend service in " + property));
            var list = new ArrayList<BackendInstance>();
            for (var url : entry.getValue().urls()) {
                if (url == null || url.isBlank()) {
                    continue;
                }
                list.add(parseInstance(service, url, property));
            }
            instances.put(service, list);
        }
        return instances;
    }

    static RouteTable buildRouteTable(
            List<GatewayConfig.RouteConfig> routes, BackendRegistry backendRegistry, RateLimitPolicies policies) {
        if (routes.isEmpty()) {
            throw new IllegalStateException("portico.routes must define at least one route");
        }
        var built = new ArrayList<Route>();
        for (var i = 0; i < routes.size(); i++) {
            var routeConfig = routes.get(i);
            var property = "portico.routes[" + i + "]";
            var service = BackendService.fromId(routeConfig.service())
                    .orElseThrow(() -> new IllegalStateException(
                            "Unknown service '" + routeConfig.service() + "' in " + property + ".service"));
            if (!backendRegistry.hasInstances(service)) {
                throw new IllegalStateException(
                        property + " routes to " + service.id() + " but portico.backends." + service.id()
                                + ".urls lists no instances");
            }
            if (policies.enabled() && policies.forGroup(routeConfig.rateLimitGroup()).isEmpty()) {
                throw new IllegalStateException("Unknown rate limit group '" + routeConfig.rateLimitGroup() + "' in "
                        + property + ".rate-limit-group");
            }
            try {
                built.add(new Route(
                        routeConfig.prefix(),
                        service,
                        routeConfig.rewrite().orElse(null),
                        routeConfig.access(),
                        routeConfig.rateLimitGroup()));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid " + property + ": " + e.getMessage(), e);
            }
        }
        try {
            return new RouteTable(built);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid portico.routes: " + e.getMessage(), e);
        }
    }

    static RateLimitPolicies buildRateLimitPolicies(RateLimitingConfig rateLimiting) {
        var policies = new LinkedHashMap<String, RateLimitPolicy>();
        for (var entry : rateLimiting.groups().entrySet()) {
            var group = entry.getValue();
            try {
                policies.put(
                        entry.getKey(),
                        new RateLimitPolicy(entry.getKey(), group.window(), group.maxRequests(), group.onStoreFailure()));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                        "Invalid portico.rate-limiting.groups." + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        var globalGroup = rateLimiting.globalGroup().orElse(null);
        if (globalGroup != null && !policies.containsKey(globalGroup)) {
            throw new IllegalStateException(
                    "Unknown rate limit group '" + globalGroup + "' in portico.rate-limiting.global-group");
        }
        var result = new RateLimitPolicies(rateLimiting.enabled(), policies, globalGroup);
        if (result.enabled()) {
            if (globalGroup != null) {
                LOG.infov("Global rate limit group: {0}", globalGroup);
            }
            policies.values().forEach(p -> LOG.infov(
                    "Rate limit group {0}: {1} requests per {2} ({3})",
                    p.group(), p.maxRequests(), p.window(), p.onStoreFailure()));
        } else {
            LOG.info("Rate limiting is disabled");
        }
        return result;
    }

    static TrustedProxyValidator buildTrustedProxies(Optional<List<String>> proxies) {
        var entries = proxies.orElse(List.of());
        try {
            var validator = new TrustedProxyValidator(entries);
            if (validator.isEmpty()) {
                LOG.info("No trusted proxies configured; forwarding headers are ignored");
            } else {
                LOG.infov("Trusted proxies: {0}", entries);
            }
            return validator;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid portico.trusted-proxies: " + e.getMessage(), e);
        }
    }

    private static BackendInstance parseInstance(BackendService service, String url, String property) {
        try {
            return new BackendInstance(service, new URI(url.trim()));
        } catch (Exception e) {
            throw new IllegalStateException("Malformed backend URL '" + url + "' in " + property, e);
        }
    }
}
