package portico.adapter.in.http;

import java.util.UUID;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

/**
 * Assigns a request identifier to every request and writes the access log.
 *
 * <p>A well-formed incoming {@code X-Request-ID} is kept; anything else is replaced
 * with a random UUID. The identifier is set on the request, so later handlers see
 * exactly one value, and on the response.
 *
 * <p>Runs at the Vert.x routing level (before JAX-RS) so that problem responses and
 * health endpoints are covered too.
 */
@ApplicationScoped
public class RequestIdFilter {

    public static final String HEADER = "X-Request-ID";

    private static final Logger LOG = Logger.getLogger(RequestIdFilter.class);
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    /**
     * Priority 110 runs before the other filters so the access log sees the whole request.
     */
    @RouteFilter(110)
    void assignRequestId(RoutingContext rc) {
        final var request = rc.request();
        final var requestId = resolve(request.getHeader(HEADER));
        request.headers().set(HEADER, requestId);
        rc.response().putHeader(HEADER, requestId);

        final var startNanos = System.nanoTime();
        final var method = request.method().name();
        final var path = request.path();
        final var clientIp = request.remoteAddress() != null ? request.remoteAddress().host() : "-";
        rc.addEndHandler(ignored -> LOG.infof(
                "%s %s - %s %d %dms %s",
                method,
                path,
                clientIp,
                rc.response().getStatusCode(),
                (System.nanoTime() - startNanos) / 1_000_000,
                requestId));

        rc.next();
    }

    /**
     * Keep a client supplied identifier when it is safe to echo, otherwise generate one.
     */
    public static String resolve(String incoming) {
        if (incoming != null && VALID_ID.matcher(incoming).matches()) {
            return incoming;
        }
        return UUID.randomUUID().toString();
    }
}
