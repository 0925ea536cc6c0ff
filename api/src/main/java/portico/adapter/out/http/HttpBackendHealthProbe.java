package portico.adapter.out.http;

import java.time.Duration;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import portico.config.GatewayConfig;
import portico.core.model.routing.BackendInstance;
import portico.core.model.status.InstanceStatus;
import portico.core.port.out.BackendHealthProbe;

/**
 * Calls {@code GET /health} on a backend instance for the operator status page.
 */
@ApplicationScoped
public class HttpBackendHealthProbe implements BackendHealthProbe {

    private static final Logger LOG = Logger.getLogger(HttpBackendHealthProbe.class);

    static final String HEALTH_PATH = "/health";

    private final Vertx vertx;
    private final Duration probeTimeout;
    private WebClient webClient;

    @Inject
    public HttpBackendHealthProbe(Vertx vertx, GatewayConfig config) {
        this(vertx, config.status().probeTimeout());
    }

    HttpBackendHealthProbe(Vertx vertx, Duration probeTimeout) {
        this.vertx = vertx;
        this.probeTimeout = probeTimeout;
    }

    @PostConstruct
    void init() {
        var options = new WebClientOptions()
                .setConnectTimeout((int) probeTimeout.toMillis())
                .setFollowRedirects(false);
        this.webClient = WebClient.create(vertx, options);
    }

    @PreDestroy
    void close() {
        if (webClient != null) {
            webClient.close();
        }
    }

    @Override
    public Uni<InstanceStatus> probe(BackendInstance instance) {
        var url = instance.baseUri().toString();
        var healthUri = instance.resolve(HEALTH_PATH, null);

        return webClient
                .getAbs(healthUri.toString())
                .send()
                .ifNoItem()
                .after(probeTimeout)
                .failWith(() -> new IllegalStateException("timeout of " + probeTimeout.toMillis() + "ms exceeded"))
                .map(response -> toStatus(url, response))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Health probe of %s failed: %s", url, error.getMessage());
                    return InstanceStatus.down(url, null, error.getMessage());
                });
    }

    private InstanceStatus toStatus(String url, HttpResponse<Buffer> response) {
        var status = response.statusCode();
        if (status < 200 || status >= 300) {
            return InstanceStatus.down(url, status, "HTTP " + status);
        }
        return InstanceStatus.up(url, status, version(response));
    }

    private String version(HttpResponse<Buffer> response) {
        var body = response.body();
        if (body == null || body.length() == 0) {
            return null;
        }
        try {
            var json = new JsonObject(body.toString());
            var version = json.getValue("version");
            return version != null ? version.toString() : null;
        } catch (RuntimeException e) {
            // Not JSON; health is decided by the status code alone
            return null;
        }
    }
}
