package portico.adapter.out.http;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;

import portico.adapter.out.telemetry.SpanAttributes;
import portico.config.GatewayConfig;
import portico.core.model.gateway.BackendTimeoutException;
import portico.core.model.gateway.BackendUnavailableException;
import portico.core.model.gateway.PreparedProxyRequest;
import portico.core.model.gateway.ProxyResponse;
import portico.core.port.out.ProxyClient;
import portico.core.service.gateway.ProxyRequestPreparer;

/**
 * HTTP adapter for forwarding prepared proxy requests using Vert.x WebClient.
 * All header preparation is handled by {@link ProxyRequestPreparer} in core.
 *
 * <p>Every call is bounded by {@code portico.proxy.request-timeout}. Timeouts fail with
 * {@link BackendTimeoutException}, connection problems with {@link BackendUnavailableException}.
 *
 * <p>This adapter propagates W3C Trace Context headers (traceparent, tracestate)
 * to backends for distributed tracing.
 */
@ApplicationScoped
public class ProxyHttpClient implements ProxyClient {

    private static final TextMapSetter<HttpRequest<Buffer>> HEADER_SETTER =
            (carrier, key, value) -> carrier.putHeader(key, value);

    private final Vertx vertx;
    private final ProxyRequestPreparer requestPreparer;
    private final Tracer tracer;
    private final TextMapPropagator propagator;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private WebClient webClient;

    @Inject
    public ProxyHttpClient(
            Vertx vertx,
            ProxyRequestPreparer requestPreparer,
            Tracer tracer,
            TextMapPropagator propagator,
            GatewayConfig config) {
        this(
                vertx,
                requestPreparer,
                tracer,
                propagator,
                config.proxy().connectTimeout(),
                config.proxy().requestTimeout());
    }

    ProxyHttpClient(
            Vertx vertx,
            ProxyRequestPreparer requestPreparer,
            Tracer tracer,
            TextMapPropagator propagator,
            Duration connectTimeout,
            Duration requestTimeout) {
        this.vertx = vertx;
        this.requestPreparer = requestPreparer;
        this.tracer = tracer;
        this.propagator = propagator;
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
    }

    @PostConstruct
    void init() {
        var options = new WebClientOptions()
                .setConnectTimeout((int) connectTimeout.toMillis())
                .setFollowRedirects(false)
                .setKeepAlive(true);
        this.webClient = WebClient.create(vertx, options);
    }

    @PreDestroy
    void close() {
        if (webClient != null) {
            webClient.close();
        }
    }

    @Override
    public Uni<ProxyResponse> forward(PreparedProxyRequest preparedRequest) {
        var targetUri = preparedRequest.targetUri();
        var method = HttpMethod.valueOf(preparedRequest.method());

        var span = tracer.spanBuilder("HTTP " + preparedRequest.method())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, preparedRequest.method())
                .setAttribute(SpanAttributes.HTTP_URL, targetUri.toString())
                .setAttribute(SpanAttributes.NET_PEER_NAME, targetUri.getHost())
                .setAttribute(SpanAttributes.NET_PEER_PORT, (long) getPort(targetUri))
                .setAttribute(SpanAttributes.REQUEST_ID, requestId(preparedRequest))
                .startSpan();

        var request = webClient.requestAbs(method, targetUri.toString());
        applyHeaders(preparedRequest, request);

        // Propagate trace context (W3C Trace Context headers)
        propagator.inject(Context.current().with(span), request, HEADER_SETTER);

        return executeRequest(request, preparedRequest.body())
                .map(this::toProxyResponse)
                .ifNoItem()
                .after(requestTimeout)
                .failWith(() -> new BackendTimeoutException(targetUri, requestTimeout))
                .onFailure(error -> !(error instanceof BackendTimeoutException))
                .transform(error -> translateFailure(targetUri, error))
                .invoke(response -> {
                    span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) response.statusCode());
                    if (response.statusCode() >= 500) {
                        span.setStatus(StatusCode.ERROR, "HTTP " + response.statusCode());
                    }
                    span.end();
                })
                .onFailure()
                .invoke(error -> {
                    span.setStatus(StatusCode.ERROR, error.getMessage());
                    span.recordException(error);
                    span.end();
                })
                // The client went away; the span is closed but the backend call is not retried
                .onCancellation()
                .invoke(span::end);
    }

    private Throwable translateFailure(URI targetUri, Throwable error) {
        if (error instanceof TimeoutException) {
            return new BackendTimeoutException(targetUri, requestTimeout);
        }
        return new BackendUnavailableException(targetUri, error);
    }

    private String requestId(PreparedProxyRequest request) {
        var values = request.headers().get(ProxyRequestPreparer.REQUEST_ID_HEADER);
        return values == null || values.isEmpty() ? "" : values.get(0);
    }

    private int getPort(URI uri) {
        var port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private void applyHeaders(PreparedProxyRequest preparedRequest, HttpRequest<Buffer> httpRequest) {
        var headers = httpRequest.headers();
        for (var entry : preparedRequest.headers().entrySet()) {
            for (var value : entry.getValue()) {
                headers.add(entry.getKey(), value);
            }
        }
    }

    private Uni<HttpResponse<Buffer>> executeRequest(HttpRequest<Buffer> request, byte[] body) {
        if (body != null && body.length > 0) {
            return request.sendBuffer(Buffer.buffer(body));
        }
        return request.send();
    }

    private ProxyResponse toProxyResponse(HttpResponse<Buffer> response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).addAll(response.headers().getAll(name));
        }

        var filteredHeaders = requestPreparer.filterResponseHeaders(headers);
        var responseBody = response.body() != null ? response.body().getBytes() : new byte[0];

        return new ProxyResponse(response.statusCode(), filteredHeaders, responseBody);
    }
}
