package portico.adapter.out.telemetry;

/**
 * Span attribute names for backend client spans.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/http/http-spans/">HTTP span conventions</a>
 */
public final class SpanAttributes {

    private SpanAttributes() {}

    public static final String HTTP_METHOD = "http.method";

    public static final String HTTP_URL = "http.url";

    public static final String HTTP_STATUS_CODE = "http.status_code";

    public static final String NET_PEER_NAME = "net.peer.name";

    public static final String NET_PEER_PORT = "net.peer.port";

    /** Request identifier shared with the client and the backend. */
    public static final String REQUEST_ID = "portico.request.id";
}
