package portico.core.model.gateway;

import java.net.URI;

/**
 * A backend could not be reached (connection refused, reset, DNS failure).
 */
public class BackendUnavailableException extends RuntimeException {

    private final URI target;

    public BackendUnavailableException(URI target, Throwable cause) {
        super("Backend unreachable: " + target.getHost() + ":" + target.getPort(), cause);
        this.target = target;
    }

    public URI getTarget() {
        return target;
    }
}
