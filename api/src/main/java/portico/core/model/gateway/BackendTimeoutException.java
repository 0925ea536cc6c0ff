package portico.core.model.gateway;

import java.net.URI;
import java.time.Duration;

/**
 * A backend call exceeded its timeout.
 */
public class BackendTimeoutException extends RuntimeException {

    private final URI target;
    private final Duration timeout;

    public BackendTimeoutException(URI target, Duration timeout) {
        super("No response from " + target.getHost() + " within " + timeout.toMillis() + "ms");
        this.target = target;
        this.timeout = timeout;
    }

    public URI getTarget() {
        return target;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
