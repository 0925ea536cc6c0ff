package portico.core.model.gateway;

/**
 * Why a request could not be completed by a backend.
 */
public enum BackendFailure {

    /** Connection refused, reset, DNS failure or similar transport error. */
    UNREACHABLE,

    /** The backend did not answer within the configured timeout. */
    TIMEOUT,

    /** The gateway itself failed while handling the request. */
    INTERNAL
}
