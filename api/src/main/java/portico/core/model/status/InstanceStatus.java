package portico.core.model.status;

/**
 * Health of a single backend instance as seen by a probe of its {@code /health} endpoint.
 *
 * @param url        base URL of the instance
 * @param healthy    whether the probe returned a 2xx response in time
 * @param statusCode HTTP status returned, null when no response was received
 * @param version    version reported by the instance, null when unknown
 * @param error      failure description, null when healthy
 */
public record InstanceStatus(String url, boolean healthy, Integer statusCode, String version, String error) {

    public static InstanceStatus up(String url, int statusCode, String version) {
        return new InstanceStatus(url, true, statusCode, version, null);
    }

    public static InstanceStatus down(String url, Integer statusCode, String error) {
        return new InstanceStatus(url, false, statusCode, null, error);
    }
}
