package portico.core.port.out;

import io.smallrye.mutiny.Uni;

import portico.core.model.routing.BackendInstance;
import portico.core.model.status.InstanceStatus;

/**
 * Polls a backend instance's health endpoint.
 */
public interface BackendHealthProbe {

    /**
     * @return the probe outcome; never a failed Uni
     */
    Uni<InstanceStatus> probe(BackendInstance instance);
}
