package portico.core.service.routing;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

import portico.core.model.routing.BackendInstance;
import portico.core.model.routing.BackendService;

/**
 * Static list of backend instances per service, registered at startup.
 *
 * <p>Selection is uniformly random across a service's instances.
 */
public final class BackendRegistry {

    private final Map<BackendService, List<BackendInstance>> instances;
    private final Supplier<RandomGenerator> random;

    public BackendRegistry(Map<BackendService, List<BackendInstance>> instances, Supplier<RandomGenerator> random) {
        var copy = new EnumMap<BackendService, List<BackendInstance>>(BackendService.class);
        instances.forEach((service, list) -> {
            for (var instance : list) {
                if (instance.service() != service) {
                    throw new IllegalArgumentException(
                            "Instance " + instance.baseUri() + " registered under " + service.id()
                                    + " belongs to " + instance.service().id());
                }
            }
            if (!list.isEmpty()) {
                copy.put(service, List.copyOf(list));
            }
        });
        this.instances = copy;
        this.random = random;
    }

    /**
     * Pick an instance of a service.
     *
     * @return an instance, or empty when the service has none registered
     */
    public Optional<BackendInstance> select(BackendService service) {
        var candidates = instances.get(service);
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        return Optional.of(candidates.get(random.get().nextInt(candidates.size())));
    }

    public List<BackendInstance> instancesOf(BackendService service) {
        return instances.getOrDefault(service, List.of());
    }

    public boolean hasInstances(BackendService service) {
        return !instancesOf(service).isEmpty();
    }
}
