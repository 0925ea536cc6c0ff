package portico.adapter.in.dto;

import java.util.List;

import portico.core.model.status.InstanceStatus;
import portico.core.model.status.ServiceStatus;

public record ServiceStatusDto(String status, String circuit, List<InstanceStatusDto> instances) {

    public record InstanceStatusDto(String url, String status, Integer statusCode, String version, String error) {
        public static InstanceStatusDto fromModel(InstanceStatus model) {
            return new InstanceStatusDto(
                    model.url(),
                    model.healthy() ? "healthy" : "unhealthy",
                    model.statusCode(),
                    model.version(),
                    model.error());
        }
    }

    public static ServiceStatusDto fromModel(ServiceStatus model) {
        return new ServiceStatusDto(
                model.healthy() ? "healthy" : "unhealthy",
                model.circuit().name(),
                model.instances().stream().map(InstanceStatusDto::fromModel).toList());
    }
}
