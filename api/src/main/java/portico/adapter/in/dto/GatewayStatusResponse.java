package portico.adapter.in.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import portico.core.model.status.GatewayStatus;

/**
 * Body of {@code GET /api/status}.
 *
 * @param gateway  the gateway's own state and the time of the check
 * @param services per-service health keyed by service id
 * @param overall  {@code healthy} when every service is healthy, otherwise {@code degraded}
 */
public record GatewayStatusResponse(GatewayInfo gateway, Map<String, ServiceStatusDto> services, String overall) {

    public record GatewayInfo(String status, String timestamp) {}

    public static GatewayStatusResponse fromModel(GatewayStatus model) {
        var services = new LinkedHashMap<String, ServiceStatusDto>();
        for (var service : model.services()) {
            services.put(service.service().id(), ServiceStatusDto.fromModel(service));
        }
        return new GatewayStatusResponse(
                new GatewayInfo("healthy", model.checkedAt().toString()),
                services,
                model.healthy() ? "healthy" : "degraded");
    }
}
