package com.meshsos.routingbackend.routing;

import com.meshsos.routingbackend.config.RoutingProperties;
import com.meshsos.routingbackend.dto.RouteMode;
import com.meshsos.routingbackend.dto.RoutePlan;
import com.meshsos.routingbackend.model.DemandPoint;
import com.meshsos.routingbackend.model.Vehicle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Serves the most urgent requests first, oldest first within an urgency tier,
 * whatever the detour costs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriorityFocusedRouteBuilder implements RouteBuilder {

    static final Comparator<DemandPoint> URGENCY_THEN_AGE =
            Comparator.comparingInt(DemandPoint::getUrgency).reversed()
                    .thenComparingLong(DemandPoint::getTimestamp);

    private final RoutingProperties properties;

    @Override
    public RouteMode mode() {
        return RouteMode.PRIORITY;
    }

    @Override
    public RoutePlan build(List<DemandPoint> demands, Vehicle vehicle) {
        RoutePlanAccumulator route = RoutePlanAccumulator.start(mode(), demands, vehicle, properties);

        // stream sort is stable, so equal keys keep input order
        List<DemandPoint> ordered = demands.stream()
                .sorted(URGENCY_THEN_AGE)
                .collect(Collectors.toList());

        for (DemandPoint demand : ordered) {
            route.visit(demand, route.getCurrentLocation().distanceTo(demand.getLocation()));
        }

        RoutePlan plan = route.complete(Map.of());
        log.debug("Priority route: {} stops, {} km, {} urgent",
                plan.getStops().size(), plan.getTotalDistanceKm(), plan.getUrgentRequestsServed());
        return plan;
    }
}
