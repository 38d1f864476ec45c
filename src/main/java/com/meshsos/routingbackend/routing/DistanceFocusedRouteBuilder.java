package com.meshsos.routingbackend.routing;

import com.meshsos.routingbackend.config.RoutingProperties;
import com.meshsos.routingbackend.dto.RouteMode;
import com.meshsos.routingbackend.dto.RoutePlan;
import com.meshsos.routingbackend.model.DemandPoint;
import com.meshsos.routingbackend.model.Location;
import com.meshsos.routingbackend.model.Vehicle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour heuristic: from the depot, always drive to the closest unvisited demand point.
 * Minimises distance greedily, not optimally.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistanceFocusedRouteBuilder implements RouteBuilder {

    private final RoutingProperties properties;

    @Override
    public RouteMode mode() {
        return RouteMode.DISTANCE;
    }

    @Override
    public RoutePlan build(List<DemandPoint> demands, Vehicle vehicle) {
        RoutePlanAccumulator route = RoutePlanAccumulator.start(mode(), demands, vehicle, properties);

        List<Integer> remaining = new ArrayList<>(demands.size());
        for (int i = 0; i < demands.size(); i++) {
            remaining.add(i);
        }

        while (!remaining.isEmpty()) {
            Location current = route.getCurrentLocation();
            int nearestPos = 0;
            double nearestKm = current.distanceTo(demands.get(remaining.get(0)).getLocation());
            for (int pos = 1; pos < remaining.size(); pos++) {
                double km = current.distanceTo(demands.get(remaining.get(pos)).getLocation());
                if (km < nearestKm) {
                    nearestKm = km;
                    nearestPos = pos;
                }
            }
            int nearestIndex = remaining.remove(nearestPos);
            route.visit(demands.get(nearestIndex), nearestKm);
        }

        RoutePlan plan = route.complete(Map.of());
        log.debug("Distance route: {} stops, {} km, {} urgent",
                plan.getStops().size(), plan.getTotalDistanceKm(), plan.getUrgentRequestsServed());
        return plan;
    }
}
