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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy route that trades urgency against distance. Each step picks the remaining demand with the
 * highest score:
 * <pre>
 *   score = urgencyWeight * urgency - distanceWeight * (distance / maxDistance)
 * </pre>
 * where {@code maxDistance} is the farthest remaining demand from the current position, so the
 * distance penalty always lies in [0, distanceWeight]. Weights are used as given; they need not sum to 1.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlendedRouteBuilder implements RouteBuilder {

    private final RoutingProperties properties;

    @Override
    public RouteMode mode() {
        return RouteMode.BLENDED;
    }

    /**
     * Builds with the configured default weights.
     */
    @Override
    public RoutePlan build(List<DemandPoint> demands, Vehicle vehicle) {
        RoutingProperties.Blended defaults = properties.getBlended();
        return build(demands, vehicle, defaults.getUrgencyWeight(), defaults.getDistanceWeight());
    }

    public RoutePlan build(List<DemandPoint> demands, Vehicle vehicle,
                           double urgencyWeight, double distanceWeight) {
        RoutePlanAccumulator route = RoutePlanAccumulator.start(mode(), demands, vehicle, properties);

        List<Integer> remaining = new ArrayList<>(demands.size());
        for (int i = 0; i < demands.size(); i++) {
            remaining.add(i);
        }

        while (!remaining.isEmpty()) {
            Location current = route.getCurrentLocation();

            double[] distances = new double[remaining.size()];
            double maxDistance = 0.0;
            for (int pos = 0; pos < remaining.size(); pos++) {
                distances[pos] = current.distanceTo(demands.get(remaining.get(pos)).getLocation());
                maxDistance = Math.max(maxDistance, distances[pos]);
            }
            if (maxDistance == 0.0) {
                // every remaining demand sits at the current position
                maxDistance = 1.0;
            }

            int bestPos = 0;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int pos = 0; pos < remaining.size(); pos++) {
                DemandPoint candidate = demands.get(remaining.get(pos));
                double score = urgencyWeight * candidate.getUrgency()
                        - distanceWeight * (distances[pos] / maxDistance);
                if (score > bestScore) {
                    bestScore = score;
                    bestPos = pos;
                }
            }

            double legKm = distances[bestPos];
            int bestIndex = remaining.remove(bestPos);
            route.visit(demands.get(bestIndex), legKm);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(RoutePlan.URGENCY_WEIGHT, urgencyWeight);
        details.put(RoutePlan.DISTANCE_WEIGHT, distanceWeight);

        RoutePlan plan = route.complete(details);
        log.debug("Blended route (urgency={}, distance={}): {} stops, {} km, {} urgent",
                urgencyWeight, distanceWeight,
                plan.getStops().size(), plan.getTotalDistanceKm(), plan.getUrgentRequestsServed());
        return plan;
    }
}
