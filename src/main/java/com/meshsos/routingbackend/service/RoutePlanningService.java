package com.meshsos.routingbackend.service;

import com.meshsos.routingbackend.config.RoutingProperties;
import com.meshsos.routingbackend.dto.RouteGenerationRequest;
import com.meshsos.routingbackend.dto.RoutePlan;
import com.meshsos.routingbackend.model.DemandPoint;
import com.meshsos.routingbackend.model.Location;
import com.meshsos.routingbackend.model.Vehicle;
import com.meshsos.routingbackend.routing.BlendedRouteBuilder;
import com.meshsos.routingbackend.routing.DistanceFocusedRouteBuilder;
import com.meshsos.routingbackend.routing.PriorityFocusedRouteBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for route generation:
 * - runs each routing mode on its own,
 * - or runs all three (distance, priority, blended) for side-by-side comparison.
 * Demand selection and storage of the resulting plans belong to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutePlanningService {

    private final DistanceFocusedRouteBuilder distanceRouteBuilder;
    private final PriorityFocusedRouteBuilder priorityRouteBuilder;
    private final BlendedRouteBuilder blendedRouteBuilder;
    private final RoutingProperties routingProperties;

    public RoutePlan distanceFocusedRoute(List<DemandPoint> demands, Vehicle vehicle) {
        return distanceRouteBuilder.build(demands, vehicle);
    }

    public RoutePlan priorityFocusedRoute(List<DemandPoint> demands, Vehicle vehicle) {
        return priorityRouteBuilder.build(demands, vehicle);
    }

    public RoutePlan blendedRoute(List<DemandPoint> demands, Vehicle vehicle) {
        return blendedRouteBuilder.build(demands, vehicle);
    }

    public RoutePlan blendedRoute(List<DemandPoint> demands, Vehicle vehicle,
                                  double urgencyWeight, double distanceWeight) {
        return blendedRouteBuilder.build(demands, vehicle, urgencyWeight, distanceWeight);
    }

    /**
     * Generates all three route modes with the configured blended weights.
     */
    public List<RoutePlan> generateAllRoutes(List<DemandPoint> demands, Vehicle vehicle) {
        RoutingProperties.Blended blended = routingProperties.getBlended();
        return generateAllRoutes(demands, vehicle, blended.getUrgencyWeight(), blended.getDistanceWeight());
    }

    /**
     * Generates all three route modes for comparison.
     *
     * @return exactly three plans, in the order distance, priority, blended
     */
    public List<RoutePlan> generateAllRoutes(List<DemandPoint> demands, Vehicle vehicle,
                                             double urgencyWeight, double distanceWeight) {
        log.info("Generating routes for {} demand points", demands == null ? 0 : demands.size());

        List<RoutePlan> routes = List.of(
                distanceRouteBuilder.build(demands, vehicle),
                priorityRouteBuilder.build(demands, vehicle),
                blendedRouteBuilder.build(demands, vehicle, urgencyWeight, distanceWeight)
        );

        log.info("Generated {} route options", routes.size());
        return routes;
    }

    /**
     * Generates all three route modes for the depot, capacity and weights named in {@code request}.
     */
    public List<RoutePlan> generateRoutes(RouteGenerationRequest request, List<DemandPoint> demands) {
        if (request == null) {
            throw new IllegalArgumentException("Route generation request is required");
        }
        if (request.getDepotLat() == null || request.getDepotLon() == null) {
            throw new IllegalArgumentException("Depot coordinates are required");
        }

        int capacity = request.getVehicleCapacity() != null
                ? request.getVehicleCapacity()
                : routingProperties.getDefaultVehicleCapacity();
        Vehicle vehicle = new Vehicle(new Location(request.getDepotLat(), request.getDepotLon()), capacity);

        RoutingProperties.Blended blended = routingProperties.getBlended();
        double urgencyWeight = request.getUrgencyWeight() != null
                ? request.getUrgencyWeight()
                : blended.getUrgencyWeight();
        double distanceWeight = request.getDistanceWeight() != null
                ? request.getDistanceWeight()
                : blended.getDistanceWeight();

        return generateAllRoutes(demands, vehicle, urgencyWeight, distanceWeight);
    }
}
