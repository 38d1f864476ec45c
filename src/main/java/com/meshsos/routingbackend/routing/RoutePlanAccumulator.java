package com.meshsos.routingbackend.routing;

import com.meshsos.routingbackend.config.RoutingProperties;
import com.meshsos.routingbackend.dto.RouteMode;
import com.meshsos.routingbackend.dto.RoutePlan;
import com.meshsos.routingbackend.dto.RouteStop;
import com.meshsos.routingbackend.model.DemandPoint;
import com.meshsos.routingbackend.model.Location;
import com.meshsos.routingbackend.model.Vehicle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running state of a route under construction: current position, emitted stops,
 * travelled distance and urgent count. Shared by every {@link RouteBuilder} so the
 * return leg, time estimate and rounding are computed the same way for all modes.
 */
final class RoutePlanAccumulator {

    private final RouteMode mode;
    private final Vehicle vehicle;
    private final RoutingProperties properties;

    private final List<RouteStop> stops = new ArrayList<>();
    private Location currentLocation;
    private double totalDistanceKm;
    private int urgentCount;

    private RoutePlanAccumulator(RouteMode mode, Vehicle vehicle, RoutingProperties properties) {
        this.mode = mode;
        this.vehicle = vehicle;
        this.properties = properties;
        this.currentLocation = vehicle.getDepot();
    }

    static RoutePlanAccumulator start(RouteMode mode, List<DemandPoint> demands, Vehicle vehicle,
                                      RoutingProperties properties) {
        if (demands == null) {
            throw new IllegalArgumentException("Demand list is required");
        }
        if (vehicle == null || vehicle.getDepot() == null) {
            throw new IllegalArgumentException("Vehicle with a depot is required");
        }
        return new RoutePlanAccumulator(mode, vehicle, properties);
    }

    Location getCurrentLocation() {
        return currentLocation;
    }

    /**
     * Appends {@code demand} as the next stop, reached after {@code legKm} from the current position.
     */
    void visit(DemandPoint demand, double legKm) {
        totalDistanceKm += legKm;
        stops.add(RouteStop.builder()
                .lat(demand.getLocation().getLat())
                .lon(demand.getLocation().getLon())
                .nodeId(demand.getNodeId())
                .resourceType(demand.getResourceType())
                .quantity(demand.getQuantity())
                .urgency(demand.getUrgency())
                .distanceFromPrevKm(round(legKm, 2))
                .build());
        if (demand.isUrgent()) {
            urgentCount++;
        }
        currentLocation = demand.getLocation();
    }

    /**
     * Closes the route at the depot and builds the plan.
     *
     * @param details algorithm-specific metadata, placed after the algorithm label
     */
    RoutePlan complete(Map<String, Object> details) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(RoutePlan.ALGORITHM, mode.getAlgorithm());
        metadata.putAll(details);

        double estimatedMinutes = 0.0;
        if (!stops.isEmpty()) {
            double returnKm = currentLocation.distanceTo(vehicle.getDepot());
            totalDistanceKm += returnKm;
            metadata.put(RoutePlan.RETURN_TO_DEPOT_KM, round(returnKm, 2));
            estimatedMinutes = totalDistanceKm / properties.getAverageSpeedKmh() * 60.0
                    + stops.size() * properties.getServiceMinutesPerStop();
        }
        metadata.put(RoutePlan.VEHICLE_CAPACITY, vehicle.getCapacity());

        return RoutePlan.builder()
                .mode(mode)
                .depotLat(vehicle.getDepot().getLat())
                .depotLon(vehicle.getDepot().getLon())
                .stops(Collections.unmodifiableList(new ArrayList<>(stops)))
                .totalDistanceKm(round(totalDistanceKm, 2))
                .estimatedTimeMinutes(round(estimatedMinutes, 1))
                .urgentRequestsServed(urgentCount)
                .metadata(Collections.unmodifiableMap(metadata))
                .build();
    }

    // half-even on the exact binary value, so 0.125 becomes 0.12 and 12.25 becomes 12.2
    static double round(double value, int decimals) {
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }
}
