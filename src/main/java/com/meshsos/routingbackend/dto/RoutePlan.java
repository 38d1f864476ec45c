package com.meshsos.routingbackend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * DTO representing one candidate route produced by a routing mode.
 * The return leg to the depot is included in {@code totalDistanceKm} but has no stop of its own.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RoutePlan {

    public static final String ALGORITHM = "algorithm";
    public static final String RETURN_TO_DEPOT_KM = "return_to_depot_km";
    public static final String URGENCY_WEIGHT = "urgency_weight";
    public static final String DISTANCE_WEIGHT = "distance_weight";
    public static final String VEHICLE_CAPACITY = "vehicle_capacity";

    RouteMode mode;
    double depotLat;
    double depotLon;
    List<RouteStop> stops;
    double totalDistanceKm;
    double estimatedTimeMinutes;
    int urgentRequestsServed;
    Map<String, Object> metadata;
}
