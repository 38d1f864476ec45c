package com.meshsos.routingbackend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * DTO representing one visited demand point within a route.
 * {@code distanceFromPrevKm} is measured from the previous stop, or from the depot for the first stop.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RouteStop {
    double lat;
    double lon;
    String nodeId;
    String resourceType;
    int quantity;
    int urgency;
    double distanceFromPrevKm;
}
