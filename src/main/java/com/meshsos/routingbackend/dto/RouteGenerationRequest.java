package com.meshsos.routingbackend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters for generating the three candidate routes.
 * Null capacity or weights fall back to the configured routing defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RouteGenerationRequest {
    private Double depotLat;
    private Double depotLon;
    private Integer vehicleCapacity;
    private Double urgencyWeight;
    private Double distanceWeight;
}
