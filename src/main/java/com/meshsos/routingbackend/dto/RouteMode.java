package com.meshsos.routingbackend.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RouteMode {
    DISTANCE("distance", "nearest_neighbor"),
    PRIORITY("priority", "urgency_first"),
    BLENDED("blended", "weighted_scoring");

    private final String wireName;
    private final String algorithm;

    RouteMode(String wireName, String algorithm) {
        this.wireName = wireName;
        this.algorithm = algorithm;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Label recorded under {@code metadata.algorithm} for plans of this mode.
     */
    public String getAlgorithm() {
        return algorithm;
    }
}
