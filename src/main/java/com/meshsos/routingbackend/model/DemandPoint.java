package com.meshsos.routingbackend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One outstanding supply/emergency request.
 * Urgency runs from 1 (lowest) to 3 (critical).
 */
@Value
@Builder
@AllArgsConstructor
public class DemandPoint {

    public static final int URGENT_THRESHOLD = 2;

    long id;
    String nodeId;
    Location location;
    int urgency;
    String resourceType;  // optional
    int quantity;
    long timestamp;       // unix seconds

    public boolean isUrgent() {
        return urgency >= URGENT_THRESHOLD;
    }
}
