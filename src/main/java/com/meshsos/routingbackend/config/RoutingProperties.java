package com.meshsos.routingbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for route generation.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    /**
     * Average vehicle speed in km/h used for time estimates.
     */
    private double averageSpeedKmh = 40.0;

    /**
     * Fixed service time spent at each stop, in minutes.
     */
    private double serviceMinutesPerStop = 10.0;

    /**
     * Capacity assumed when a generation request does not name one.
     */
    private int defaultVehicleCapacity = 100;

    private Blended blended = new Blended();

    /**
     * Default weights for the blended mode when the caller supplies none.
     */
    @Data
    public static class Blended {
        private double urgencyWeight = 0.6;
        private double distanceWeight = 0.4;
    }
}
