package com.meshsos.routingbackend.service;

import com.meshsos.routingbackend.config.RoutingProperties;
import com.meshsos.routingbackend.dto.RouteMode;
import com.meshsos.routingbackend.dto.RoutePlan;
import com.meshsos.routingbackend.model.DemandPoint;
import com.meshsos.routingbackend.model.Location;
import com.meshsos.routingbackend.model.Vehicle;
import com.meshsos.routingbackend.routing.BlendedRouteBuilder;
import com.meshsos.routingbackend.routing.DistanceFocusedRouteBuilder;
import com.meshsos.routingbackend.routing.PriorityFocusedRouteBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the service over the real builders.
 */
class RoutePlanningServiceIntegrationTest {

    private RoutePlanningService routePlanningService;
    private Vehicle vehicle;
    private List<DemandPoint> demands;

    @BeforeEach
    void setUp() {
        RoutingProperties properties = new RoutingProperties();
        routePlanningService = new RoutePlanningService(
                new DistanceFocusedRouteBuilder(properties),
                new PriorityFocusedRouteBuilder(properties),
                new BlendedRouteBuilder(properties),
                properties);

        vehicle = new Vehicle(new Location(43.47, -80.54));
        demands = List.of(
                new DemandPoint(1, "n1", new Location(43.48, -80.55), 1, "water", 10, 1733184000L),
                new DemandPoint(2, "n2", new Location(43.49, -80.56), 2, "food", 20, 1733184001L),
                new DemandPoint(3, "n3", new Location(43.50, -80.57), 3, "medical", 5, 1733184002L)
        );
    }

    @Test
    void testGenerateAllRoutes() {
        List<RoutePlan> routes = routePlanningService.generateAllRoutes(demands, vehicle);

        assertEquals(3, routes.size());
        Set<RouteMode> modes = routes.stream().map(RoutePlan::getMode).collect(Collectors.toSet());
        assertEquals(EnumSet.allOf(RouteMode.class), modes);
        assertEquals(List.of(RouteMode.DISTANCE, RouteMode.PRIORITY, RouteMode.BLENDED),
                routes.stream().map(RoutePlan::getMode).collect(Collectors.toList()));
        for (RoutePlan route : routes) {
            assertEquals(3, route.getStops().size());
            assertEquals(2, route.getUrgentRequestsServed());
            assertTrue(route.getTotalDistanceKm() > 0);
            assertTrue(route.getEstimatedTimeMinutes() > 0);
            assertEquals(Vehicle.DEFAULT_CAPACITY, route.getMetadata().get(RoutePlan.VEHICLE_CAPACITY));
        }
        assertEquals(0.6, routes.get(2).getMetadata().get(RoutePlan.URGENCY_WEIGHT));
        assertEquals(0.4, routes.get(2).getMetadata().get(RoutePlan.DISTANCE_WEIGHT));
    }

    @Test
    void testGenerateAllRoutes_noDemands() {
        List<RoutePlan> routes = routePlanningService.generateAllRoutes(List.of(), vehicle, 0.6, 0.4);

        assertEquals(3, routes.size());
        routes.forEach(route -> {
            assertTrue(route.getStops().isEmpty());
            assertEquals(0.0, route.getTotalDistanceKm());
            assertEquals(0.0, route.getEstimatedTimeMinutes());
            assertEquals(43.47, route.getDepotLat());
            assertEquals(-80.54, route.getDepotLon());
        });
    }

    @Test
    void testResultsAreImmutable() {
        RoutePlan route = routePlanningService.distanceFocusedRoute(demands, vehicle);

        assertThrows(UnsupportedOperationException.class, () -> route.getStops().clear());
        assertThrows(UnsupportedOperationException.class, () -> route.getMetadata().put("extra", 1));
    }

    @Test
    void testNullVehicleRejected() {
        assertThrows(IllegalArgumentException.class, () -> routePlanningService.generateAllRoutes(demands, null));
    }
}
