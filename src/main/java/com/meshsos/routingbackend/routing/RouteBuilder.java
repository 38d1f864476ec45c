package com.meshsos.routingbackend.routing;

import com.meshsos.routingbackend.dto.RoutePlan;
import com.meshsos.routingbackend.dto.RouteMode;
import com.meshsos.routingbackend.model.DemandPoint;
import com.meshsos.routingbackend.model.Vehicle;

import java.util.List;

/**
 * Strategy that sequences demand points into a single depot-to-depot route.
 * Implementations never modify the demand list they are given.
 */
public interface RouteBuilder {

    RouteMode mode();

    RoutePlan build(List<DemandPoint> demands, Vehicle vehicle);
}
