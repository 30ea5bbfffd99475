package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.model.VehicleRoute;

import java.util.List;
import java.util.Set;

/**
 * Returns the same single-trip routes in every round.
 */
public class FixedRouteSource implements RouteSource {
    private final List<VehicleRoute> routes;

    public FixedRouteSource(List<VehicleRoute> routes) {
        this.routes = List.copyOf(routes);
    }

    @Override
    public List<VehicleRoute> routesForRound(int round, Set<Integer> remaining) {
        return routes;
    }
}
