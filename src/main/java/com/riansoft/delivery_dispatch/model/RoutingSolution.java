package com.riansoft.delivery_dispatch.model;

import java.util.List;

/**
 * Output of one single-trip solve: one route per vehicle (unused vehicles as depot-depot) or infeasible.
 */
public class RoutingSolution {
    public final boolean feasible;
    public final List<VehicleRoute> routes;
    public final long objectiveValue;
    public final String status;

    private RoutingSolution(boolean feasible, List<VehicleRoute> routes, long objectiveValue, String status) {
        this.feasible = feasible;
        this.routes = routes;
        this.objectiveValue = objectiveValue;
        this.status = status;
    }

    public static RoutingSolution feasible(List<VehicleRoute> routes, long objectiveValue, String status) {
        return new RoutingSolution(true, List.copyOf(routes), objectiveValue, status);
    }

    public static RoutingSolution infeasible(String status) {
        return new RoutingSolution(false, List.of(), 0, status);
    }
}
