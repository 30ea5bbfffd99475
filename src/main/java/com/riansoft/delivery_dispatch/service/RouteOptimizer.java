package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.model.RoutingRequest;
import com.riansoft.delivery_dispatch.model.RoutingSolution;

/**
 * Single-trip capacitated vehicle routing solver. Implementations must return one route per vehicle
 * (unused vehicles as depot to depot) or an infeasible solution; they never throw for an infeasible model.
 */
public interface RouteOptimizer {

    RoutingSolution solve(RoutingRequest request);
}
