package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.model.VehicleRoute;

import java.util.List;
import java.util.Set;

/**
 * Supplies the visiting order each vehicle walks in a given round.
 */
public interface RouteSource {

    /**
     * @param round     1-based round number
     * @param remaining customers not yet served when the round starts
     */
    List<VehicleRoute> routesForRound(int round, Set<Integer> remaining);
}
