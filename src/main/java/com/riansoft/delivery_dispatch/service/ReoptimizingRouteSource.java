package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.model.DataModel;
import com.riansoft.delivery_dispatch.model.RoutingRequest;
import com.riansoft.delivery_dispatch.model.RoutingSolution;
import com.riansoft.delivery_dispatch.model.SolverSettings;
import com.riansoft.delivery_dispatch.model.VehicleRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Uses the single-trip routes for round 1 and solves the still-unserved customers again before every later
 * round. Sub-problem node indices are mapped back to the original node ids. When a later solve finds no
 * solution, that round walks the single-trip routes, so rounds already delivered are kept.
 */
public class ReoptimizingRouteSource implements RouteSource {

    private static final Logger log = LoggerFactory.getLogger(ReoptimizingRouteSource.class);

    private final RouteOptimizer optimizer;
    private final DataModel data;
    private final SolverSettings settings;
    private final List<VehicleRoute> initialRoutes;

    public ReoptimizingRouteSource(RouteOptimizer optimizer, DataModel data, SolverSettings settings,
                                   List<VehicleRoute> initialRoutes) {
        this.optimizer = optimizer;
        this.data = data;
        this.settings = settings;
        this.initialRoutes = List.copyOf(initialRoutes);
    }

    @Override
    public List<VehicleRoute> routesForRound(int round, Set<Integer> remaining) {
        if (round == 1) {
            return initialRoutes;
        }
        // sub-problem index k -> original node id nodeIds[k], depot stays at 0
        int[] nodeIds = new int[remaining.size() + 1];
        nodeIds[0] = data.depotIndex;
        int k = 1;
        for (int customer : remaining.stream().sorted().collect(Collectors.toList())) {
            nodeIds[k++] = customer;
        }
        long[] subDemands = new long[nodeIds.length];
        for (int i = 0; i < nodeIds.length; i++) {
            subDemands[i] = data.demands[nodeIds[i]];
        }

        log.info("[RE-OPTIMIZE] Round {}: solving {} remaining customer(s) again", round, remaining.size());
        RoutingRequest request = RoutingRequest.create(data.distanceMatrix.subMatrix(nodeIds).toLongMatrix(),
                subDemands, data.vehicleCapacities, 0, settings);
        RoutingSolution solution = optimizer.solve(request);
        if (!solution.feasible) {
            log.warn("[RE-OPTIMIZE] Round {}: no solution for the remaining customers (status {}), "
                    + "walking the single-trip routes instead", round, solution.status);
            return initialRoutes;
        }

        List<VehicleRoute> routes = new ArrayList<>();
        for (VehicleRoute subRoute : solution.routes) {
            List<Integer> mapped = subRoute.nodes.stream().map(i -> nodeIds[i]).collect(Collectors.toList());
            routes.add(new VehicleRoute(subRoute.vehicleId, mapped));
        }
        return routes;
    }
}
