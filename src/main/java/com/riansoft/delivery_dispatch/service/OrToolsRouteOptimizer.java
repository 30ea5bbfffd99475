package com.riansoft.delivery_dispatch.service;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.*;
import com.google.protobuf.Duration;
import com.riansoft.delivery_dispatch.model.RoutingRequest;
import com.riansoft.delivery_dispatch.model.RoutingSolution;
import com.riansoft.delivery_dispatch.model.VehicleRoute;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link RouteOptimizer} backed by the OR-Tools routing library.
 */
@Service
public class OrToolsRouteOptimizer implements RouteOptimizer {

    private static final Logger log = LoggerFactory.getLogger(OrToolsRouteOptimizer.class);

    @PostConstruct
    public void init() {
        log.info("[LOG] Loading Google OR-Tools native libraries...");
        Loader.loadNativeLibraries();
        log.info("[LOG] OR-Tools native libraries loaded");
    }

    @Override
    public RoutingSolution solve(RoutingRequest request) {
        log.info("========= [SOLVER] Building OR-Tools model: {} locations, {} vehicles ==========",
                request.distanceMatrix.length, request.numVehicles);
        RoutingIndexManager manager = new RoutingIndexManager(request.distanceMatrix.length, request.numVehicles, request.depotIndex);
        RoutingModel routing = new RoutingModel(manager);

        final int transitCallbackIndex = routing.registerTransitCallback(
                (long fromIndex, long toIndex) -> {
                    int fromNode = manager.indexToNode(fromIndex);
                    int toNode = manager.indexToNode(toIndex);
                    return request.distanceMatrix[fromNode][toNode];
                });
        routing.setArcCostEvaluatorOfAllVehicles(transitCallbackIndex);

        final int demandCallbackIndex = routing.registerUnaryTransitCallback(
                (long fromIndex) -> request.demands[manager.indexToNode(fromIndex)]);
        routing.addDimensionWithVehicleCapacity(demandCallbackIndex, 0, request.vehicleCapacities, true, "Capacity");

        RoutingSearchParameters searchParameters = main.defaultRoutingSearchParameters().toBuilder()
                .setFirstSolutionStrategy(FirstSolutionStrategy.Value.valueOf(request.settings.firstSolutionStrategy))
                .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.valueOf(request.settings.localSearchMetaheuristic))
                .setTimeLimit(Duration.newBuilder().setSeconds(request.settings.timeLimitSeconds).build())
                .setLogSearch(request.settings.logSearch)
                .build();

        log.info("========= [SOLVER] Starting optimization (max {} s, {} / {}) ==========",
                request.settings.timeLimitSeconds, request.settings.firstSolutionStrategy,
                request.settings.localSearchMetaheuristic);
        Assignment solution = routing.solveWithParameters(searchParameters);

        String status = String.valueOf(routing.status());
        if (solution == null) {
            log.error("[SOLVER] No solution found, solver status: {}", status);
            return RoutingSolution.infeasible(status);
        }

        List<VehicleRoute> routes = new ArrayList<>();
        for (int vehicle = 0; vehicle < request.numVehicles; ++vehicle) {
            List<Integer> nodes = new ArrayList<>();
            long index = routing.start(vehicle);
            nodes.add(manager.indexToNode(index));
            while (!routing.isEnd(index)) {
                index = solution.value(routing.nextVar(index));
                nodes.add(manager.indexToNode(index));
            }
            routes.add(new VehicleRoute(vehicle, nodes));
        }
        log.info("[SOLVER] Solution found, objective: {}", solution.objectiveValue());
        return RoutingSolution.feasible(routes, solution.objectiveValue(), status);
    }
}
