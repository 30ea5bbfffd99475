package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.config.DispatchProperties;
import com.riansoft.delivery_dispatch.dto.CustomerListDto;
import com.riansoft.delivery_dispatch.dto.DispatchPlanDto;
import com.riansoft.delivery_dispatch.exception.NoSolutionFromOptimizerException;
import com.riansoft.delivery_dispatch.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Runs one optimization: records -> instance -> distance matrix -> single-trip solve -> rounds -> report.
 * Every call is an independent run with no state shared between runs.
 */
@Service
public class DispatchPipelineService {

    private static final Logger log = LoggerFactory.getLogger(DispatchPipelineService.class);

    private final DispatchProperties properties;
    private final CustomerDataService customerDataService;
    private final ProblemInstanceBuilder problemInstanceBuilder;
    private final DistanceMatrixProvider distanceMatrixProvider;
    private final RouteOptimizer routeOptimizer;
    private final MultiTripDispatchScheduler scheduler;
    private final SolutionFormatterService solutionFormatterService;

    public DispatchPipelineService(DispatchProperties properties, CustomerDataService customerDataService,
                                   ProblemInstanceBuilder problemInstanceBuilder,
                                   DistanceMatrixProvider distanceMatrixProvider, RouteOptimizer routeOptimizer,
                                   MultiTripDispatchScheduler scheduler,
                                   SolutionFormatterService solutionFormatterService) {
        this.properties = properties;
        this.customerDataService = customerDataService;
        this.problemInstanceBuilder = problemInstanceBuilder;
        this.distanceMatrixProvider = distanceMatrixProvider;
        this.routeOptimizer = routeOptimizer;
        this.scheduler = scheduler;
        this.solutionFormatterService = solutionFormatterService;
    }

    public DispatchPlanDto planFromConfiguredFile() {
        return planFromRecords(customerDataService.loadCustomers(properties.getCustomerFile()));
    }

    public CustomerListDto listConfiguredCustomers() {
        List<CustomerRecord> records = customerDataService.loadCustomers(properties.getCustomerFile());
        return solutionFormatterService.formatCustomers(problemInstanceBuilder.build(records, properties.toFleetConfig()));
    }

    public DispatchPlanDto planFromRecords(List<CustomerRecord> records) {
        log.info("\n========= [1/5] Building problem instance ==========");
        FleetConfig fleet = properties.toFleetConfig();
        ProblemInstance instance = problemInstanceBuilder.build(records, fleet);
        log.info("[LOG] Total locations: {}, first locations: {}", instance.nodes.size(),
                instance.coordinates().subList(0, Math.min(3, instance.nodes.size())));

        DistanceMatrix matrix = distanceMatrixProvider.fetchMatrix(instance.coordinates());
        DataModel data = new DataModel(instance, matrix);
        preCheckDemand(data);

        log.info("========= [3/5] Single-trip route optimization ==========");
        SolverSettings settings = properties.toSolverSettings();
        RoutingRequest request = RoutingRequest.forDataModel(data, settings);
        if (request.capacityRelaxed) {
            log.info("[SOLVER] Fleet cannot take all customers in one pass; ordering all customers with relaxed capacities {}",
                    Arrays.toString(request.vehicleCapacities));
        }
        RoutingSolution solution = routeOptimizer.solve(request);
        if (!solution.feasible) {
            log.error("!!! [SOLVER] No solution found! locations: {}, vehicles: {}, capacity: {}, total demand: {} !!!",
                    instance.nodes.size(), data.numVehicles, fleet.vehicleCapacity, instance.totalDemand());
            throw new NoSolutionFromOptimizerException(instance.nodes.size(), data.numVehicles,
                    request.vehicleCapacities, instance.totalDemand(), solution.status);
        }

        log.info("========= [4/5] Multi-trip dispatch ({}) ==========", properties.getMode());
        RouteSource routeSource = properties.getMode() == DispatchMode.REOPTIMIZE_PER_ROUND
                ? new ReoptimizingRouteSource(routeOptimizer, data, settings, solution.routes)
                : new FixedRouteSource(solution.routes);
        DispatchResult result = scheduler.dispatch(data, routeSource);

        log.info("========= [5/5] Report ==========");
        log.info(solutionFormatterService.renderItinerary(data, solution, result));
        return solutionFormatterService.formatPlan(data, solution, request.capacityRelaxed, result, properties.getMode());
    }

    /**
     * Warns about oversubscription and customers no vehicle can ever carry. Neither stops the run.
     */
    private void preCheckDemand(DataModel data) {
        long totalDemand = data.instance.totalDemand();
        long totalCapacity = data.instance.totalCapacity();
        log.info("[PRE-CHECK] Total demand: {}, total capacity: {}", totalDemand, totalCapacity);
        if (totalDemand > totalCapacity) {
            long minRounds = (totalDemand + totalCapacity - 1) / totalCapacity;
            log.warn("[PRE-CHECK] Total demand exceeds total capacity; deliveries need at least {} rounds", minRounds);
        }
        long maxCapacity = data.instance.maxCapacity();
        for (Node node : data.instance.nodes) {
            if (node.demand > maxCapacity) {
                log.warn("[PRE-CHECK] Customer {} '{}' demand {} exceeds vehicle capacity {} and cannot be served",
                        node.id, node.displayName(), node.demand, maxCapacity);
            }
        }
    }
}
