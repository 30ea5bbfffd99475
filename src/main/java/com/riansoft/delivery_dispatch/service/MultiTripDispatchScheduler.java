package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splits the vehicles' visiting orders into capacity-bounded delivery rounds.
 * <p>
 * Each round walks every vehicle's route in vehicle id order. A customer becomes a stop when it is still
 * unserved and fits into the vehicle's remaining capacity for that round; otherwise it is left for a later
 * vehicle or round. The loop ends when every customer is served or a round serves nobody.
 */
@Service
public class MultiTripDispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(MultiTripDispatchScheduler.class);

    public DispatchResult dispatch(DataModel data, List<VehicleRoute> routes) {
        return dispatch(data, new FixedRouteSource(routes));
    }

    public DispatchResult dispatch(DataModel data, RouteSource routeSource) {
        Set<Integer> allCustomers = data.instance.customerIds();
        ServedSet served = new ServedSet();
        List<RoundResult> rounds = new ArrayList<>();
        Map<Integer, Set<Integer>> vehiclesByCustomer = new HashMap<>();
        boolean stalled = false;

        log.info("========= [DISPATCH] Multi-trip delivery simulation, {} customers to serve ==========", allCustomers.size());

        int round = 1;
        while (true) {
            Set<Integer> remaining = new LinkedHashSet<>(allCustomers);
            remaining.removeIf(served::contains);
            if (remaining.isEmpty()) {
                break;
            }
            log.info("--- ROUND {} --- customers remaining: {}", round, remaining.size());

            List<VehicleRoute> routes = orderedRoutes(data, routeSource.routesForRound(round, remaining));
            for (VehicleRoute route : routes) {
                for (int customer : route.customers()) {
                    vehiclesByCustomer.computeIfAbsent(customer, c -> new HashSet<>()).add(route.vehicleId);
                }
            }

            RoundResult result = runRound(data, routes, round, remaining, served.size());
            if (result.newlyServed.isEmpty()) {
                log.warn("[DISPATCH] Round {} could not serve any more customers. Check capacity constraints.", round);
                stalled = true;
                break;
            }
            served.addAll(result.newlyServed);
            rounds.add(result);
            log.info("Round {} summary: served this round {}, total served {}, round distance {} km",
                    round, result.newlyServed.size(), served.size(), String.format("%.2f", result.distance / 1000));
            round++;
        }

        List<UnservedCustomer> unserved = classifyUnserved(data, allCustomers, served, vehiclesByCustomer);
        double totalDistance = rounds.stream().mapToDouble(r -> r.distance).sum();
        DispatchSummary summary = new DispatchSummary(rounds.size(), allCustomers.size(), served.size(),
                unserved, totalDistance, stalled);

        log.info("========= [DISPATCH] Finished: {} round(s), {} of {} customers served ==========",
                summary.roundsUsed, summary.servedCount, summary.totalCustomers);
        for (UnservedCustomer customer : unserved) {
            Node node = data.instance.node(customer.nodeId);
            log.warn("[DISPATCH] Unserved customer {} '{}' (demand {}): {}",
                    customer.nodeId, node.displayName(), customer.demand, customer.reason);
        }
        return new DispatchResult(rounds, summary);
    }

    /**
     * One atomic pass over all vehicles. Nothing is merged into the served set here.
     */
    private RoundResult runRound(DataModel data, List<VehicleRoute> routes, int round,
                                 Set<Integer> remaining, int servedBefore) {
        Set<Integer> takenThisRound = new LinkedHashSet<>();
        List<VehicleTrip> trips = new ArrayList<>();

        for (VehicleRoute route : routes) {
            long capacity = data.vehicleCapacities[route.vehicleId];
            long load = 0;
            double distance = 0;
            List<TripStop> stops = new ArrayList<>();

            int previous = route.nodes.get(0);
            for (int i = 1; i < route.nodes.size(); i++) {
                int node = route.nodes.get(i);
                distance += data.distanceMatrix.get(previous, node);
                previous = node;
                if (node == data.depotIndex || !remaining.contains(node) || takenThisRound.contains(node)) {
                    continue;
                }
                long demand = data.demands[node];
                // load <= capacity, so the subtraction cannot overflow
                if (demand > capacity - load) {
                    continue;
                }
                load += demand;
                takenThisRound.add(node);
                stops.add(new TripStop(node, demand, load, distance));
            }

            if (!stops.isEmpty()) {
                trips.add(new VehicleTrip(route.vehicleId, round, stops, load, distance));
            }
        }
        return new RoundResult(round, trips, takenThisRound, servedBefore + takenThisRound.size());
    }

    private List<VehicleRoute> orderedRoutes(DataModel data, List<VehicleRoute> routes) {
        for (VehicleRoute route : routes) {
            if (route.vehicleId < 0 || route.vehicleId >= data.numVehicles) {
                throw new IllegalArgumentException("Route references unknown vehicle " + route.vehicleId);
            }
            for (int node : route.nodes) {
                if (node < 0 || node >= data.distanceMatrix.size()) {
                    throw new IllegalArgumentException("Route of vehicle " + route.vehicleId + " references unknown node " + node);
                }
            }
        }
        return routes.stream()
                .sorted(Comparator.comparingInt(route -> route.vehicleId))
                .collect(Collectors.toList());
    }

    private List<UnservedCustomer> classifyUnserved(DataModel data, Set<Integer> allCustomers, ServedSet served,
                                                    Map<Integer, Set<Integer>> vehiclesByCustomer) {
        long maxCapacity = data.instance.maxCapacity();
        List<UnservedCustomer> unserved = new ArrayList<>();
        for (int customer : allCustomers) {
            if (served.contains(customer)) continue;
            long demand = data.demands[customer];
            UnservedReason reason;
            if (demand > maxCapacity) {
                reason = UnservedReason.DEMAND_EXCEEDS_CAPACITY;
            } else if (!vehiclesByCustomer.containsKey(customer)) {
                reason = UnservedReason.NOT_ROUTED;
            } else if (vehiclesByCustomer.get(customer).stream().allMatch(v -> demand > data.vehicleCapacities[v])) {
                reason = UnservedReason.CAPACITY_OF_ASSIGNED_VEHICLE_EXCEEDED;
            } else {
                reason = UnservedReason.NO_PROGRESS;
            }
            unserved.add(new UnservedCustomer(customer, demand, reason));
        }
        return unserved;
    }
}
