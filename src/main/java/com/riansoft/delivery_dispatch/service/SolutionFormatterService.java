package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.dto.*;
import com.riansoft.delivery_dispatch.model.*;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts dispatch results into response DTOs and the plain-text itinerary written to the log.
 * Vehicles are numbered from 1 in everything shown to people.
 */
@Service
public class SolutionFormatterService {

    public DispatchPlanDto formatPlan(DataModel data, RoutingSolution solution, boolean capacityRelaxed,
                                      DispatchResult result, DispatchMode mode) {
        List<PlannedRouteDto> planned = new ArrayList<>();
        for (VehicleRoute route : solution.routes) {
            if (route.isUnused()) continue;
            planned.add(new PlannedRouteDto(route.vehicleId + 1, route.nodes, plannedLoad(data, route), routeDistance(data, route)));
        }

        List<RoundReportDto> rounds = new ArrayList<>();
        for (RoundResult round : result.rounds) {
            List<VehicleTripDto> vehicles = new ArrayList<>();
            for (VehicleTrip trip : round.trips) {
                List<StopDto> stops = trip.stops.stream()
                        .map(stop -> toStopDto(data.instance.node(stop.nodeId), stop))
                        .collect(Collectors.toList());
                vehicles.add(new VehicleTripDto(trip.vehicleId + 1, stops, trip.load,
                        data.vehicleCapacities[trip.vehicleId], trip.distance));
            }
            rounds.add(new RoundReportDto(round.round, vehicles, round.newlyServed.size(),
                    round.totalServedAfterRound, round.distance));
        }

        return new DispatchPlanDto(mode.name(), solution.objectiveValue, capacityRelaxed, planned, rounds,
                formatSummary(data, result.summary), formatExcluded(data.instance.excludedRecords));
    }

    public DispatchSummaryDto formatSummary(DataModel data, DispatchSummary summary) {
        List<UnservedCustomerDto> unserved = summary.unserved.stream()
                .map(customer -> {
                    Node node = data.instance.node(customer.nodeId);
                    return new UnservedCustomerDto(customer.nodeId, node.displayName(), node.city,
                            customer.demand, customer.reason.name());
                })
                .collect(Collectors.toList());
        return new DispatchSummaryDto(summary.status().name(), summary.roundsUsed, summary.totalCustomers,
                summary.servedCount, summary.stalled, summary.totalDistance, unserved);
    }

    public List<ExcludedRecordDto> formatExcluded(List<ExcludedRecord> excluded) {
        return excluded.stream()
                .map(e -> new ExcludedRecordDto(e.record.rowNumber, e.record.latitude, e.record.longitude,
                        e.record.name, e.record.city, e.reason.name()))
                .collect(Collectors.toList());
    }

    public CustomerListDto formatCustomers(ProblemInstance instance) {
        List<StopDto> customers = instance.nodes.stream()
                .filter(node -> !node.isDepot())
                .map(node -> new StopDto(node.id, node.displayName(), node.city, node.orderValue, node.demand,
                        node.latitude, node.longitude))
                .collect(Collectors.toList());
        return new CustomerListDto(customers, formatExcluded(instance.excludedRecords));
    }

    /**
     * Human-readable report: single-trip reference routes, every round's itineraries, final summary.
     */
    public String renderItinerary(DataModel data, RoutingSolution solution, DispatchResult result) {
        StringBuilder out = new StringBuilder();
        out.append("\n=== SINGLE-TRIP SOLUTION (for reference) ===\n");
        double totalDistance = 0;
        long totalLoad = 0;
        for (VehicleRoute route : solution.routes) {
            if (route.isUnused()) continue;
            long load = 0;
            out.append("Route for Vehicle ").append(route.vehicleId + 1).append(":\n");
            for (int node : route.nodes) {
                load += data.demands[node];
                out.append(" -> ").append(label(data.instance.node(node))).append(" (Load: ").append(load).append(")");
            }
            double distance = routeDistance(data, route);
            out.append(String.format("%nDistance: %.2f km, Stops: %d%n", distance / 1000, route.customers().size()));
            totalDistance += distance;
            totalLoad += load;
        }
        out.append(String.format("Total distance: %.2f km%n", totalDistance / 1000));
        out.append("Total load: ").append(totalLoad).append('\n');

        out.append("\n=== MULTI-TRIP DELIVERY ===\n");
        for (RoundResult round : result.rounds) {
            out.append("\n--- ROUND ").append(round.round).append(" ---\n");
            for (VehicleTrip trip : round.trips) {
                out.append(String.format("Vehicle %d - Round %d:%n", trip.vehicleId + 1, round.round));
                out.append("  -> Start from DEPOT\n");
                int stopNumber = 1;
                for (TripStop stop : trip.stops) {
                    Node node = data.instance.node(stop.nodeId);
                    out.append(String.format("  -> Stop %d: %s", stopNumber++, label(node)));
                    if (node.orderValue != null) {
                        out.append(" - Order: ").append(node.orderValue);
                    }
                    out.append(String.format(" [load %d, %.2f km]%n", stop.load, stop.cumulativeDistance / 1000));
                }
                out.append("  -> Return to DEPOT\n");
                out.append(String.format("  Distance: %.2f km, Stops: %d, Load: %d%n",
                        trip.distance / 1000, trip.stops.size(), trip.load));
            }
            out.append(String.format("Round %d summary: served %d, total served %d, round distance %.2f km%n",
                    round.round, round.newlyServed.size(), round.totalServedAfterRound, round.distance / 1000));
        }

        DispatchSummary summary = result.summary;
        out.append("\n=== FINAL SUMMARY ===\n");
        out.append("Total rounds needed: ").append(summary.roundsUsed).append('\n');
        out.append("Customers served: ").append(summary.servedCount).append(" out of ").append(summary.totalCustomers).append('\n');
        out.append(String.format("Total distance: %.2f km%n", summary.totalDistance / 1000));
        if (!summary.allServed()) {
            out.append("Unserved customers:\n");
            for (UnservedCustomer customer : summary.unserved) {
                out.append(String.format("  %d %s (demand %d): %s%n", customer.nodeId,
                        label(data.instance.node(customer.nodeId)), customer.demand, customer.reason));
            }
        }
        return out.toString();
    }

    private StopDto toStopDto(Node node, TripStop stop) {
        StopDto dto = new StopDto(node.id, node.displayName(), node.city, node.orderValue, node.demand,
                node.latitude, node.longitude);
        dto.setCurrentLoad(stop.load);
        dto.setCumulativeDistanceMeters(stop.cumulativeDistance);
        return dto;
    }

    private String label(Node node) {
        if (node.isDepot()) return "DEPOT";
        return node.displayName() + " (" + (node.city == null ? "Unknown" : node.city) + ")";
    }

    private long plannedLoad(DataModel data, VehicleRoute route) {
        long load = 0;
        for (int node : route.customers()) load += data.demands[node];
        return load;
    }

    private double routeDistance(DataModel data, VehicleRoute route) {
        double distance = 0;
        for (int i = 1; i < route.nodes.size(); i++) {
            distance += data.distanceMatrix.get(route.nodes.get(i - 1), route.nodes.get(i));
        }
        return distance;
    }
}
