package com.riansoft.delivery_dispatch.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered visiting sequence of one vehicle, depot to depot.
 */
public class VehicleRoute {
    public final int vehicleId;
    public final List<Integer> nodes;

    public VehicleRoute(int vehicleId, List<Integer> nodes) {
        if (nodes.size() < 2 || nodes.get(0) != Node.DEPOT_ID || nodes.get(nodes.size() - 1) != Node.DEPOT_ID) {
            throw new IllegalArgumentException("Route of vehicle " + vehicleId + " must start and end at the depot: " + nodes);
        }
        long distinctCustomers = nodes.subList(1, nodes.size() - 1).stream().distinct().count();
        if (distinctCustomers != nodes.size() - 2) {
            throw new IllegalArgumentException("Route of vehicle " + vehicleId + " visits a customer twice: " + nodes);
        }
        this.vehicleId = vehicleId;
        this.nodes = List.copyOf(nodes);
    }

    public static VehicleRoute unused(int vehicleId) {
        return new VehicleRoute(vehicleId, List.of(Node.DEPOT_ID, Node.DEPOT_ID));
    }

    public List<Integer> customers() {
        return nodes.subList(1, nodes.size() - 1);
    }

    public boolean isUnused() {
        return nodes.size() == 2;
    }

    @Override
    public String toString() {
        return nodes.stream().map(String::valueOf).collect(Collectors.joining(" -> "));
    }
}
