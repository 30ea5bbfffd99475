package com.riansoft.delivery_dispatch.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical optimization instance: depot at index 0, customers at 1..N in input order.
 */
public class ProblemInstance {
    public final List<Node> nodes;
    public final long[] demands;
    public final long[] vehicleCapacities;
    public final int numVehicles;
    public final int depotIndex = Node.DEPOT_ID;
    public final List<ExcludedRecord> excludedRecords;

    public ProblemInstance(List<Node> nodes, long[] demands, long[] vehicleCapacities,
                           List<ExcludedRecord> excludedRecords) {
        if (nodes.size() != demands.length) {
            throw new IllegalArgumentException("nodes (" + nodes.size() + ") and demands (" + demands.length + ") differ in size");
        }
        if (vehicleCapacities.length == 0) {
            throw new IllegalArgumentException("At least one vehicle is required");
        }
        for (long capacity : vehicleCapacities) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Vehicle capacity must be positive: " + capacity);
            }
        }
        this.nodes = List.copyOf(nodes);
        this.demands = demands.clone();
        this.vehicleCapacities = vehicleCapacities.clone();
        this.numVehicles = vehicleCapacities.length;
        this.excludedRecords = excludedRecords == null ? List.of() : List.copyOf(excludedRecords);
    }

    public int customerCount() {
        return nodes.size() - 1;
    }

    public Node node(int id) {
        return nodes.get(id);
    }

    public Set<Integer> customerIds() {
        Set<Integer> ids = new LinkedHashSet<>();
        for (int i = 1; i < nodes.size(); i++) {
            ids.add(i);
        }
        return Collections.unmodifiableSet(ids);
    }

    public long totalDemand() {
        long total = 0;
        for (long demand : demands) total = Math.addExact(total, demand);
        return total;
    }

    public long totalCapacity() {
        long total = 0;
        for (long capacity : vehicleCapacities) total = Math.addExact(total, capacity);
        return total;
    }

    public long maxCapacity() {
        long max = 0;
        for (long capacity : vehicleCapacities) max = Math.max(max, capacity);
        return max;
    }

    public long minCapacity() {
        long min = Long.MAX_VALUE;
        for (long capacity : vehicleCapacities) min = Math.min(min, capacity);
        return min;
    }

    /**
     * "longitude,latitude" strings in node order, depot first.
     */
    public List<String> coordinates() {
        return nodes.stream().map(Node::coordinateString).collect(Collectors.toList());
    }
}
