package com.riansoft.delivery_dispatch.testutil;

import com.riansoft.delivery_dispatch.model.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small hand-made instances for scheduler, formatter and pipeline tests.
 */
public final class DispatchFixtures {

    private DispatchFixtures() {}

    /**
     * Customers placed on a line, node i at position i * 100 m, depot at 0.
     */
    public static DataModel lineModel(long[] customerDemands, long... capacities) {
        int size = customerDemands.length + 1;
        double[][] matrix = new double[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                matrix[i][j] = Math.abs(i - j) * 100.0;
            }
        }
        return model(customerDemands, capacities, matrix);
    }

    public static DataModel model(long[] customerDemands, long[] capacities, double[][] matrix) {
        List<Node> nodes = new ArrayList<>();
        nodes.add(Node.depot(77.5946, 12.9716));
        long[] demands = new long[customerDemands.length + 1];
        for (int i = 0; i < customerDemands.length; i++) {
            int id = i + 1;
            demands[id] = customerDemands[i];
            nodes.add(new Node(id, 77.6 + id * 0.001, 12.97, customerDemands[i],
                    "Customer " + (char) ('A' + i), "Bengaluru", String.valueOf(100 * id), i));
        }
        ProblemInstance instance = new ProblemInstance(nodes, demands, capacities, List.of());
        return new DataModel(instance, new DistanceMatrix(matrix));
    }

    public static VehicleRoute route(int vehicleId, Integer... nodes) {
        return new VehicleRoute(vehicleId, Arrays.asList(nodes));
    }

    public static SolverSettings solverSettings(boolean relax) {
        return new SolverSettings("PATH_CHEAPEST_ARC", "GUIDED_LOCAL_SEARCH", 1, false, relax);
    }

    public static FleetConfig bangaloreFleet(int vehicles, long capacity, long demandPerCustomer) {
        return new FleetConfig(vehicles, capacity, demandPerCustomer, 77.5946, 12.9716,
                new GeoBoundingBox(12.5, 13.5, 77.0, 78.0));
    }
}
