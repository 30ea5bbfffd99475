package com.riansoft.delivery_dispatch.model;

import org.junit.jupiter.api.Test;

import static com.riansoft.delivery_dispatch.testutil.DispatchFixtures.lineModel;
import static com.riansoft.delivery_dispatch.testutil.DispatchFixtures.solverSettings;
import static org.junit.jupiter.api.Assertions.*;

class RoutingRequestTest {

    @Test
    void keepsRealCapacitiesWhenFleetFits() {
        DataModel data = lineModel(new long[]{3, 3, 3}, 5, 5);

        RoutingRequest request = RoutingRequest.forDataModel(data, solverSettings(true));

        assertFalse(request.capacityRelaxed);
        assertArrayEquals(new long[]{5, 5}, request.vehicleCapacities);
        assertEquals(4, request.distanceMatrix.length);
        assertEquals(200, request.distanceMatrix[1][3]);
    }

    @Test
    void raisesCapacityToFairShareWhenOversubscribed() {
        DataModel data = lineModel(new long[]{4, 4, 4, 4, 4}, 5, 5);

        RoutingRequest request = RoutingRequest.forDataModel(data, solverSettings(true));

        assertTrue(request.capacityRelaxed);
        // ceil(20 / 2)
        assertArrayEquals(new long[]{10, 10}, request.vehicleCapacities);
        assertArrayEquals(new long[]{5, 5}, data.vehicleCapacities);
    }

    @Test
    void raisesCapacityToLargestDemand() {
        DataModel data = lineModel(new long[]{1, 9}, 5, 20);

        RoutingRequest request = RoutingRequest.forDataModel(data, solverSettings(true));

        assertTrue(request.capacityRelaxed);
        assertArrayEquals(new long[]{9, 20}, request.vehicleCapacities);
    }

    @Test
    void leavesCapacitiesAloneWhenRelaxationDisabled() {
        DataModel data = lineModel(new long[]{4, 4, 4}, 5);

        RoutingRequest request = RoutingRequest.forDataModel(data, solverSettings(false));

        assertFalse(request.capacityRelaxed);
        assertArrayEquals(new long[]{5}, request.vehicleCapacities);
    }

    @Test
    void rejectsDemandVectorOfWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> RoutingRequest.create(
                new long[2][2], new long[]{0, 1, 2}, new long[]{5}, 0, solverSettings(true)));
    }
}
