package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.dto.DispatchPlanDto;
import com.riansoft.delivery_dispatch.dto.StopDto;
import com.riansoft.delivery_dispatch.dto.VehicleTripDto;
import com.riansoft.delivery_dispatch.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.riansoft.delivery_dispatch.testutil.DispatchFixtures.lineModel;
import static com.riansoft.delivery_dispatch.testutil.DispatchFixtures.route;
import static org.junit.jupiter.api.Assertions.*;

class SolutionFormatterServiceTest {

    private final SolutionFormatterService formatter = new SolutionFormatterService();
    private final MultiTripDispatchScheduler scheduler = new MultiTripDispatchScheduler();

    @Test
    void planNumbersVehiclesFromOneAndSkipsUnusedRoutes() {
        DataModel data = lineModel(new long[]{4, 4, 4}, 10, 10);
        RoutingSolution solution = RoutingSolution.feasible(
                List.of(VehicleRoute.unused(0), route(1, 0, 1, 2, 3, 0)), 600, "SUCCESS");
        DispatchResult result = scheduler.dispatch(data, solution.routes);

        DispatchPlanDto plan = formatter.formatPlan(data, solution, false, result, DispatchMode.FIXED_ROUTE);

        assertEquals(1, plan.getSingleTripRoutes().size());
        assertEquals(2, plan.getSingleTripRoutes().get(0).getVehicleNumber());
        assertEquals(12, plan.getSingleTripRoutes().get(0).getPlannedLoad());
        assertEquals(600.0, plan.getSingleTripRoutes().get(0).getDistanceMeters(), 1e-9);

        VehicleTripDto trip = plan.getRounds().get(0).getVehicles().get(0);
        assertEquals(2, trip.getVehicleNumber());
        assertEquals(10, trip.getCapacity());
        assertEquals(8, trip.getLoad());
        assertEquals(0.6, trip.getDistanceKm(), 1e-9);
        StopDto stop = trip.getStops().get(1);
        assertEquals("Customer B", stop.getName());
        assertEquals("200", stop.getOrderValue());
        assertEquals(8, stop.getCurrentLoad());
        assertEquals(200.0, stop.getCumulativeDistanceMeters(), 1e-9);

        assertEquals("FULLY_SERVED", plan.getSummary().getStatus());
        assertEquals(1200.0, plan.getSummary().getTotalDistanceMeters(), 1e-9);
    }

    @Test
    void summaryListsUnservedCustomersWithReason() {
        DataModel data = lineModel(new long[]{2, 12}, 10);
        DispatchResult result = scheduler.dispatch(data, List.of(route(0, 0, 1, 2, 0)));

        DispatchPlanDto plan = formatter.formatPlan(data,
                RoutingSolution.feasible(List.of(route(0, 0, 1, 2, 0)), 400, "SUCCESS"), true, result,
                DispatchMode.FIXED_ROUTE);

        assertEquals("SERVED_WITH_EXCEPTIONS", plan.getSummary().getStatus());
        assertTrue(plan.getSummary().isStalled());
        assertEquals(1, plan.getSummary().getUnservedCustomers().size());
        assertEquals("Customer B", plan.getSummary().getUnservedCustomers().get(0).getName());
        assertEquals("DEMAND_EXCEEDS_CAPACITY", plan.getSummary().getUnservedCustomers().get(0).getReason());
    }

    @Test
    void itineraryContainsEverySection() {
        DataModel data = lineModel(new long[]{4, 4, 4}, 10);
        RoutingSolution solution = RoutingSolution.feasible(List.of(route(0, 0, 1, 2, 3, 0)), 600, "SUCCESS");
        DispatchResult result = scheduler.dispatch(data, solution.routes);

        String text = formatter.renderItinerary(data, solution, result);

        assertTrue(text.contains("=== SINGLE-TRIP SOLUTION (for reference) ==="));
        assertTrue(text.contains("=== MULTI-TRIP DELIVERY ==="));
        assertTrue(text.contains("--- ROUND 1 ---"));
        assertTrue(text.contains("--- ROUND 2 ---"));
        assertTrue(text.contains("Stop 1: Customer A (Bengaluru) - Order: 100"));
        assertTrue(text.contains("Total rounds needed: 2"));
        assertTrue(text.contains("Customers served: 3 out of 3"));
        assertFalse(text.contains("Unserved customers:"));
    }
}
