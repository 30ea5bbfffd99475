package com.riansoft.delivery_dispatch.config;

import com.riansoft.delivery_dispatch.model.DispatchMode;
import com.riansoft.delivery_dispatch.model.FleetConfig;
import com.riansoft.delivery_dispatch.model.GeoBoundingBox;
import com.riansoft.delivery_dispatch.model.SolverSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externally supplied run parameters ({@code dispatch.*}).
 * Converted into immutable {@link FleetConfig} and {@link SolverSettings} for every run.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private int vehicles = 5;
    private long vehicleCapacity = 50;
    private long demandPerCustomer = 3;
    private String customerFile = "classpath:orderlist.csv";
    private DispatchMode mode = DispatchMode.FIXED_ROUTE;
    private boolean runOnStartup = false;
    private final Depot depot = new Depot();
    private final ServiceArea serviceArea = new ServiceArea();
    private final Columns columns = new Columns();
    private final Solver solver = new Solver();

    public FleetConfig toFleetConfig() {
        return new FleetConfig(vehicles, vehicleCapacity, demandPerCustomer, depot.getLongitude(), depot.getLatitude(),
                new GeoBoundingBox(serviceArea.getMinLatitude(), serviceArea.getMaxLatitude(),
                        serviceArea.getMinLongitude(), serviceArea.getMaxLongitude()));
    }

    public SolverSettings toSolverSettings() {
        return new SolverSettings(solver.getFirstSolutionStrategy(), solver.getLocalSearchMetaheuristic(),
                solver.getTimeLimitSeconds(), solver.isLogSearch(), solver.isRelaxCapacityWhenOversubscribed());
    }

    // --- Getters and Setters ---
    public int getVehicles() { return vehicles; }
    public void setVehicles(int vehicles) { this.vehicles = vehicles; }
    public long getVehicleCapacity() { return vehicleCapacity; }
    public void setVehicleCapacity(long vehicleCapacity) { this.vehicleCapacity = vehicleCapacity; }
    public long getDemandPerCustomer() { return demandPerCustomer; }
    public void setDemandPerCustomer(long demandPerCustomer) { this.demandPerCustomer = demandPerCustomer; }
    public String getCustomerFile() { return customerFile; }
    public void setCustomerFile(String customerFile) { this.customerFile = customerFile; }
    public DispatchMode getMode() { return mode; }
    public void setMode(DispatchMode mode) { this.mode = mode; }
    public boolean isRunOnStartup() { return runOnStartup; }
    public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
    public Depot getDepot() { return depot; }
    public ServiceArea getServiceArea() { return serviceArea; }
    public Columns getColumns() { return columns; }
    public Solver getSolver() { return solver; }

    public static class Depot {
        private double longitude = 77.5946;
        private double latitude = 12.9716;

        public double getLongitude() { return longitude; }
        public void setLongitude(double longitude) { this.longitude = longitude; }
        public double getLatitude() { return latitude; }
        public void setLatitude(double latitude) { this.latitude = latitude; }
    }

    public static class ServiceArea {
        private double minLatitude = 12.5;
        private double maxLatitude = 13.5;
        private double minLongitude = 77.0;
        private double maxLongitude = 78.0;

        public double getMinLatitude() { return minLatitude; }
        public void setMinLatitude(double minLatitude) { this.minLatitude = minLatitude; }
        public double getMaxLatitude() { return maxLatitude; }
        public void setMaxLatitude(double maxLatitude) { this.maxLatitude = maxLatitude; }
        public double getMinLongitude() { return minLongitude; }
        public void setMinLongitude(double minLongitude) { this.minLongitude = minLongitude; }
        public double getMaxLongitude() { return maxLongitude; }
        public void setMaxLongitude(double maxLongitude) { this.maxLongitude = maxLongitude; }
    }

    /**
     * Header names of the customer table. An empty name means the column is not present.
     */
    public static class Columns {
        private String latitude = "Latitude";
        private String longitude = "Longitude";
        private String name = "Customer Name";
        private String city = "City";
        private String orderValue = "Order Value";
        private String demand = "";

        public String getLatitude() { return latitude; }
        public void setLatitude(String latitude) { this.latitude = latitude; }
        public String getLongitude() { return longitude; }
        public void setLongitude(String longitude) { this.longitude = longitude; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getCity() { return city; }
        public void setCity(String city) { this.city = city; }
        public String getOrderValue() { return orderValue; }
        public void setOrderValue(String orderValue) { this.orderValue = orderValue; }
        public String getDemand() { return demand; }
        public void setDemand(String demand) { this.demand = demand; }
    }

    public static class Solver {
        private String firstSolutionStrategy = "PATH_CHEAPEST_ARC";
        private String localSearchMetaheuristic = "GUIDED_LOCAL_SEARCH";
        private long timeLimitSeconds = 60;
        private boolean logSearch = false;
        private boolean relaxCapacityWhenOversubscribed = true;

        public String getFirstSolutionStrategy() { return firstSolutionStrategy; }
        public void setFirstSolutionStrategy(String firstSolutionStrategy) { this.firstSolutionStrategy = firstSolutionStrategy; }
        public String getLocalSearchMetaheuristic() { return localSearchMetaheuristic; }
        public void setLocalSearchMetaheuristic(String localSearchMetaheuristic) { this.localSearchMetaheuristic = localSearchMetaheuristic; }
        public long getTimeLimitSeconds() { return timeLimitSeconds; }
        public void setTimeLimitSeconds(long timeLimitSeconds) { this.timeLimitSeconds = timeLimitSeconds; }
        public boolean isLogSearch() { return logSearch; }
        public void setLogSearch(boolean logSearch) { this.logSearch = logSearch; }
        public boolean isRelaxCapacityWhenOversubscribed() { return relaxCapacityWhenOversubscribed; }
        public void setRelaxCapacityWhenOversubscribed(boolean relaxCapacityWhenOversubscribed) { this.relaxCapacityWhenOversubscribed = relaxCapacityWhenOversubscribed; }
    }
}
