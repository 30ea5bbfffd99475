package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.exception.EmptyInstanceException;
import com.riansoft.delivery_dispatch.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns validated customer records into the canonical optimization instance.
 */
@Service
public class ProblemInstanceBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProblemInstanceBuilder.class);

    /**
     * Depot goes to index 0, each accepted record to 1..N in input order. Rejected records are logged and
     * returned in {@link ProblemInstance#excludedRecords}.
     *
     * @throws EmptyInstanceException if no record passes validation
     */
    public ProblemInstance build(List<CustomerRecord> records, FleetConfig config) {
        log.info("[BUILDER] Original data rows: {}", records.size());
        List<Node> nodes = new ArrayList<>();
        List<Long> demands = new ArrayList<>();
        List<ExcludedRecord> excluded = new ArrayList<>();

        nodes.add(Node.depot(config.depotLongitude, config.depotLatitude));
        demands.add(0L);

        for (CustomerRecord record : records) {
            Double latitude = parseFinite(record.latitude);
            Double longitude = parseFinite(record.longitude);
            ExclusionReason reason = null;
            if (latitude == null || longitude == null) {
                reason = ExclusionReason.UNPARSEABLE_COORDINATE;
            } else if (latitude < -90 || latitude > 90) {
                reason = ExclusionReason.LATITUDE_OUT_OF_RANGE;
            } else if (longitude < -180 || longitude > 180) {
                reason = ExclusionReason.LONGITUDE_OUT_OF_RANGE;
            } else if (!config.serviceArea.contains(latitude, longitude)) {
                reason = ExclusionReason.OUTSIDE_SERVICE_AREA;
            }

            long demand = config.demandPerCustomer;
            if (reason == null && record.demand != null) {
                Long parsed = parseDemand(record.demand);
                if (parsed == null) {
                    reason = ExclusionReason.INVALID_DEMAND;
                } else {
                    demand = parsed;
                }
            }

            if (reason != null) {
                excluded.add(new ExcludedRecord(record, reason));
                continue;
            }
            nodes.add(new Node(nodes.size(), longitude, latitude, demand,
                    record.name, record.city, record.orderValue, record.rowNumber));
            demands.add(demand);
        }

        if (!excluded.isEmpty()) {
            log.warn("[BUILDER] Filtered out {} row(s) with invalid/distant coordinates or demand:", excluded.size());
            for (ExcludedRecord e : excluded) {
                log.warn("  {} ({})", e.record, e.reason);
            }
        }
        int customerCount = nodes.size() - 1;
        if (customerCount == 0) {
            throw new EmptyInstanceException(excluded.size());
        }
        log.info("[BUILDER] After filtering: {} customer(s), {} location(s) including depot, service area {}",
                customerCount, nodes.size(), config.serviceArea);

        long[] demandVector = demands.stream().mapToLong(Long::longValue).toArray();
        long[] capacities = new long[config.numVehicles];
        Arrays.fill(capacities, config.vehicleCapacity);
        return new ProblemInstance(nodes, demandVector, capacities, excluded);
    }

    private Double parseFinite(String value) {
        if (value == null) return null;
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Long parseDemand(String value) {
        Double parsed = parseFinite(value);
        if (parsed == null || parsed < 0 || parsed > FleetConfig.MAX_QUANTITY) return null;
        return Math.round(parsed);
    }
}
