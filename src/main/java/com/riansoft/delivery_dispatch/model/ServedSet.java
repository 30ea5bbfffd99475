package com.riansoft.delivery_dispatch.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Customers delivered to so far. Members are only ever added.
 */
public class ServedSet {
    private final Set<Integer> served = new LinkedHashSet<>();

    /**
     * @return number of ids that were not yet present
     */
    public int addAll(Collection<Integer> customerIds) {
        int before = served.size();
        served.addAll(customerIds);
        return served.size() - before;
    }

    public boolean contains(int customerId) {
        return served.contains(customerId);
    }

    public int size() {
        return served.size();
    }
}
