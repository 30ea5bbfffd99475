package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.config.DispatchProperties;
import com.riansoft.delivery_dispatch.exception.CustomerDataException;
import com.riansoft.delivery_dispatch.model.CustomerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CustomerDataServiceTest {

    private DispatchProperties properties;
    private CustomerDataService service;

    @BeforeEach
    void setUp() {
        properties = new DispatchProperties();
        properties.getColumns().setLatitude("Latitide");
        properties.getColumns().setDemand("Crates");
        service = new CustomerDataService(properties);
    }

    @Test
    @DisplayName("Classpath file is read with configured column names, BOM and quoted cells")
    void readsClasspathFile() {
        List<CustomerRecord> records = service.loadCustomers("classpath:customers-test.csv");

        assertEquals(3, records.size());

        CustomerRecord first = records.get(0);
        assertEquals(0, first.rowNumber);
        assertEquals("Fresh Basket, Indiranagar", first.name);
        assertEquals("Bengaluru", first.city);
        assertEquals("2300", first.orderValue);
        assertEquals("12.9719", first.latitude);
        assertEquals("77.6412", first.longitude);
        assertEquals("4", first.demand);

        CustomerRecord second = records.get(1);
        assertEquals(1, second.rowNumber);
        assertNull(second.demand);

        CustomerRecord third = records.get(2);
        assertEquals("Raju \"Big\" Stores", third.name);
        assertNull(third.city);
        assertNull(third.latitude);
        assertEquals("2", third.demand);
    }

    @Test
    void demandStaysNullWhenColumnNotConfigured() {
        properties.getColumns().setDemand("");
        service = new CustomerDataService(properties);

        List<CustomerRecord> records = service.loadCustomers("classpath:customers-test.csv");

        assertTrue(records.stream().allMatch(r -> r.demand == null));
    }

    @Test
    void headerMatchIgnoresCase(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("orders.csv");
        Files.writeString(file, "customer name,LATITIDE,longitude\nShop,12.9,77.6\n");

        List<CustomerRecord> records = service.loadCustomers(file.toString());

        assertEquals(1, records.size());
        assertEquals("Shop", records.get(0).name);
        assertNull(records.get(0).city);
    }

    @Test
    void missingLatitudeColumnIsRejected() {
        InputStream input = stream("Customer Name,Longitude\nShop,77.6\n");

        CustomerDataException e = assertThrows(CustomerDataException.class, () -> service.readCustomers(input));
        assertTrue(e.getMessage().contains("Latitide"));
    }

    @Test
    void emptyFileIsRejected() {
        assertThrows(CustomerDataException.class, () -> service.readCustomers(stream("")));
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(CustomerDataException.class, () -> service.loadCustomers("/no/such/orders.csv"));
        assertThrows(CustomerDataException.class, () -> service.loadCustomers("classpath:no-such.csv"));
    }

    @Test
    void splitsQuotedCells() {
        assertEquals(List.of("a", "b,c", "", "d\"e"), CustomerDataService.splitCsvLine("a,\"b,c\",,\"d\"\"e\""));
    }

    private InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
