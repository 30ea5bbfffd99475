package com.riansoft.delivery_dispatch.service;

import com.riansoft.delivery_dispatch.config.DispatchProperties;
import com.riansoft.delivery_dispatch.exception.CustomerDataException;
import com.riansoft.delivery_dispatch.model.CustomerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads customer rows from a CSV table whose column names come from configuration.
 * Coordinates are not validated here; that is the instance builder's job.
 */
@Service
public class CustomerDataService {

    private static final Logger log = LoggerFactory.getLogger(CustomerDataService.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final DispatchProperties.Columns columns;

    public CustomerDataService(DispatchProperties properties) {
        this.columns = properties.getColumns();
    }

    /**
     * @param location {@code classpath:} resource or file system path
     */
    public List<CustomerRecord> loadCustomers(String location) {
        Resource resource = location.startsWith(CLASSPATH_PREFIX)
                ? new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()))
                : new FileSystemResource(location);
        if (!resource.exists()) {
            throw new CustomerDataException("Customer file not found: " + location);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            List<CustomerRecord> records = readCustomers(inputStream);
            log.info("[DATA LOG] Loaded {} customer row(s) from {}", records.size(), location);
            return records;
        } catch (IOException e) {
            throw new CustomerDataException("Failed to read customer file " + location, e);
        }
    }

    public List<CustomerRecord> readCustomers(InputStream inputStream) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        String headerLine = reader.readLine();
        if (headerLine == null || headerLine.isBlank()) {
            throw new CustomerDataException("Customer file is empty, a header row is required");
        }
        // BOM written by spreadsheet exports
        if (headerLine.startsWith("\uFEFF")) {
            headerLine = headerLine.substring(1);
        }
        List<String> header = splitCsvLine(headerLine);
        log.info("[DATA LOG] CSV columns: {}", header);

        int latitudeIndex = requiredColumn(header, columns.getLatitude());
        int longitudeIndex = requiredColumn(header, columns.getLongitude());
        int nameIndex = optionalColumn(header, columns.getName());
        int cityIndex = optionalColumn(header, columns.getCity());
        int orderValueIndex = optionalColumn(header, columns.getOrderValue());
        int demandIndex = optionalColumn(header, columns.getDemand());

        List<CustomerRecord> records = new ArrayList<>();
        String line;
        int rowNumber = 0;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            List<String> cells = splitCsvLine(line);
            records.add(new CustomerRecord(rowNumber++,
                    cell(cells, latitudeIndex),
                    cell(cells, longitudeIndex),
                    cell(cells, nameIndex),
                    cell(cells, cityIndex),
                    cell(cells, orderValueIndex),
                    demandIndex < 0 ? null : cell(cells, demandIndex)));
        }
        return records;
    }

    private int requiredColumn(List<String> header, String name) {
        int index = optionalColumn(header, name);
        if (index < 0) {
            throw new CustomerDataException("Required column '" + name + "' not found in header " + header);
        }
        return index;
    }

    private int optionalColumn(List<String> header, String name) {
        if (name == null || name.isBlank()) return -1;
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().equalsIgnoreCase(name.trim())) return i;
        }
        return -1;
    }

    private String cell(List<String> cells, int index) {
        if (index < 0 || index >= cells.size()) return null;
        String value = cells.get(index).trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Splits one CSV line, honouring double-quoted fields and "" escapes.
     */
    static List<String> splitCsvLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
