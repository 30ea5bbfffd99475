package com.riansoft.delivery_dispatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riansoft.delivery_dispatch.exception.DistanceMatrixException;
import com.riansoft.delivery_dispatch.model.DistanceMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Fetches the distance matrix from an OSRM {@code table} service.
 */
@Service
public class OsrmDistanceMatrixService implements DistanceMatrixProvider {

    private static final Logger log = LoggerFactory.getLogger(OsrmDistanceMatrixService.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String osrmServerUrl;

    public OsrmDistanceMatrixService(RestTemplateBuilder builder,
                                     @Value("${osrm.server.url}") String osrmServerUrl,
                                     @Value("${osrm.timeout-seconds:30}") long timeoutSeconds) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        this.objectMapper = new ObjectMapper();
        this.osrmServerUrl = osrmServerUrl.endsWith("/")
                ? osrmServerUrl.substring(0, osrmServerUrl.length() - 1)
                : osrmServerUrl;
    }

    @Override
    public DistanceMatrix fetchMatrix(List<String> coordinates) {
        int size = coordinates.size();
        log.info("========= [2/5] Requesting {}x{} distance matrix from OSRM ==========", size, size);
        String url = osrmServerUrl + "/table/v1/driving/" + String.join(";", coordinates) + "?annotations=distance";
        log.info("[API LOG] OSRM URL length: {} characters", url.length());

        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(URI.create(url), String.class);
        } catch (HttpStatusCodeException e) {
            log.error("[API LOG] OSRM returned HTTP {}: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new DistanceMatrixException("OSRM error: " + e.getResponseBodyAsString(), size, e.getStatusCode().value());
        } catch (RestClientException e) {
            log.error("[API LOG] OSRM request failed: {}", e.getMessage());
            throw new DistanceMatrixException("OSRM request failed: " + e.getMessage(), size, e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new DistanceMatrixException("OSRM error: " + response.getBody(), size, response.getStatusCode().value());
        }
        DistanceMatrix matrix = parseMatrix(response.getBody(), size);
        log.info("[API LOG] Distance matrix size: {}x{}", matrix.size(), matrix.size());
        return matrix;
    }

    private DistanceMatrix parseMatrix(String body, int size) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new DistanceMatrixException("Unparseable OSRM response: " + body, size, e);
        }
        JsonNode distances = root == null ? null : root.get("distances");
        if (distances == null || !distances.isArray()) {
            throw new DistanceMatrixException("No distances in response: " + body, size, (Integer) null);
        }
        if (distances.size() != size) {
            throw new DistanceMatrixException("Expected " + size + " rows but OSRM returned " + distances.size(), size, (Integer) null);
        }

        double[][] values = new double[size][size];
        for (int i = 0; i < size; i++) {
            JsonNode row = distances.get(i);
            if (row == null || !row.isArray() || row.size() != size) {
                throw new DistanceMatrixException("Distance row " + i + " does not have " + size + " entries", size, (Integer) null);
            }
            for (int j = 0; j < size; j++) {
                JsonNode cell = row.get(j);
                if (cell == null || !cell.isNumber()) {
                    // OSRM answers null when no road connects the two points
                    throw new DistanceMatrixException("No route between location " + i + " and " + j, size, (Integer) null);
                }
                values[i][j] = i == j ? 0 : cell.asDouble();
            }
        }
        try {
            return new DistanceMatrix(values);
        } catch (IllegalArgumentException e) {
            throw new DistanceMatrixException("Invalid distance matrix: " + e.getMessage(), size, e);
        }
    }
}
