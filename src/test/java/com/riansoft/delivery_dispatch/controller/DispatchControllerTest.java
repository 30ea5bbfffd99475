package com.riansoft.delivery_dispatch.controller;

import com.riansoft.delivery_dispatch.dto.DispatchPlanDto;
import com.riansoft.delivery_dispatch.dto.DispatchSummaryDto;
import com.riansoft.delivery_dispatch.exception.CustomerDataException;
import com.riansoft.delivery_dispatch.exception.DistanceMatrixException;
import com.riansoft.delivery_dispatch.exception.EmptyInstanceException;
import com.riansoft.delivery_dispatch.exception.NoSolutionFromOptimizerException;
import com.riansoft.delivery_dispatch.model.CustomerRecord;
import com.riansoft.delivery_dispatch.service.DispatchPipelineService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DispatchController.class)
class DispatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DispatchPipelineService pipelineService;

    @Test
    void returnsPlanForConfiguredFile() throws Exception {
        DispatchSummaryDto summary = new DispatchSummaryDto("FULLY_SERVED", 2, 3, 3, false, 1200.0, List.of());
        when(pipelineService.planFromConfiguredFile())
                .thenReturn(new DispatchPlanDto("FIXED_ROUTE", 600, true, List.of(), List.of(), summary, List.of()));

        mockMvc.perform(get("/api/dispatch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("FIXED_ROUTE"))
                .andExpect(jsonPath("$.capacityRelaxedForSolve").value(true))
                .andExpect(jsonPath("$.summary.status").value("FULLY_SERVED"))
                .andExpect(jsonPath("$.summary.roundsUsed").value(2));
    }

    @Test
    void postedCustomersBecomeRecordsInOrder() throws Exception {
        DispatchSummaryDto summary = new DispatchSummaryDto("FULLY_SERVED", 1, 2, 2, false, 800.0, List.of());
        when(pipelineService.planFromRecords(anyList()))
                .thenReturn(new DispatchPlanDto("FIXED_ROUTE", 800, false, List.of(), List.of(), summary, List.of()));

        String body = "{\"customers\":["
                + "{\"latitude\":\"12.9352\",\"longitude\":\"77.6245\",\"name\":\"Sri Lakshmi Stores\",\"city\":\"Bengaluru\",\"orderValue\":\"1250\"},"
                + "{\"latitude\":\"12.9784\",\"longitude\":\"77.6408\",\"name\":\"Annapurna Provisions\",\"demand\":\"5\"}"
                + "]}";

        mockMvc.perform(post("/api/dispatch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.servedCustomers").value(2));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CustomerRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(pipelineService).planFromRecords(captor.capture());
        List<CustomerRecord> records = captor.getValue();
        assertEquals(2, records.size());
        assertEquals(0, records.get(0).rowNumber);
        assertNull(records.get(0).demand);
        assertEquals(1, records.get(1).rowNumber);
        assertEquals("5", records.get(1).demand);
    }

    @Test
    void emptyCustomerListIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/dispatch").contentType(MediaType.APPLICATION_JSON).content("{\"customers\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value(containsString("customers")));
    }

    @Test
    void nullCustomerEntryIsBadRequestNamingTheField() throws Exception {
        mockMvc.perform(post("/api/dispatch").contentType(MediaType.APPLICATION_JSON).content("{\"customers\":[null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value(containsString("customers[0]")));
        verifyNoInteractions(pipelineService);
    }

    @Test
    void emptyInstanceMapsToUnprocessableEntity() throws Exception {
        when(pipelineService.planFromConfiguredFile()).thenThrow(new EmptyInstanceException(4));

        mockMvc.perform(get("/api/dispatch"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("EMPTY_INSTANCE"));
    }

    @Test
    void customerDataErrorMapsToBadRequest() throws Exception {
        when(pipelineService.listConfiguredCustomers()).thenThrow(new CustomerDataException("Customer file not found: x.csv"));

        mockMvc.perform(get("/api/customers"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_CUSTOMER_DATA"));
    }

    @Test
    void distanceProviderErrorMapsToBadGateway() throws Exception {
        when(pipelineService.planFromConfiguredFile())
                .thenThrow(new DistanceMatrixException("OSRM error", 5, 500));

        mockMvc.perform(get("/api/dispatch"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("DISTANCE_PROVIDER_ERROR"));
    }

    @Test
    void noSolutionMapsToUnprocessableEntity() throws Exception {
        when(pipelineService.planFromConfiguredFile())
                .thenThrow(new NoSolutionFromOptimizerException(4, 1, new long[]{10}, 12, "ROUTING_FAIL"));

        mockMvc.perform(get("/api/dispatch"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("NO_SOLUTION"));
    }
}
