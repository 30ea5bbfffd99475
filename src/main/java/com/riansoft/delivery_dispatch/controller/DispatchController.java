package com.riansoft.delivery_dispatch.controller;

import com.riansoft.delivery_dispatch.dto.*;
import com.riansoft.delivery_dispatch.model.CustomerRecord;
import com.riansoft.delivery_dispatch.service.DispatchPipelineService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api")
public class DispatchController {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private final DispatchPipelineService pipelineService;

    public DispatchController(DispatchPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    /**
     * Plans deliveries for the configured customer file.
     */
    @GetMapping("/dispatch")
    public ResponseEntity<DispatchPlanDto> dispatchConfiguredCustomers() {
        return ResponseEntity.ok(pipelineService.planFromConfiguredFile());
    }

    /**
     * Plans deliveries for the posted customers with the configured fleet and depot.
     */
    @PostMapping("/dispatch")
    public ResponseEntity<DispatchPlanDto> dispatchCustomers(@Valid @RequestBody DispatchRequestDto request) {
        log.info("[CONTROLLER LOG] Dispatch requested for {} posted customer(s)", request.getCustomers().size());
        List<CustomerRecord> records = new ArrayList<>();
        int row = 0;
        for (CustomerInputDto customer : request.getCustomers()) {
            records.add(new CustomerRecord(row++, customer.getLatitude(), customer.getLongitude(),
                    customer.getName(), customer.getCity(), customer.getOrderValue(), customer.getDemand()));
        }
        return ResponseEntity.ok(pipelineService.planFromRecords(records));
    }

    @GetMapping("/customers")
    public ResponseEntity<CustomerListDto> getCustomers() {
        return ResponseEntity.ok(pipelineService.listConfiguredCustomers());
    }
}
