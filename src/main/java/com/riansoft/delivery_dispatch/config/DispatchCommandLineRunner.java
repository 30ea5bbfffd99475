package com.riansoft.delivery_dispatch.config;

import com.riansoft.delivery_dispatch.dto.DispatchPlanDto;
import com.riansoft.delivery_dispatch.exception.DispatchException;
import com.riansoft.delivery_dispatch.service.DispatchPipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one dispatch over the configured customer file at start-up when {@code dispatch.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "dispatch", name = "run-on-startup", havingValue = "true")
public class DispatchCommandLineRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DispatchCommandLineRunner.class);

    private final DispatchPipelineService pipelineService;

    public DispatchCommandLineRunner(DispatchPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public void run(String... args) {
        try {
            DispatchPlanDto plan = pipelineService.planFromConfiguredFile();
            log.info("[RUNNER] Dispatch finished with status {} in {} round(s)",
                    plan.getSummary().getStatus(), plan.getSummary().getRoundsUsed());
        } catch (DispatchException e) {
            log.error("[RUNNER] Dispatch run failed: {}", e.getMessage());
            throw e;
        }
    }
}
