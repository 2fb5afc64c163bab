package com.previewenv.api.rest;

import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.engine.allocator.CapacityUsage;
import com.previewenv.engine.service.CapacityReport;
import com.previewenv.engine.service.EnvironmentQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Environment counts and routing priority usage.
 */
@RestController
@RequestMapping("/api/v1/capacity")
public class CapacityController {

    private final EnvironmentQueryService queries;

    public CapacityController(EnvironmentQueryService queries) {
        this.queries = queries;
    }

    @GetMapping
    public ResponseEntity<CapacityResponse> getCapacity() {
        return ResponseEntity.ok(CapacityResponse.from(queries.capacity()));
    }

    public record CapacityResponse(
        Map<EnvironmentStatus, Long> environments,
        long liveEnvironments,
        String routingDomain,
        int prioritiesUsed,
        int prioritiesCapacity,
        int prioritiesAvailable,
        int percentage,
        CapacityReport.Level level
    ) {
        public static CapacityResponse from(CapacityReport report) {
            CapacityUsage usage = report.priorities();
            return new CapacityResponse(
                report.environments(),
                report.live(),
                usage.routingDomain(),
                usage.used(),
                usage.capacity(),
                usage.available(),
                usage.percentage(),
                report.level()
            );
        }
    }
}
