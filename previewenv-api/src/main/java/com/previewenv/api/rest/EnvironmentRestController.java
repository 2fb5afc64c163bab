package com.previewenv.api.rest;

import com.previewenv.core.model.*;
import com.previewenv.engine.service.EnvironmentQueryService;
import com.previewenv.engine.service.LifecycleActionHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for preview environments.
 */
@RestController
@RequestMapping("/api/v1/environments")
public class EnvironmentRestController {

    private final LifecycleActionHandler handler;
    private final EnvironmentQueryService queries;

    public EnvironmentRestController(LifecycleActionHandler handler, EnvironmentQueryService queries) {
        this.handler = handler;
        this.queries = queries;
    }

    /**
     * Handle a lifecycle action synchronously.
     * Answers 204 when no record exists afterwards, as for a DESTROY of an unknown environment.
     */
    @PostMapping("/actions")
    public ResponseEntity<EnvironmentResponse> handleAction(@RequestBody ActionRequest request) {
        LifecycleAction action = request.toAction();
        handler.handle(action);

        return queries.find(action.environmentId())
            .map(env -> ResponseEntity.status(HttpStatus.ACCEPTED).body(EnvironmentResponse.from(env)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping
    public ResponseEntity<List<EnvironmentResponse>> listEnvironments(
            @RequestParam(required = false) EnvironmentStatus status,
            @RequestParam(defaultValue = "100") int limit) {

        List<EnvironmentResponse> responses = queries.list(status, limit).stream()
            .map(EnvironmentResponse::from)
            .collect(Collectors.toList());

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{environmentId}")
    public ResponseEntity<EnvironmentResponse> getEnvironment(@PathVariable String environmentId) {
        return ResponseEntity.ok(EnvironmentResponse.from(queries.get(environmentId)));
    }

    @GetMapping("/{environmentId}/routing")
    public ResponseEntity<List<RoutingEntry>> getRouting(@PathVariable String environmentId) {
        return ResponseEntity.ok(queries.routing(environmentId));
    }

    /**
     * Extend the TTL of a live environment, by 24 hours unless the body says otherwise.
     */
    @PostMapping("/{environmentId}/extend")
    public ResponseEntity<EnvironmentResponse> extendTtl(
            @PathVariable String environmentId,
            @RequestBody(required = false) ExtendRequest request) {

        int hours = request != null && request.hours() != null
            ? request.hours()
            : EnvironmentQueryService.DEFAULT_EXTENSION_HOURS;
        Environment env = queries.extendTtl(environmentId, hours);
        return ResponseEntity.ok(EnvironmentResponse.from(env));
    }

    // ========== DTOs ==========

    /**
     * Ingress form of a lifecycle action. environmentId may be left out when
     * prNumber is given.
     */
    public record ActionRequest(
        ActionType action,
        String environmentId,
        String repository,
        String branch,
        String commitRef,
        Integer prNumber,
        String prUrl,
        String baseBranch,
        Boolean merged,
        String reason
    ) {
        public LifecycleAction toAction() {
            String id = environmentId;
            if ((id == null || id.isBlank()) && prNumber != null) {
                id = LifecycleAction.environmentIdFor(prNumber);
            }
            PrMetadata pr = prNumber != null ? new PrMetadata(prNumber, prUrl, baseBranch, merged) : null;
            return new LifecycleAction(action, id, repository, branch, commitRef, pr, reason);
        }
    }

    public record ExtendRequest(Integer hours) {}

    public record ServiceResponse(
        String serviceId,
        ServiceStatus status,
        Integer priority,
        boolean computeServiceCreated,
        String lastError,
        String errorCode
    ) {
        public static ServiceResponse from(ServiceState state) {
            return new ServiceResponse(
                state.serviceId(),
                state.status(),
                state.priority(),
                state.hasComputeService(),
                state.lastError(),
                state.errorCode()
            );
        }
    }

    public record EnvironmentResponse(
        String environmentId,
        EnvironmentStatus status,
        String repository,
        String branch,
        String commitRef,
        PrMetadata pr,
        String previewAddress,
        List<ServiceResponse> services,
        String lastError,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt,
        long version
    ) {
        public static EnvironmentResponse from(Environment env) {
            return new EnvironmentResponse(
                env.environmentId(),
                env.status(),
                env.repository(),
                env.branch(),
                env.commitRef(),
                env.prMetadata(),
                env.previewAddress(),
                env.services().values().stream()
                    .map(ServiceResponse::from)
                    .collect(Collectors.toList()),
                env.lastError(),
                env.createdAt(),
                env.updatedAt(),
                env.expiresAt(),
                env.version()
            );
        }
    }
}
