package com.previewenv.api.rest;

import com.previewenv.core.exception.InvalidActionException;
import com.previewenv.core.exception.InvalidStateTransitionException;
import com.previewenv.core.exception.NotFoundException;
import com.previewenv.core.exception.ResourceExhaustedException;
import com.previewenv.core.model.*;
import com.previewenv.engine.service.EnvironmentQueryService;
import com.previewenv.engine.service.LifecycleActionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EnvironmentRestControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private LifecycleActionHandler handler;
    private EnvironmentQueryService queries;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        handler = mock(LifecycleActionHandler.class);
        queries = mock(EnvironmentQueryService.class);
        mvc = MockMvcBuilders.standaloneSetup(new EnvironmentRestController(handler, queries))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static Environment activeEnvironment() {
        LifecycleAction action = new LifecycleAction(ActionType.CREATE, "pr-7", "acme/shop",
            "feature/pr-7", "sha-7", PrMetadata.of(7, "https://github.com/acme/shop/pull/7"), null);
        return Environment.create(action, "https://pr-7.preview.example.com", NOW, Duration.ofHours(24))
            .withStatus(EnvironmentStatus.ACTIVE)
            .withService(ServiceState.pending("web").toBuilder()
                .status(ServiceStatus.ACTIVE)
                .priority(3)
                .computeServiceRef("arn:service/pr-7-web")
                .build());
    }

    @Test
    @DisplayName("Action derives the environment id from the PR number and answers 202")
    void handlesAction() throws Exception {
        when(queries.find("pr-7")).thenReturn(Optional.of(activeEnvironment()));

        mvc.perform(post("/api/v1/environments/actions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"action":"CREATE","repository":"acme/shop","branch":"feature/pr-7",
                     "commitRef":"sha-7","prNumber":7,"prUrl":"https://github.com/acme/shop/pull/7"}
                    """))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.environmentId").value("pr-7"))
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.services[0].serviceId").value("web"))
            .andExpect(jsonPath("$.services[0].priority").value(3));

        ArgumentCaptor<LifecycleAction> captor = ArgumentCaptor.forClass(LifecycleAction.class);
        verify(handler).handle(captor.capture());
        assertThat(captor.getValue().environmentId()).isEqualTo("pr-7");
        assertThat(captor.getValue().action()).isEqualTo(ActionType.CREATE);
        assertThat(captor.getValue().prMetadata().number()).isEqualTo(7);
    }

    @Test
    @DisplayName("DESTROY leaving no record answers 204")
    void destroyOfUnknownEnvironment() throws Exception {
        when(queries.find("pr-404")).thenReturn(Optional.empty());

        mvc.perform(post("/api/v1/environments/actions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"DESTROY\",\"environmentId\":\"pr-404\"}"))
            .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Rejected action maps to 400 INVALID_ACTION")
    void invalidAction() throws Exception {
        doThrow(new InvalidActionException("CREATE for pr-7 requires a commitRef"))
            .when(handler).handle(any());

        mvc.perform(post("/api/v1/environments/actions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"CREATE\",\"environmentId\":\"pr-7\",\"repository\":\"acme/shop\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_ACTION"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Unknown action type is a malformed request")
    void malformedBody() throws Exception {
        mvc.perform(post("/api/v1/environments/actions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"REBOOT\",\"environmentId\":\"pr-7\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Capacity exhaustion escaping the controller maps to 503")
    void exhaustion() throws Exception {
        doThrow(new ResourceExhaustedException("listener", new PriorityRange(1, 2)))
            .when(handler).handle(any());

        mvc.perform(post("/api/v1/environments/actions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"CREATE\",\"environmentId\":\"pr-7\",\"repository\":\"acme/shop\",\"commitRef\":\"sha\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.errorCode").value("RESOURCE_EXHAUSTED"));
    }

    @Test
    @DisplayName("Unknown environment maps to 404")
    void unknownEnvironment() throws Exception {
        when(queries.get("pr-404")).thenThrow(new NotFoundException("Environment", "pr-404"));

        mvc.perform(get("/api/v1/environments/pr-404"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("List passes the status filter and default limit")
    void listByStatus() throws Exception {
        when(queries.list(EnvironmentStatus.ACTIVE, 100)).thenReturn(List.of(activeEnvironment()));

        mvc.perform(get("/api/v1/environments").param("status", "ACTIVE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].environmentId").value("pr-7"))
            .andExpect(jsonPath("$[0].previewAddress").value("https://pr-7.preview.example.com"));
    }

    @Test
    @DisplayName("Routing entries of an environment are returned as stored")
    void routing() throws Exception {
        when(queries.routing("pr-7")).thenReturn(List.of(new RoutingEntry("pr-7", "web", "arn:rule",
            "arn:tg", null, "arn:service", 3, NOW.plus(Duration.ofHours(24)), NOW)));

        mvc.perform(get("/api/v1/environments/pr-7/routing"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].serviceId").value("web"))
            .andExpect(jsonPath("$[0].priority").value(3));
    }

    @Test
    @DisplayName("Extend without a body uses the default extension")
    void extendDefaultsTo24Hours() throws Exception {
        when(queries.extendTtl(eq("pr-7"), anyInt())).thenReturn(activeEnvironment());

        mvc.perform(post("/api/v1/environments/pr-7/extend"))
            .andExpect(status().isOk());
        mvc.perform(post("/api/v1/environments/pr-7/extend")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"hours\":6}"))
            .andExpect(status().isOk());

        verify(queries).extendTtl("pr-7", 24);
        verify(queries).extendTtl("pr-7", 6);
    }

    @Test
    @DisplayName("Extending an environment that is not live maps to 409")
    void extendNotLive() throws Exception {
        when(queries.extendTtl("pr-7", 24)).thenThrow(
            new InvalidStateTransitionException("pr-7", EnvironmentStatus.DESTROYED, "extend"));

        mvc.perform(post("/api/v1/environments/pr-7/extend"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));
    }
}
