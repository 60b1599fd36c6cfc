package roadwatch.compute.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import roadwatch.compute.service.StreamOrchestrator;
import roadwatch.config.ApiRoutes;
import roadwatch.domain.accident.AccidentRecord;
import roadwatch.domain.accident.AccidentStatus;
import roadwatch.domain.dto.control.ClearResult;
import roadwatch.domain.dto.control.InjectionResult;
import roadwatch.domain.traffic.GeoPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AccidentController.class)
@TestPropertySource(properties = "roadwatch.stream.command-timeout=100ms")
class AccidentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StreamOrchestrator orchestrator;

    private static AccidentRecord activeRecord() {
        return AccidentRecord.builder()
                .id("acc-1")
                .entityId("Car1")
                .status(AccidentStatus.ACTIVE)
                .openedAt(Instant.parse("2026-03-02T10:00:00Z"))
                .confidence(2.0 / 3.0)
                .detectionMethods(Set.of("SPRT", "CUSUM"))
                .location(new GeoPoint(37.7749, -122.4194))
                .build();
    }

    // --- TEST 1: ACTIVOS ---
    @Test
    void getActive_ShouldReturnRecords() throws Exception {
        // A. GIVEN
        given(orchestrator.activeAccidents()).willReturn(List.of(activeRecord()));

        // B. WHEN & THEN
        mockMvc.perform(get(ApiRoutes.ACCIDENTS + "/active"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("acc-1"))
                .andExpect(jsonPath("$[0].entity_id").value("Car1"))
                .andExpect(jsonPath("$[0].status").value("ACTIVE"))
                .andExpect(jsonPath("$[0].detection_methods[0]").value("CUSUM"))
                .andExpect(jsonPath("$[0].closed_at").doesNotExist())
                .andExpect(jsonPath("$[0].active").doesNotExist());
    }

    // --- TEST 2: HISTÓRICO ---
    @Test
    void getHistory_ShouldPassLimit() throws Exception {
        given(orchestrator.history(5)).willReturn(List.of(activeRecord()));

        mockMvc.perform(get(ApiRoutes.ACCIDENTS + "/history").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void getHistory_ShouldReturn400_WhenLimitIsNotPositive() throws Exception {
        given(orchestrator.history(0)).willThrow(new IllegalArgumentException("limit must be positive"));

        mockMvc.perform(get(ApiRoutes.ACCIDENTS + "/history").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("limit must be positive"));
    }

    // --- TEST 3: INYECCIÓN ---
    @Test
    void inject_ShouldReturnResult_WhenAppliedInTime() throws Exception {
        given(orchestrator.inject("Car1", Duration.ofSeconds(30))).willReturn(CompletableFuture.completedFuture(
                InjectionResult.injected(activeRecord().withForced(true), Duration.ofSeconds(30))));

        mockMvc.perform(post(ApiRoutes.ACCIDENTS + "/inject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_id\": \"Car1\", \"duration_seconds\": 30}"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("INJECTED"))
                .andExpect(jsonPath("$.entity_id").value("Car1"))
                .andExpect(jsonPath("$.record.forced").value(true))
                .andExpect(jsonPath("$.duration").value("PT30S"));
    }

    @Test
    void inject_ShouldAcceptMissingBody() throws Exception {
        given(orchestrator.inject(isNull(), isNull()))
                .willReturn(CompletableFuture.completedFuture(InjectionResult.noEntityAvailable()));

        mockMvc.perform(post(ApiRoutes.ACCIDENTS + "/inject"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("NO_ENTITY_AVAILABLE"));
    }

    @Test
    void inject_ShouldReturn400_WhenDurationIsNotPositive() throws Exception {
        mockMvc.perform(post(ApiRoutes.ACCIDENTS + "/inject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"duration_seconds\": -5}"))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).inject(any(), any());
    }

    @Test
    void inject_ShouldReturn400_WhenDurationExceedsMaximum() throws Exception {
        mockMvc.perform(post(ApiRoutes.ACCIDENTS + "/inject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"duration_seconds\": 100000000000000000}"))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).inject(any(), any());
    }

    // --- TEST 4: DESPEJE ---
    @Test
    void clear_ShouldReturn202_WhenStillQueued() throws Exception {
        given(orchestrator.clear(isNull())).willReturn(new CompletableFuture<>());

        mockMvc.perform(post(ApiRoutes.ACCIDENTS + "/clear"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("QUEUED"));
    }

    @Test
    void clear_ShouldReturnClearedIds() throws Exception {
        given(orchestrator.clear("Car1"))
                .willReturn(CompletableFuture.completedFuture(new ClearResult(1, List.of("acc-1"))));

        mockMvc.perform(post(ApiRoutes.ACCIDENTS + "/clear")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_id\": \"Car1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared_count").value(1))
                .andExpect(jsonPath("$.cleared_accident_ids[0]").value("acc-1"));
    }
}
