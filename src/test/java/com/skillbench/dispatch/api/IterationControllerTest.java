package com.skillbench.dispatch.api;

import com.skillbench.core.iteration.RoundController;
import com.skillbench.core.model.IterationParams;
import com.skillbench.core.model.IterationProgress;
import com.skillbench.core.model.IterationReport;
import com.skillbench.core.model.RoundStatus;
import com.skillbench.core.model.StopReason;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(IterationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class IterationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RoundController roundController;

    @Test
    @DisplayName("POST /iterations returns 202 and fills parameter defaults")
    void start() throws Exception {
        when(roundController.startIteration(eq("p1"), any(), any())).thenReturn("it-1");

        mockMvc.perform(post("/api/v1/projects/p1/iterations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recomposed_skill_id\": \"sk-9\", \"beam_width\": 2, \"stop_threshold\": 90}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.iteration_id").value("it-1"));

        ArgumentCaptor<IterationParams> params = ArgumentCaptor.forClass(IterationParams.class);
        verify(roundController).startIteration(eq("p1"), params.capture(), any());
        assertEquals("sk-9", params.getValue().recomposedSkillId());
        assertEquals(3, params.getValue().maxRounds());
        assertEquals(2, params.getValue().beamWidth());
        assertEquals(90.0, params.getValue().stopThreshold());
        assertEquals(1.0, params.getValue().plateauThreshold());
        assertEquals(2, params.getValue().plateauRoundsBeforeEscape());
    }

    @Test
    @DisplayName("POST /iterations with invalid parameters returns 400")
    void startInvalid() throws Exception {
        when(roundController.startIteration(eq("p1"), any(), any()))
                .thenThrow(new EvaluationStateException(ErrorCode.INVALID_PARAMS, "max_rounds must be at least 1"));

        mockMvc.perform(post("/api/v1/projects/p1/iterations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recomposed_skill_id\": \"sk-9\", \"max_rounds\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMS"));
    }

    @Test
    @DisplayName("POST /iterations/pause without an iteration returns 409")
    void pauseNotRunning() throws Exception {
        doThrow(new EvaluationStateException(ErrorCode.NOT_RUNNING, "No iteration is running"))
                .when(roundController).pauseIteration("p1");

        mockMvc.perform(post("/api/v1/projects/p1/iterations/pause"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NOT_RUNNING"));
    }

    @Test
    @DisplayName("POST /iterations/stop acknowledges the request")
    void stop() throws Exception {
        mockMvc.perform(post("/api/v1/projects/p1/iterations/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true));

        verify(roundController).stopIteration("p1");
    }

    @Test
    @DisplayName("GET /iterations/progress lists per-round status")
    void progress() throws Exception {
        when(roundController.getProgress("p1")).thenReturn(new IterationProgress("running", 2, 2, "explore",
                List.of(new IterationProgress.RoundProgress(1, RoundStatus.COMPLETED, 78.5),
                        new IterationProgress.RoundProgress(2, RoundStatus.RUNNING, null))));

        mockMvc.perform(get("/api/v1/projects/p1/iterations/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_round").value(2))
                .andExpect(jsonPath("$.current_phase").value("explore"))
                .andExpect(jsonPath("$.rounds[0].status").value("completed"))
                .andExpect(jsonPath("$.rounds[0].avg_score").value(78.5));
    }

    @Test
    @DisplayName("GET /iterations/report returns the final report")
    void report() throws Exception {
        when(roundController.getReport("p1")).thenReturn(new IterationReport("p1", "it-1", Instant.now(), 2,
                StopReason.THRESHOLD_REACHED, 80.0, 2, "sk-2", "Iteration skill v2", 81.5, List.of()));

        mockMvc.perform(get("/api/v1/projects/p1/iterations/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stop_reason").value("threshold_reached"))
                .andExpect(jsonPath("$.best_round").value(2))
                .andExpect(jsonPath("$.best_avg_score").value(81.5));
    }

    @Test
    @DisplayName("GET /iterations/exploration-log before any iteration returns 404")
    void explorationLogNotFound() throws Exception {
        when(roundController.getExplorationLog("p1"))
                .thenThrow(EvaluationStateException.notFound("Exploration log of project p1"));

        mockMvc.perform(get("/api/v1/projects/p1/iterations/exploration-log"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("request defaults leave the stop threshold unset")
    void requestDefaults() {
        IterationParams params = new IterationRequest("sk", null, null, null, null, null, null, null).toParams();

        assertNull(params.stopThreshold());
        assertEquals(1, params.beamWidth());
        assertEquals("", params.retentionRules());
    }
}
