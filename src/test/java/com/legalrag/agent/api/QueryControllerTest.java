package com.legalrag.agent.api;

import com.legalrag.agent.core.AgenticRagOrchestrator;
import com.legalrag.agent.exception.AgentNotInitializedException;
import com.legalrag.agent.exception.GlobalExceptionHandler;
import com.legalrag.agent.model.QueryResponse;
import com.legalrag.agent.resilience.IdempotencyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueryControllerTest {

    @Mock AgenticRagOrchestrator orchestrator;
    @Mock IdempotencyService idempotencyService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(orchestrator, idempotencyService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void query_returnsSnakeCaseEnvelope() throws Exception {
        when(orchestrator.query("What is probation?", 2, 5, false)).thenReturn(response("At most 180 days."));

        mockMvc.perform(post("/api/v1/rag/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is probation?\",\"max_iterations\":2,\"top_k\":5,\"enable_web_search\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("At most 180 days."))
                .andExpect(jsonPath("$.query_used").value("probation"))
                .andExpect(jsonPath("$.iterations").value(2))
                .andExpect(jsonPath("$.search_results").isArray())
                .andExpect(jsonPath("$.web_results").isArray());

        verifyNoInteractions(idempotencyService);
    }

    @Test
    void query_knownIdempotencyKey_returnsStoredResponse() throws Exception {
        when(idempotencyService.lookup("key-1")).thenReturn(Optional.of(response("cached")));

        mockMvc.perform(post("/api/v1/rag/query")
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is probation?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("cached"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void query_newIdempotencyKey_storesResponse() throws Exception {
        QueryResponse fresh = response("fresh");
        when(idempotencyService.lookup("key-2")).thenReturn(Optional.empty());
        when(orchestrator.query(eq("What is probation?"), isNull(), isNull(), isNull())).thenReturn(fresh);

        mockMvc.perform(post("/api/v1/rag/query")
                        .header("Idempotency-Key", "key-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is probation?\"}"))
                .andExpect(status().isOk());

        verify(idempotencyService).claim("key-2");
        verify(idempotencyService).complete("key-2", fresh);
    }

    @Test
    void query_notInitialized_returns503AndReleasesKey() throws Exception {
        when(idempotencyService.lookup("key-3")).thenReturn(Optional.empty());
        when(orchestrator.query(anyString(), any(), any(), any())).thenThrow(new AgentNotInitializedException());

        mockMvc.perform(post("/api/v1/rag/query")
                        .header("Idempotency-Key", "key-3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is probation?\"}"))
                .andExpect(status().isServiceUnavailable());

        verify(idempotencyService).release("key-3");
    }

    @Test
    void query_topKOutOfRange_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/rag/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is probation?\",\"top_k\":50}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void query_blankQuestion_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/rag/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("question: question must not be blank"));
    }

    private static QueryResponse response(String answer) {
        return QueryResponse.builder().answer(answer).iterations(2).queryUsed("probation").build();
    }
}
