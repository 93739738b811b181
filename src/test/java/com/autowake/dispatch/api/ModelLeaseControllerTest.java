package com.autowake.dispatch.api;

import com.autowake.core.idle.ModelLease;
import com.autowake.core.idle.ModelLeaseTable;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelLeaseController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ModelLeaseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ModelLeaseTable leases;

    @Test
    void registerWithDefaultKeepAlive() throws Exception {
        when(leases.register("llama3")).thenReturn(new ModelLease("llama3", Instant.parse("2026-05-04T11:00:00Z")));

        mockMvc.perform(post("/api/v1/models/llama3/lease"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.keepAliveUntil").value("2026-05-04T11:00:00Z"));
    }

    @Test
    void zeroKeepAliveDropsLease() throws Exception {
        when(leases.register("llama3", Duration.ZERO)).thenReturn(null);

        mockMvc.perform(post("/api/v1/models/llama3/lease").param("keepAliveSeconds", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model").value("llama3"))
                .andExpect(jsonPath("$.keepAliveUntil").doesNotExist());
    }

    @Test
    void keepAliveBeyondOneYearIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/models/llama3/lease").param("keepAliveSeconds", "9223372036854775807"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("keepAliveSeconds must not exceed 31536000"));

        verify(leases, never()).register(anyString(), any());
    }
}
