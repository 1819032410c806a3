package com.platform.podset.api;

import com.platform.podset.dispatch.PodSetEventSource;
import com.platform.podset.lifecycle.ApplicationLifecycleManager;
import com.platform.podset.lifecycle.ApplicationLifecycleManager.LifecyclePhase;
import com.platform.podset.observability.MetricsRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApplicationLifecycleManager lifecycleManager;

    @MockBean
    private PodSetEventSource eventSource;

    @MockBean
    private MetricsRegistry metricsRegistry;

    @Test
    void livenessIsAlwaysUp() throws Exception {
        mockMvc.perform(get("/api/health/live"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void readyWhenStartedAndSynced() throws Exception {
        when(lifecycleManager.getCurrentPhase()).thenReturn(LifecyclePhase.READY);
        when(lifecycleManager.isReady()).thenReturn(true);
        when(eventSource.isSynced()).thenReturn(true);

        mockMvc.perform(get("/api/health/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.phase").value("READY"));
    }

    @Test
    void notReadyUntilInformersSync() throws Exception {
        when(lifecycleManager.getCurrentPhase()).thenReturn(LifecyclePhase.READY);
        when(lifecycleManager.isReady()).thenReturn(true);
        when(eventSource.isSynced()).thenReturn(false);

        mockMvc.perform(get("/api/health/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.informersSynced").value(false));
    }

    @Test
    void notReadyWhileDraining() throws Exception {
        when(lifecycleManager.getCurrentPhase()).thenReturn(LifecyclePhase.DRAINING);
        when(lifecycleManager.isReady()).thenReturn(false);
        when(eventSource.isSynced()).thenReturn(true);

        mockMvc.perform(get("/api/health/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("DOWN"));
    }
}
