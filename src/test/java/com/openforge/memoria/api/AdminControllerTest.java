package com.openforge.memoria.api;

import com.openforge.memoria.worker.RecoveryCoordinator;
import com.openforge.memoria.worker.RecoveryResult;
import com.openforge.memoria.worker.WorkerLifecycle;
import com.openforge.memoria.worker.WorkerStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean WorkerLifecycle lifecycle;
    @MockitoBean RecoveryCoordinator recovery;

    @Test
    void statusIsReported() throws Exception {
        when(lifecycle.status()).thenReturn(new WorkerStatus(true, 1_500L, "auto", 3, 1, 7L, 0));

        mvc.perform(get("/api/admin/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepting").value(true))
                .andExpect(jsonPath("$.running_consumers").value(1))
                .andExpect(jsonPath("$.queue_depth").value(7));
    }

    @Test
    void restartStopsThenStarts() throws Exception {
        when(lifecycle.status()).thenReturn(new WorkerStatus(true, 0L, "claude", 0, 0, 0L, 0));

        mvc.perform(post("/api/admin/restart")).andExpect(status().isOk());

        var order = inOrder(lifecycle);
        order.verify(lifecycle).restart();
        order.verify(lifecycle).status();
    }

    @Test
    void recoveryRunsOnlyWhileRunning() throws Exception {
        when(lifecycle.isRunning()).thenReturn(false);
        mvc.perform(post("/api/admin/recover")).andExpect(status().isServiceUnavailable());
        verify(recovery, never()).runPass();

        when(lifecycle.isRunning()).thenReturn(true);
        when(recovery.runPass()).thenReturn(new RecoveryResult(2, 1, 1, 0, 3, 0));
        mvc.perform(post("/api/admin/recover"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset_messages").value(2))
                .andExpect(jsonPath("$.started_sessions").value(3));
    }
}
