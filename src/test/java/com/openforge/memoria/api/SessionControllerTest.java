package com.openforge.memoria.api;

import com.openforge.memoria.worker.SessionService;
import com.openforge.memoria.worker.WorkerNotAcceptingException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean SessionService sessionService;

    @Test
    void observationIsAcceptedWithItsMessageId() throws Exception {
        when(sessionService.queueObservation(eq("c-1"), eq("Read"), anyString(), anyString(), eq("/work")))
                .thenReturn(new SessionService.QueueResult("queued", 42L));

        mvc.perform(post("/api/sessions/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content_session_id":"c-1","tool_name":"Read",
                                 "tool_input":{"file_path":"a.txt"},"tool_response":"hello","cwd":"/work"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.message_id").value(42));

        verify(sessionService).queueObservation("c-1", "Read", "{\"file_path\":\"a.txt\"}", "hello", "/work");
    }

    @Test
    void skippedToolIsAcceptedWithoutAnId() throws Exception {
        when(sessionService.queueObservation(any(), any(), any(), any(), any()))
                .thenReturn(new SessionService.QueueResult("skipped", null));

        mvc.perform(post("/api/sessions/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_session_id\":\"c-1\",\"tool_name\":\"TodoWrite\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("skipped"));
    }

    @Test
    void missingToolNameIsRejected() throws Exception {
        mvc.perform(post("/api/sessions/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_session_id\":\"c-1\"}"))
                .andExpect(status().isBadRequest());

        verify(sessionService, never()).queueObservation(any(), any(), any(), any(), any());
    }

    @Test
    void writesAnswer503WhileStopping() throws Exception {
        when(sessionService.queueSummarize(any(), any(), any())).thenThrow(new WorkerNotAcceptingException());

        mvc.perform(post("/api/sessions/summarize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_session_id\":\"c-1\",\"last_assistant_message\":\"done\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void initReturnsPromptNumber() throws Exception {
        when(sessionService.init("c-1", "memoria", "Fix it"))
                .thenReturn(new SessionService.InitResult(7L, 2));

        mvc.perform(post("/api/sessions/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_session_id\":\"c-1\",\"project\":\"memoria\",\"prompt\":\"Fix it\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_db_id").value(7))
                .andExpect(jsonPath("$.prompt_number").value(2));
    }

    @Test
    void completingAnUnknownSessionIs404() throws Exception {
        when(sessionService.complete("nope")).thenReturn(false);
        when(sessionService.complete("c-1")).thenReturn(true);

        mvc.perform(post("/api/sessions/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_session_id\":\"nope\"}"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/sessions/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_session_id\":\"c-1\"}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void statusReportsQueueDepth() throws Exception {
        when(sessionService.status("c-1")).thenReturn(Optional.of(new SessionService.SessionStatusView(
                3L, "c-1", "claude-c-1-1", "active", 2, 4L, "running", "claude")));
        when(sessionService.status("missing")).thenReturn(Optional.empty());

        mvc.perform(get("/api/sessions/c-1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queue_depth").value(4))
                .andExpect(jsonPath("$.processor_state").value("running"));
        mvc.perform(get("/api/sessions/missing/status"))
                .andExpect(status().isNotFound());
    }
}
