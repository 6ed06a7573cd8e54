package com.example.conversion.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.TaskName;
import com.example.conversion.model.TaskOutcome;
import com.example.conversion.service.ScheduledTaskService;
import com.example.conversion.service.auth.TaskTriggerAuthenticator;
import com.example.conversion.service.auth.TaskTriggerAuthenticator.TaskAuthResult;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TaskTriggerController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
@EnableConfigurationProperties(IngestProperties.class)
class TaskTriggerControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TaskTriggerAuthenticator authenticator;
  @MockitoBean private ScheduledTaskService scheduledTaskService;

  @MockitoBean(name = "taskTriggerExecutor")
  private ThreadPoolTaskExecutor taskTriggerExecutor;

  @BeforeEach
  void setUp() {
    when(authenticator.authenticate(any(), any(), any()))
        .thenReturn(authResult(TaskAuthResult.Status.OK, null));
  }

  @Test
  void rejectsUnauthenticatedTrigger() throws Exception {
    when(authenticator.authenticate(any(), any(), any()))
        .thenReturn(authResult(TaskAuthResult.Status.UNAUTHORIZED, "invalid_secret"));

    mockMvc
        .perform(post("/api/cron").header("X-Request-Id", "req-1"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.requestId").value("req-1"))
        .andExpect(jsonPath("$.reason").value("invalid_secret"));

    verify(scheduledTaskService, never()).run(any(), anyBoolean(), anyString());
  }

  @Test
  void replayStoreFailureReturns503() throws Exception {
    when(authenticator.authenticate(any(), any(), any()))
        .thenReturn(authResult(TaskAuthResult.Status.STORE_ERROR, "replay_store_error"));

    mockMvc
        .perform(post("/api/cron"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.reason").value("replay_store_error"));
  }

  @Test
  void brokenJsonBodyReturns400() throws Exception {
    mockMvc
        .perform(post("/api/cron").contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("invalid_json"));
  }

  @Test
  void getWithoutBodyRunsAllTasks() throws Exception {
    when(scheduledTaskService.run(eq(TaskName.ALL), eq(false), eq("req-1")))
        .thenReturn(TaskOutcome.completed(TaskName.ALL, Map.of("processed", 3)));

    mockMvc
        .perform(get("/api/cron").header("X-Request-Id", "req-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.task").value("all"))
        .andExpect(jsonPath("$.result.processed").value(3))
        .andExpect(jsonPath("$.durationMs").isNumber());
  }

  @Test
  void namedTaskWithForceIsPassedThrough() throws Exception {
    when(scheduledTaskService.run(eq(TaskName.RECONCILIATION), eq(true), anyString()))
        .thenReturn(TaskOutcome.completed(TaskName.RECONCILIATION, Map.of("shops", 2)));

    mockMvc
        .perform(
            post("/api/cron")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"task":"reconciliation","force":true}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.task").value("reconciliation"));
  }

  @Test
  void unknownTaskFallsBackToAll() throws Exception {
    when(scheduledTaskService.run(eq(TaskName.ALL), eq(false), anyString()))
        .thenReturn(TaskOutcome.completed(TaskName.ALL, Map.of()));

    mockMvc
        .perform(
            post("/api/cron")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"task\":\"unknown\",\"force\":\"yes\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.task").value("all"));
  }

  @Test
  void lockHeldReturns202WithRemainingTime() throws Exception {
    when(scheduledTaskService.run(eq(TaskName.ALL), eq(false), anyString()))
        .thenReturn(TaskOutcome.lockHeld(TaskName.ALL, 42_000L));

    mockMvc
        .perform(post("/api/cron"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.reason").value("lock_held"))
        .andExpect(jsonPath("$.remainingMs").value(42_000));
  }

  @Test
  void lockBackendErrorReturns503() throws Exception {
    when(scheduledTaskService.run(eq(TaskName.ALL), eq(false), anyString()))
        .thenReturn(TaskOutcome.backendError(TaskName.ALL, "redis down"));

    mockMvc
        .perform(post("/api/cron"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.reason").value("lock_backend_error"));
  }

  @Test
  void taskFailureReturns500() throws Exception {
    when(scheduledTaskService.run(eq(TaskName.ALL), eq(false), anyString()))
        .thenReturn(TaskOutcome.failed(TaskName.ALL, "boom"));

    mockMvc
        .perform(post("/api/cron"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.reason").value("task_failed"));
  }

  @Test
  void asyncModeIsAcceptedWithoutWaiting() throws Exception {
    mockMvc
        .perform(post("/api/cron").param("mode", "async"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.result.mode").value("async"))
        .andExpect(jsonPath("$.result.accepted").value(true));

    verify(taskTriggerExecutor).execute(any(Runnable.class));
    verify(scheduledTaskService, never()).run(any(), anyBoolean(), anyString());
  }

  @Test
  void asyncModeReturns503WhenExecutorIsSaturated() throws Exception {
    doThrow(new TaskRejectedException("full")).when(taskTriggerExecutor).execute(any(Runnable.class));

    mockMvc
        .perform(post("/api/cron").param("mode", "async"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.reason").value("executor_busy"));
  }

  private static TaskAuthResult authResult(TaskAuthResult.Status status, String reason) {
    return new TaskAuthResult(status, reason, false);
  }
}
