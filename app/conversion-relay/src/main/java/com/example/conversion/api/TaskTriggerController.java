/*
 * どこで: Conversion Relay タスク起動 API
 * 何を: 外部スケジューラからの GET/POST /api/cron を認証し、ロック付きでタスクを実行する
 * なぜ: 複数インスタンス構成でも cron 起動が重複実行されないようにするため
 */
package com.example.conversion.api;

import com.example.conversion.api.response.TaskEnvelope;
import com.example.conversion.config.RequestMdcInterceptor;
import com.example.conversion.model.TaskName;
import com.example.conversion.model.TaskOutcome;
import com.example.conversion.service.ScheduledTaskService;
import com.example.conversion.service.auth.TaskTriggerAuthenticator;
import com.example.conversion.service.auth.TaskTriggerAuthenticator.TaskAuthResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper と Executor は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class TaskTriggerController {

  private static final Logger logger = LoggerFactory.getLogger(TaskTriggerController.class);
  static final String TIMESTAMP_HEADER = "X-Cron-Timestamp";
  static final String SIGNATURE_HEADER = "X-Cron-Signature";

  private final TaskTriggerAuthenticator authenticator;
  private final ScheduledTaskService scheduledTaskService;
  private final Clock clock;
  private final ObjectMapper objectMapper;
  private final ThreadPoolTaskExecutor taskTriggerExecutor;

  public TaskTriggerController(
      TaskTriggerAuthenticator authenticator,
      ScheduledTaskService scheduledTaskService,
      Clock clock,
      ObjectMapper objectMapper,
      @Qualifier("taskTriggerExecutor") ThreadPoolTaskExecutor taskTriggerExecutor) {
    this.authenticator = authenticator;
    this.scheduledTaskService = scheduledTaskService;
    this.clock = clock;
    this.objectMapper = objectMapper;
    this.taskTriggerExecutor = taskTriggerExecutor;
  }

  @RequestMapping(
      path = "/api/cron",
      method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Object> trigger(
      HttpServletRequest request,
      @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestHeader(name = TIMESTAMP_HEADER, required = false) String timestamp,
      @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
      @RequestParam(name = "mode", required = false) String mode,
      @RequestBody(required = false) String body) {
    final long startedAt = clock.millis();
    final String requestId = RequestMdcInterceptor.requestIdOf(request);

    final TaskAuthResult auth = authenticator.authenticate(authorization, timestamp, signature);
    if (!auth.authenticated()) {
      final HttpStatus status =
          auth.status() == TaskAuthResult.Status.UNAUTHORIZED
              ? HttpStatus.UNAUTHORIZED
              : HttpStatus.SERVICE_UNAVAILABLE;
      logger.warn("task trigger rejected status={} reason={}", status.value(), auth.reason());
      return ResponseEntity.status(status)
          .body(new TaskEnvelope(requestId, null, elapsed(startedAt), null, auth.reason(), null));
    }

    final TaskRequest taskRequest;
    try {
      taskRequest = parseBody(body);
    } catch (JsonProcessingException ex) {
      return ResponseEntity.badRequest()
          .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, "invalid_json"));
    }

    if ("async".equalsIgnoreCase(mode)) {
      try {
        taskTriggerExecutor.execute(
            () -> scheduledTaskService.run(taskRequest.task(), taskRequest.force(), requestId));
      } catch (TaskRejectedException ex) {
        logger.warn("task trigger executor saturated task={}", taskRequest.task().wireName(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(
                new TaskEnvelope(
                    requestId, taskRequest.task().wireName(), elapsed(startedAt), null, "executor_busy", null));
      }
      return ResponseEntity.status(HttpStatus.ACCEPTED)
          .body(
              new TaskEnvelope(
                  requestId,
                  taskRequest.task().wireName(),
                  elapsed(startedAt),
                  Map.of("mode", "async", "accepted", true),
                  null,
                  null));
    }

    final TaskOutcome outcome =
        scheduledTaskService.run(taskRequest.task(), taskRequest.force(), requestId);
    return toResponse(requestId, outcome, elapsed(startedAt));
  }

  private ResponseEntity<Object> toResponse(String requestId, TaskOutcome outcome, long durationMs) {
    final String task = outcome.task().wireName();
    return switch (outcome.status()) {
      case COMPLETED ->
          ResponseEntity.ok(new TaskEnvelope(requestId, task, durationMs, outcome.result(), null, null));
      case SKIPPED ->
          ResponseEntity.status(HttpStatus.ACCEPTED)
              .body(
                  new TaskEnvelope(
                      requestId,
                      task,
                      durationMs,
                      outcome.result().isEmpty() ? null : outcome.result(),
                      outcome.reason(),
                      outcome.remainingMs()));
      case BACKEND_ERROR ->
          ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
              .body(new TaskEnvelope(requestId, task, durationMs, null, outcome.reason(), null));
      case FAILED ->
          ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
              .body(new TaskEnvelope(requestId, task, durationMs, null, outcome.reason(), null));
    };
  }

  /** 本文が無い/スキーマ外なら ALL。JSON として壊れている場合だけ例外。 */
  private TaskRequest parseBody(String body) throws JsonProcessingException {
    if (body == null || body.isBlank()) {
      return new TaskRequest(TaskName.ALL, false);
    }
    final JsonNode root = objectMapper.readTree(body);
    if (root == null || !root.isObject()) {
      return new TaskRequest(TaskName.ALL, false);
    }
    final JsonNode taskNode = root.get("task");
    final TaskName task =
        taskNode != null && taskNode.isTextual()
            ? TaskName.fromWire(taskNode.asText()).orElse(TaskName.ALL)
            : TaskName.ALL;
    final JsonNode forceNode = root.get("force");
    final boolean force = forceNode != null && forceNode.isBoolean() && forceNode.booleanValue();
    return new TaskRequest(task, force);
  }

  private long elapsed(long startedAt) {
    return Math.max(0L, clock.millis() - startedAt);
  }

  private record TaskRequest(TaskName task, boolean force) {}
}
