package com.mk.fx.qa.process.sync.resource;

import com.mk.fx.qa.process.sync.dto.LogResponse;
import com.mk.fx.qa.process.sync.dto.PauseToggleResponse;
import com.mk.fx.qa.process.sync.dto.PoolStatusResponse;
import com.mk.fx.qa.process.sync.dto.StartPoolRequest;
import com.mk.fx.qa.process.sync.dto.WorkerViewResponse;
import com.mk.fx.qa.process.sync.pool.PoolController;
import com.mk.fx.qa.process.sync.sink.LogEntry;
import com.mk.fx.qa.process.sync.sink.LogSink;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Worker Pool", description = "Start, pause, stop and observe the worker pool")
@RestController
@RequestMapping("/api/pool")
@Validated
@RequiredArgsConstructor
public class PoolApiController {

  private final PoolController poolController;
  private final LogSink logSink;
  private final PoolMapper poolMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Start a worker pool",
      description = "Stops any running pool, then starts a fresh generation of workers")
  @PostMapping("/start")
  public ResponseEntity<PoolStatusResponse> start(@Valid @RequestBody StartPoolRequest request) {
    log.info(
        "Received start request: count={} speed={} priority={}",
        request.getCount(),
        request.getSpeed(),
        request.getPriority());
    var spec = poolMapper.toLaunchSpec(request);
    return responseFactory.accepted(poolMapper.toResponse(poolController.start(spec)));
  }

  @Operation(summary = "Toggle pause", description = "Pauses a running pool or resumes a paused one")
  @PostMapping("/pause")
  public ResponseEntity<PauseToggleResponse> togglePause() {
    boolean paused = poolController.togglePause();
    return ResponseEntity.ok(
        new PauseToggleResponse(paused, paused ? "All workers paused" : "All workers resumed"));
  }

  @Operation(
      summary = "Stop the pool",
      description = "Stops every worker, forcing stragglers after the grace period")
  @PostMapping("/stop")
  public ResponseEntity<PoolStatusResponse> stop() {
    return ResponseEntity.ok(poolMapper.toResponse(poolController.stop()));
  }

  @Operation(summary = "Pool status")
  @GetMapping
  public ResponseEntity<PoolStatusResponse> status() {
    return ResponseEntity.ok(poolMapper.toResponse(poolController.snapshot()));
  }

  @Operation(summary = "Worker table", description = "Reconciled per-worker state, ordered by id")
  @GetMapping("/workers")
  public ResponseEntity<List<WorkerViewResponse>> workers() {
    return ResponseEntity.ok(poolMapper.toWorkerResponses(poolController.workers()));
  }

  @Operation(summary = "Observer log", description = "Most recent log lines, oldest first")
  @GetMapping("/log")
  public ResponseEntity<LogResponse> logLines(
      @Parameter(description = "Maximum number of lines to return")
          @RequestParam(required = false)
          @Min(1)
          Integer limit) {
    List<LogEntry> entries = limit == null ? logSink.entries() : logSink.tail(limit);
    var lines = entries.stream().map(LogEntry::line).toList();
    return ResponseEntity.ok(new LogResponse(logSink.size(), lines));
  }

  @Operation(summary = "Clear the observer log")
  @DeleteMapping("/log")
  public ResponseEntity<Void> clearLog() {
    logSink.clear();
    return ResponseEntity.noContent().build();
  }
}
