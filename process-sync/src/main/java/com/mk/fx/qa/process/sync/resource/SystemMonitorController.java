package com.mk.fx.qa.process.sync.resource;

import com.mk.fx.qa.process.sync.cfg.SamplerCfg;
import com.mk.fx.qa.process.sync.dto.HealthResponse;
import com.mk.fx.qa.process.sync.dto.SampleHistoryResponse;
import com.mk.fx.qa.process.sync.sampler.SystemSampler;
import com.mk.fx.qa.process.sync.sink.SampleSink;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "System Monitor", description = "Host resource samples")
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemMonitorController {

  private final SampleSink sampleSink;
  private final SystemSampler systemSampler;
  private final SamplerCfg samplerCfg;
  private final PoolMapper poolMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "Resource samples", description = "Latest sample and retained history")
  @GetMapping("/samples")
  public ResponseEntity<SampleHistoryResponse> samples() {
    var latest = sampleSink.latest().map(poolMapper::toResponse).orElse(null);
    var history = poolMapper.toSampleResponses(sampleSink.history());
    return ResponseEntity.ok(
        new SampleHistoryResponse(latest, history, systemSampler.failureCount()));
  }

  @Operation(
      summary = "Health check",
      description = "UP unless the sampler is enabled but not running")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> healthy() {
    if (samplerCfg.isEnabled() && !systemSampler.isRunning()) {
      return responseFactory.unavailable(new HealthResponse("DOWN"));
    }
    return ResponseEntity.ok(new HealthResponse("UP"));
  }
}
