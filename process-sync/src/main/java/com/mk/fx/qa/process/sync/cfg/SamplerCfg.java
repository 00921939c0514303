package com.mk.fx.qa.process.sync.cfg;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "process.sampler")
public class SamplerCfg {

  private boolean enabled = true;

  @NotNull private Duration interval = Duration.ofSeconds(1);

  /** Chance that a tick also writes a summary line to the observer log. */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double logProbability = 0.1;

  /** Samples retained for the observer (one minute at the default interval). */
  @Positive private int historySize = 60;

  @NotBlank private String diskPath = "/";
}
