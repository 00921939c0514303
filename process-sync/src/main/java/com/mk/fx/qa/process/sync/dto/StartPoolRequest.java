package com.mk.fx.qa.process.sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request to start a new worker pool generation. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartPoolRequest {

  @NotNull
  @Min(1)
  @Max(32)
  @JsonProperty("count")
  private Integer count;

  /** One of 0.1x, 0.25x, 0.5x, 1x, 2x, 5x, 10x. */
  @NotBlank
  @JsonProperty("speed")
  private String speed;

  /** LOW, NORMAL or HIGH. */
  @NotBlank
  @JsonProperty("priority")
  private String priority;
}
