package com.mk.fx.qa.process.sync.dto;

import java.util.List;

/** Latest sample plus the retained history, oldest first. */
public record SampleHistoryResponse(
    SampleResponse latest, List<SampleResponse> history, long failedReadings) {}
