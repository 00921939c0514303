package com.mk.fx.qa.process.sync.dto;

import java.util.List;

/**
 * Observer log lines, oldest first.
 *
 * @param retained number of lines currently retained
 * @param lines rendered lines returned by this call
 */
public record LogResponse(int retained, List<String> lines) {}
