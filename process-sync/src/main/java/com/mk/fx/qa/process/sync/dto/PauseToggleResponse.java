package com.mk.fx.qa.process.sync.dto;

/** Result of a pause toggle. */
public record PauseToggleResponse(boolean paused, String message) {}
