package com.mk.fx.qa.process.sync.dto;

/** Response object for health check endpoint. Contains the status of the service. */
public record HealthResponse(String status) {}
