package com.mk.fx.qa.process.sync.cfg;

/**
 * Error body returned by the API.
 *
 * @param error short error title
 * @param details human-readable cause
 */
public record ErrorResponse(String error, String details) {}
