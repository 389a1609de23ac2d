package com.mk.fx.qa.load.telemetry.cfg;

/**
 * Body returned by the REST layer when a request cannot be served.
 *
 * @param error short title of the failure
 * @param details what was wrong with the request
 */
public record ErrorResponse(String error, String details) {}
