package com.mk.fx.qa.lode.api.cfg;

/**
 * Body of every 4xx/5xx answer produced by the service.
 *
 * @param error short error title
 * @param details what was wrong with the request
 */
public record ErrorResponse(String error, String details) {}
