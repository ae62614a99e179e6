package org.docsearch.search.model;

public record HealthResponse(
		String status,
		String version,
		double uptimeSeconds
) {}
