package org.docsearch.search.model;

import java.util.Map;

public record ServiceInfoResponse(
		String message,
		String version,
		String description,
		Map<String, String> endpoints
) {}
