package org.docsearch.search.model;

import java.util.List;

public record SearchResponse(
		String query,
		List<SearchResult> results,
		int totalResults,
		double searchTimeMs
) {}
