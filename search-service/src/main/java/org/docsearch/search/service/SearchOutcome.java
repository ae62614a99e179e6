package org.docsearch.search.service;

import org.docsearch.core.model.SearchHit;

import java.util.List;

public record SearchOutcome(
		List<SearchHit> hits,
		double elapsedMillis
) {}
