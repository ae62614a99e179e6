package org.docsearch.search.model;

import java.util.Map;

/**
 * Body of {@code GET /index}: summary counters plus a sample of postings.
 */
public record IndexResponse(
		Stats stats,
		Map<String, Map<String, Integer>> sampleTerms
) {
	/**
	 * @param lastUpdated modification time of the snapshot file, or the response time when nothing is saved yet
	 */
	public record Stats(
			int totalDocuments,
			int totalTerms,
			double indexSizeMb,
			String lastUpdated
	) {}
}
