package org.docsearch.core.model;

import java.util.Map;

/**
 * Self-contained, versioned copy of the whole index as it is written to disk.
 *
 * <p>{@code index} maps term to document id to raw occurrence count; {@code termStats} maps term to the number of
 * documents containing it. Map iteration order is the order in which terms were first indexed.</p>
 */
public record IndexSnapshot(
		Map<String, Map<String, Integer>> index,
		Map<String, DocumentRecord> documents,
		Map<String, Integer> termStats,
		int totalDocuments,
		int totalTerms,
		String savedAt,
		String version
) {
	public static final String FORMAT_VERSION = "1.0";
}
