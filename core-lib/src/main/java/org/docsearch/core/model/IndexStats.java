package org.docsearch.core.model;

import java.util.List;

public record IndexStats(
		int totalDocuments,
		int totalTerms,
		int totalDocumentOccurrences,
		double averageTermsPerDocument,
		List<TermFrequency> mostCommonTerms
) {
	/** A term with its document frequency. */
	public record TermFrequency(String term, int documentFrequency) {}
}
