package org.docsearch.search.model;

import org.docsearch.core.model.DocumentRecord;
import org.docsearch.core.model.SearchHit;
import org.jetbrains.annotations.Nullable;

public record SearchResult(
		String docId,
		double score,
		@Nullable String title,
		@Nullable String author,
		@Nullable String snippet
) {
	public static final int SNIPPET_LENGTH = 200;

	public static SearchResult fromHit(SearchHit hit) {
		DocumentRecord document = hit.document();
		return new SearchResult(
				hit.documentId(),
				round(hit.score(), 4),
				document == null ? null : document.title(),
				document == null ? null : document.author(),
				document == null ? null : snippet(document.content())
		);
	}

	/**
	 * First {@value #SNIPPET_LENGTH} code points of the content, never splitting a surrogate pair
	 */
	static String snippet(String content) {
		if (content.codePointCount(0, content.length()) <= SNIPPET_LENGTH) {
			return content;
		}
		return content.substring(0, content.offsetByCodePoints(0, SNIPPET_LENGTH)) + "...";
	}

	static double round(double value, int places) {
		double scale = Math.pow(10, places);
		return Math.round(value * scale) / scale;
	}
}
