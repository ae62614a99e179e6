package org.docsearch.search.model;

import org.docsearch.core.model.DocumentRecord;

import java.time.Instant;

public record DocumentResponse(
		String docId,
		String title,
		String author,
		String content,
		int totalTerms,
		int uniqueTerms,
		String addedAt
) {
	public static DocumentResponse from(DocumentRecord record) {
		return new DocumentResponse(
				record.id(),
				record.title(),
				record.author(),
				record.content(),
				record.totalTerms(),
				record.uniqueTerms(),
				Instant.ofEpochMilli(record.addedAt()).toString()
		);
	}
}
