package org.docsearch.search.model;

public record UploadResponse(
		String message,
		String docId,
		int indexedTerms,
		int totalDocuments,
		boolean persisted
) {}
