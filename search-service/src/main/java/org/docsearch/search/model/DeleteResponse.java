package org.docsearch.search.model;

public record DeleteResponse(
		String message,
		String docId,
		int totalDocuments,
		boolean persisted
) {}
