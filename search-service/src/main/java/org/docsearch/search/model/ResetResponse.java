package org.docsearch.search.model;

public record ResetResponse(
		String message,
		int totalDocuments,
		boolean filesDeleted
) {}
