package org.docsearch.core.model;

public record SearchHit(
		String documentId,
		double score,
		DocumentRecord document
) {}
