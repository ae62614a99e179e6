package org.docsearch.search.service;

import org.docsearch.core.model.DocumentRecord;

public record UploadResult(
		Outcome outcome,
		String docId,
		DocumentRecord document,
		int totalDocuments,
		boolean persisted
) {
	public enum Outcome {
		UPLOADED,
		/** A document with the same id is already indexed. */
		DUPLICATE,
		/** The content had nothing to index. */
		REJECTED
	}

	public static UploadResult uploaded(DocumentRecord document, int totalDocuments, boolean persisted) {
		return new UploadResult(Outcome.UPLOADED, document.id(), document, totalDocuments, persisted);
	}

	public static UploadResult duplicate(String docId, int totalDocuments) {
		return new UploadResult(Outcome.DUPLICATE, docId, null, totalDocuments, false);
	}

	public static UploadResult rejected(String docId, int totalDocuments) {
		return new UploadResult(Outcome.REJECTED, docId, null, totalDocuments, false);
	}
}
