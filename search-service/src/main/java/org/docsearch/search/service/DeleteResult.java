package org.docsearch.search.service;

public record DeleteResult(
		boolean removed,
		String docId,
		int totalDocuments,
		boolean persisted
) {
	public static DeleteResult removed(String docId, int totalDocuments, boolean persisted) {
		return new DeleteResult(true, docId, totalDocuments, persisted);
	}

	public static DeleteResult notFound(String docId, int totalDocuments) {
		return new DeleteResult(false, docId, totalDocuments, false);
	}
}
