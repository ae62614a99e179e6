package org.docsearch.search.service;

import org.docsearch.core.index.AddResult;
import org.docsearch.core.index.InvertedIndex;
import org.docsearch.core.index.RemoveResult;
import org.docsearch.core.model.DocumentRecord;
import org.docsearch.core.model.IndexStats;
import org.docsearch.core.model.SearchHit;
import org.docsearch.core.model.SnapshotInfo;
import org.docsearch.core.storage.SaveResult;
import org.docsearch.core.storage.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application-level operations over one index and its snapshot store.
 *
 * <p>Mutations are serialized on this service so the duplicate-id check and the add that follows it cannot interleave
 * with another upload. Every successful mutation is followed by a snapshot save; a failed save is reported in the
 * result, the in-memory change stays.</p>
 */
public class DocumentService {
	private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

	private final InvertedIndex index;
	private final SnapshotStore snapshotStore;

	public DocumentService(InvertedIndex index, SnapshotStore snapshotStore) {
		this.index = index;
		this.snapshotStore = snapshotStore;
	}

	public synchronized UploadResult upload(String docId, String content, String title, String author) {
		if (index.containsDocument(docId)) {
			logger.warn("Document {} already exists, upload refused", docId);
			return UploadResult.duplicate(docId, index.totalDocuments());
		}

		if (index.addDocument(docId, content, title, author) == AddResult.REJECTED) {
			return UploadResult.rejected(docId, index.totalDocuments());
		}

		boolean persisted = persist();
		DocumentRecord document = index.getDocument(docId).orElseThrow();
		return UploadResult.uploaded(document, index.totalDocuments(), persisted);
	}

	public synchronized DeleteResult delete(String docId) {
		if (index.removeDocument(docId) == RemoveResult.NOT_FOUND) {
			logger.info("Delete requested for unknown document {}", docId);
			return DeleteResult.notFound(docId, index.totalDocuments());
		}

		boolean persisted = persist();
		return DeleteResult.removed(docId, index.totalDocuments(), persisted);
	}

	public Optional<DocumentRecord> getDocument(String docId) {
		return index.getDocument(docId);
	}

	public SearchOutcome search(String query, int limit) {
		long start = System.nanoTime();
		List<SearchHit> hits = index.search(query, limit);
		double elapsedMillis = (System.nanoTime() - start) / 1_000_000.0;

		logger.info("Search '{}' returned {} results in {} ms", query, hits.size(), String.format("%.2f", elapsedMillis));
		return new SearchOutcome(hits, elapsedMillis);
	}

	public IndexStats stats() {
		return index.stats();
	}

	public SnapshotInfo storageInfo() {
		return snapshotStore.info();
	}

	public Map<String, Map<String, Integer>> sampleTerms(int limit) {
		return index.sampleTerms(limit);
	}

	public int totalDocuments() {
		return index.totalDocuments();
	}

	/**
	 * Empty the index and delete every stored snapshot
	 *
	 * @return false if the snapshot files could not all be deleted; the in-memory index is empty either way
	 */
	public synchronized boolean reset() {
		index.clear();
		boolean deleted = snapshotStore.deleteAll();
		logger.info("Index reset, snapshot files deleted: {}", deleted);
		return deleted;
	}

	/**
	 * Save a snapshot of the current index
	 */
	public boolean persist() {
		SaveResult result = snapshotStore.save(index);
		if (!result.success()) {
			logger.warn("Index snapshot not saved: {}", result.error());
		}
		return result.success();
	}
}
