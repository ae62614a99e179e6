package org.docsearch.core.index;

import org.docsearch.core.model.DocumentRecord;
import org.docsearch.core.model.IndexSnapshot;
import org.docsearch.core.model.IndexStats;
import org.docsearch.core.model.SearchHit;
import org.docsearch.core.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory inverted index: term to document id to raw occurrence count, plus document records and per-term document
 * frequencies.
 *
 * <p>All state sits behind one read-write lock. Queries, lookups and snapshots share the read lock; add, remove and
 * clear take the write lock. Document ids are not checked for uniqueness here: adding an id that is already indexed
 * corrupts the document frequencies, so callers check {@link #containsDocument} first.</p>
 */
public class InvertedIndex {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);
	private static final int MOST_COMMON_TERMS = 10;

	private final Tokenizer tokenizer;
	private final TermFrequencyRanker ranker;
	private final Clock clock;
	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	private final Map<String, Map<String, Integer>> postings = new LinkedHashMap<>();
	private final Map<String, DocumentRecord> documents = new LinkedHashMap<>();
	private final Map<String, Integer> termStats = new LinkedHashMap<>();
	private int totalDocuments;
	private int totalTerms;

	public InvertedIndex() {
		this(new Tokenizer(), Clock.systemUTC());
	}

	public InvertedIndex(Tokenizer tokenizer, Clock clock) {
		this.tokenizer = tokenizer;
		this.ranker = new TermFrequencyRanker();
		this.clock = clock;
	}

	public AddResult addDocument(String id, String content) {
		return addDocument(id, content, null, null);
	}

	/**
	 * Index a document. Terms are counted before anything is written, so a rejected document leaves no trace.
	 *
	 * @param title defaults to {@code "Document <id>"} when null or empty
	 */
	public AddResult addDocument(String id, String content, String title, String author) {
		Objects.requireNonNull(id, "id");

		if (content == null || content.isBlank()) {
			logger.warn("Empty content for document {}", id);
			return AddResult.REJECTED;
		}

		List<String> tokens = tokenizer.tokenize(content);
		if (tokens.isEmpty()) {
			logger.warn("No valid tokens found for document {}", id);
			return AddResult.REJECTED;
		}

		Map<String, Integer> termCounts = countTerms(tokens);
		DocumentRecord record = new DocumentRecord(
				id,
				content,
				title == null || title.isEmpty() ? "Document " + id : title,
				author,
				tokens.size(),
				termCounts.size(),
				clock.millis()
		);

		lock.writeLock().lock();
		try {
			for (Map.Entry<String, Integer> entry : termCounts.entrySet()) {
				postings.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>()).put(id, entry.getValue());
				termStats.merge(entry.getKey(), 1, Integer::sum);
			}
			documents.put(id, record);
			totalDocuments++;
			totalTerms = postings.size();
		} finally {
			lock.writeLock().unlock();
		}

		logger.info("Indexed document {} with {} tokens ({} unique)", id, tokens.size(), termCounts.size());
		return AddResult.ADDED;
	}

	public RemoveResult removeDocument(String id) {
		lock.writeLock().lock();
		try {
			if (!documents.containsKey(id)) {
				return RemoveResult.NOT_FOUND;
			}

			Iterator<Map.Entry<String, Map<String, Integer>>> terms = postings.entrySet().iterator();
			while (terms.hasNext()) {
				Map.Entry<String, Map<String, Integer>> term = terms.next();
				if (term.getValue().remove(id) == null) {
					continue;
				}
				if (term.getValue().isEmpty()) {
					terms.remove();
					termStats.remove(term.getKey());
				} else {
					termStats.merge(term.getKey(), -1, Integer::sum);
				}
			}

			documents.remove(id);
			totalDocuments--;
			totalTerms = postings.size();
		} finally {
			lock.writeLock().unlock();
		}

		logger.info("Removed document {}", id);
		return RemoveResult.REMOVED;
	}

	public Optional<DocumentRecord> getDocument(String id) {
		lock.readLock().lock();
		try {
			return Optional.ofNullable(documents.get(id));
		} finally {
			lock.readLock().unlock();
		}
	}

	public boolean containsDocument(String id) {
		return getDocument(id).isPresent();
	}

	/**
	 * Rank documents matching any query term, best first
	 */
	public List<SearchHit> search(String query, int limit) {
		long start = System.nanoTime();
		List<String> queryTerms = tokenizer.tokenize(query);
		if (queryTerms.isEmpty()) {
			return List.of();
		}

		List<SearchHit> hits;
		lock.readLock().lock();
		try {
			hits = ranker.rank(queryTerms, postings, documents, limit);
		} finally {
			lock.readLock().unlock();
		}

		logger.debug("Search '{}' completed in {} ms, found {} results",
				query, String.format("%.2f", (System.nanoTime() - start) / 1_000_000.0), hits.size());
		return hits;
	}

	public IndexStats stats() {
		lock.readLock().lock();
		try {
			int occurrences = postings.values().stream()
					.mapToInt(Map::size)
					.sum();

			List<IndexStats.TermFrequency> mostCommon = termStats.entrySet().stream()
					.sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
					.limit(MOST_COMMON_TERMS)
					.map(e -> new IndexStats.TermFrequency(e.getKey(), e.getValue()))
					.toList();

			return new IndexStats(
					totalDocuments,
					totalTerms,
					occurrences,
					(double) totalTerms / Math.max(totalDocuments, 1),
					mostCommon
			);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Get the first {@code limit} terms in indexing order with their postings, for inspection
	 */
	public Map<String, Map<String, Integer>> sampleTerms(int limit) {
		lock.readLock().lock();
		try {
			Map<String, Map<String, Integer>> sample = new LinkedHashMap<>();
			for (Map.Entry<String, Map<String, Integer>> entry : postings.entrySet()) {
				if (sample.size() >= limit) {
					break;
				}
				sample.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
			}
			return Collections.unmodifiableMap(sample);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Postings of one term (document id to count), empty when the term is not indexed
	 */
	public Map<String, Integer> postingsFor(String term) {
		lock.readLock().lock();
		try {
			Map<String, Integer> termPostings = postings.get(term);
			return termPostings == null ? Map.of() : Map.copyOf(termPostings);
		} finally {
			lock.readLock().unlock();
		}
	}

	public int documentFrequency(String term) {
		lock.readLock().lock();
		try {
			return termStats.getOrDefault(term, 0);
		} finally {
			lock.readLock().unlock();
		}
	}

	public int totalDocuments() {
		lock.readLock().lock();
		try {
			return totalDocuments;
		} finally {
			lock.readLock().unlock();
		}
	}

	public int totalTerms() {
		lock.readLock().lock();
		try {
			return totalTerms;
		} finally {
			lock.readLock().unlock();
		}
	}

	public void clear() {
		lock.writeLock().lock();
		try {
			postings.clear();
			documents.clear();
			termStats.clear();
			totalDocuments = 0;
			totalTerms = 0;
		} finally {
			lock.writeLock().unlock();
		}
		logger.info("Index cleared");
	}

	/**
	 * Deep copy of the current state, consistent as of one point in time
	 */
	public IndexSnapshot toSnapshot(String savedAt) {
		lock.readLock().lock();
		try {
			Map<String, Map<String, Integer>> indexCopy = new LinkedHashMap<>();
			postings.forEach((term, docs) -> indexCopy.put(term, new LinkedHashMap<>(docs)));

			return new IndexSnapshot(
					indexCopy,
					new LinkedHashMap<>(documents),
					new LinkedHashMap<>(termStats),
					totalDocuments,
					totalTerms,
					savedAt,
					IndexSnapshot.FORMAT_VERSION
			);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Rebuild an index from a snapshot.
	 *
	 * @throws IllegalArgumentException if the snapshot is incomplete, of an unknown version or internally inconsistent
	 */
	public static InvertedIndex fromSnapshot(IndexSnapshot snapshot) {
		validate(snapshot);

		InvertedIndex index = new InvertedIndex();
		snapshot.index().forEach((term, docs) -> index.postings.put(term, new LinkedHashMap<>(docs)));
		index.documents.putAll(snapshot.documents());
		index.termStats.putAll(snapshot.termStats());
		index.totalDocuments = snapshot.totalDocuments();
		index.totalTerms = snapshot.totalTerms();
		return index;
	}

	private static void validate(IndexSnapshot snapshot) {
		if (snapshot == null) {
			throw new IllegalArgumentException("Snapshot is empty");
		}
		if (!IndexSnapshot.FORMAT_VERSION.equals(snapshot.version())) {
			throw new IllegalArgumentException("Unsupported snapshot version: " + snapshot.version());
		}
		if (snapshot.index() == null || snapshot.documents() == null || snapshot.termStats() == null) {
			throw new IllegalArgumentException("Snapshot is missing index, documents or term_stats");
		}
		if (snapshot.totalDocuments() != snapshot.documents().size()) {
			throw new IllegalArgumentException("total_documents is " + snapshot.totalDocuments()
					+ " but snapshot holds " + snapshot.documents().size() + " documents");
		}
		if (snapshot.totalTerms() != snapshot.index().size()) {
			throw new IllegalArgumentException("total_terms is " + snapshot.totalTerms()
					+ " but snapshot holds " + snapshot.index().size() + " terms");
		}

		snapshot.documents().forEach((id, record) -> {
			if (record == null || !id.equals(record.id()) || record.content() == null) {
				throw new IllegalArgumentException("Malformed record for document " + id);
			}
		});

		for (Map.Entry<String, Map<String, Integer>> entry : snapshot.index().entrySet()) {
			Map<String, Integer> docs = entry.getValue();
			if (docs == null || docs.isEmpty()) {
				throw new IllegalArgumentException("Term '" + entry.getKey() + "' has no postings");
			}
			if (!Integer.valueOf(docs.size()).equals(snapshot.termStats().get(entry.getKey()))) {
				throw new IllegalArgumentException("Document frequency of '" + entry.getKey() + "' does not match its postings");
			}
			for (Map.Entry<String, Integer> posting : docs.entrySet()) {
				if (!snapshot.documents().containsKey(posting.getKey()) || posting.getValue() == null || posting.getValue() < 1) {
					throw new IllegalArgumentException("Invalid posting for '" + entry.getKey() + "' in " + posting.getKey());
				}
			}
		}
		if (snapshot.termStats().size() != snapshot.index().size()) {
			throw new IllegalArgumentException("term_stats lists terms without postings");
		}
	}

	private static Map<String, Integer> countTerms(List<String> tokens) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (String token : tokens) {
			counts.merge(token, 1, Integer::sum);
		}
		return counts;
	}
}
