package org.docsearch.benchmarks;

import org.docsearch.core.index.InvertedIndex;
import org.docsearch.core.model.IndexStats;
import org.docsearch.core.model.SearchHit;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for in-memory index operations
 * Tests: add document, remove document, single and multi term search, stats
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexOperationsBenchmark {

	private static final int WORDS_PER_DOCUMENT = 300;

	private InvertedIndex index;
	private String newDocument;
	private String singleTermQuery;
	private String multiTermQuery;

	@Param({"100", "1000", "5000"})
	private int indexSize;

	@Setup(Level.Trial)
	public void setup() {
		System.out.println("=== Index Operations Benchmark Setup (indexSize=" + indexSize + ") ===");

		SyntheticCorpus corpus = new SyntheticCorpus();
		index = new InvertedIndex();

		List<String> documents = corpus.documents(indexSize, WORDS_PER_DOCUMENT);
		for (int i = 0; i < documents.size(); i++) {
			index.addDocument("doc" + i, documents.get(i));
		}

		newDocument = corpus.document(WORDS_PER_DOCUMENT);
		singleTermQuery = corpus.commonTerm();
		multiTermQuery = corpus.commonTerm() + " " + corpus.rareTerm() + " " + corpus.document(3);

		System.out.println("Index ready: " + index.totalDocuments() + " documents, " + index.totalTerms() + " unique terms");
	}

	/**
	 * Benchmark: Add a document, then remove it again so the index size stays fixed
	 */
	@Benchmark
	public void addAndRemoveDocument(Blackhole blackhole) {
		blackhole.consume(index.addDocument("benchmark-doc", newDocument));
		blackhole.consume(index.removeDocument("benchmark-doc"));
	}

	/**
	 * Benchmark: Rank documents for a term present in most of them
	 */
	@Benchmark
	public void searchCommonTerm(Blackhole blackhole) {
		List<SearchHit> hits = index.search(singleTermQuery, 10);
		blackhole.consume(hits);
	}

	/**
	 * Benchmark: Rank documents for a query mixing common and rare terms
	 */
	@Benchmark
	public void searchMultipleTerms(Blackhole blackhole) {
		List<SearchHit> hits = index.search(multiTermQuery, 10);
		blackhole.consume(hits);
	}

	/**
	 * Benchmark: Compute index statistics
	 */
	@Benchmark
	public void computeStats(Blackhole blackhole) {
		IndexStats stats = index.stats();
		blackhole.consume(stats);
	}
}
