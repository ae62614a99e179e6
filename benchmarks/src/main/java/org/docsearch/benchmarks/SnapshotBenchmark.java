package org.docsearch.benchmarks;

import org.docsearch.core.index.InvertedIndex;
import org.docsearch.core.storage.JsonSnapshotStore;
import org.docsearch.core.storage.LoadResult;
import org.docsearch.core.storage.SaveResult;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for snapshot persistence
 * Tests: save (including backup rotation), load
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SnapshotBenchmark {

	private static final int WORDS_PER_DOCUMENT = 300;

	private Path dataDir;
	private InvertedIndex index;
	private JsonSnapshotStore store;

	@Param({"100", "1000"})
	private int indexSize;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Snapshot Benchmark Setup (indexSize=" + indexSize + ") ===");

		dataDir = Files.createTempDirectory("docsearch-benchmark");
		store = new JsonSnapshotStore(dataDir);
		index = new InvertedIndex();

		List<String> documents = new SyntheticCorpus().documents(indexSize, WORDS_PER_DOCUMENT);
		for (int i = 0; i < documents.size(); i++) {
			index.addDocument("doc" + i, documents.get(i));
		}

		SaveResult initial = store.save(index);
		if (!initial.success()) {
			throw new IllegalStateException("Initial snapshot failed: " + initial.error());
		}
		System.out.println("Snapshot ready: " + store.info().sizeMb() + " MB");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		try (Stream<Path> paths = Files.walk(dataDir)) {
			paths.sorted(Comparator.reverseOrder()).forEach(path -> {
				try {
					Files.deleteIfExists(path);
				} catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			});
		}
	}

	/**
	 * Benchmark: Write a snapshot, backing up and pruning the previous one
	 */
	@Benchmark
	public void saveSnapshot(Blackhole blackhole) {
		blackhole.consume(store.save(index));
	}

	/**
	 * Benchmark: Read and validate the current snapshot
	 */
	@Benchmark
	public void loadSnapshot(Blackhole blackhole) {
		LoadResult result = store.load();
		blackhole.consume(result.index());
	}
}
