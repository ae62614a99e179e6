package org.docsearch.benchmarks;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic generated documents for the benchmarks.
 * Word frequencies are skewed so a few terms appear in most documents and the long tail in few.
 */
final class SyntheticCorpus {
	private static final long SEED = 42L;
	private static final int VOCABULARY_SIZE = 5_000;

	private final List<String> vocabulary = new ArrayList<>(VOCABULARY_SIZE);
	private final Random random = new Random(SEED);

	SyntheticCorpus() {
		for (int i = 0; i < VOCABULARY_SIZE; i++) {
			vocabulary.add("word" + Integer.toString(i, 36));
		}
	}

	String document(int words) {
		StringBuilder sb = new StringBuilder(words * 8);
		for (int i = 0; i < words; i++) {
			if (i > 0) {
				sb.append(i % 12 == 0 ? ". " : " ");
			}
			sb.append(term());
		}
		return sb.toString();
	}

	List<String> documents(int count, int wordsPerDocument) {
		List<String> documents = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			documents.add(document(wordsPerDocument));
		}
		return documents;
	}

	/** A common term, present in most generated documents. */
	String commonTerm() {
		return vocabulary.get(0);
	}

	/** A term from the long tail. */
	String rareTerm() {
		return vocabulary.get(VOCABULARY_SIZE - 1);
	}

	private String term() {
		// squaring a uniform value biases picks towards the start of the vocabulary
		double u = random.nextDouble();
		return vocabulary.get((int) (u * u * VOCABULARY_SIZE));
	}
}
