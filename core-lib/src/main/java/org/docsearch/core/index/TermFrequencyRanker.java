package org.docsearch.core.index;

import org.docsearch.core.model.DocumentRecord;
import org.docsearch.core.model.SearchHit;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores documents by summed term frequency over the query terms.
 *
 * <p>Every occurrence of a term in the query adds {@code count / totalTerms} for each document holding a posting of
 * that term, so a repeated query word counts twice. Scores are only comparable within one query. Equal scores are
 * ordered by document id.</p>
 */
public class TermFrequencyRanker {
	static final Comparator<SearchHit> RANKING_ORDER = Comparator
			.comparingDouble(SearchHit::score).reversed()
			.thenComparing(SearchHit::documentId);

	public List<SearchHit> rank(List<String> queryTerms,
								Map<String, Map<String, Integer>> postings,
								Map<String, DocumentRecord> documents,
								int limit) {
		if (queryTerms.isEmpty() || limit <= 0) {
			return List.of();
		}

		Map<String, Double> scores = new HashMap<>();
		for (String term : queryTerms) {
			Map<String, Integer> termPostings = postings.get(term);
			if (termPostings == null) {
				continue;
			}

			for (Map.Entry<String, Integer> posting : termPostings.entrySet()) {
				DocumentRecord document = documents.get(posting.getKey());
				int totalTerms = document != null ? document.totalTerms() : 1;
				scores.merge(posting.getKey(), termFrequency(posting.getValue(), totalTerms), Double::sum);
			}
		}

		return scores.entrySet().stream()
				.map(e -> new SearchHit(e.getKey(), e.getValue(), documents.get(e.getKey())))
				.sorted(RANKING_ORDER)
				.limit(limit)
				.toList();
	}

	static double termFrequency(int termCount, int totalTerms) {
		if (totalTerms == 0) {
			return 0.0;
		}
		return (double) termCount / totalTerms;
	}
}
