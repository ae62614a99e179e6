package org.docsearch.core.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An indexed document. Never mutated after it is added; replacing a document means removing it and adding it again.
 *
 * @param totalTerms  number of tokens left after stopword filtering
 * @param uniqueTerms number of distinct terms among those tokens
 * @param addedAt     insertion time in epoch milliseconds
 */
public record DocumentRecord(
		@NotNull String id,
		@NotNull String content,
		@NotNull String title,
		@Nullable String author,
		int totalTerms,
		int uniqueTerms,
		long addedAt
) {
	@NotNull
	@Override
	public String toString() {
		return String.format("DocumentRecord{id='%s', title='%s', author='%s', terms=%d, unique=%d}",
				id, title, author, totalTerms, uniqueTerms);
	}
}
