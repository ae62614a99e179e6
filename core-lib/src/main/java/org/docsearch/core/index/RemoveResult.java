package org.docsearch.core.index;

/** Outcome of {@link InvertedIndex#removeDocument}. */
public enum RemoveResult {
	REMOVED,
	NOT_FOUND
}
