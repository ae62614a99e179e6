package org.docsearch.core.index;

/** Outcome of {@link InvertedIndex#addDocument}. */
public enum AddResult {
	ADDED,
	/** Content was blank or contained no indexable terms; nothing changed. */
	REJECTED
}
