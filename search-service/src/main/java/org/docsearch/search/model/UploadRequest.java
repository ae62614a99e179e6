package org.docsearch.search.model;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Body of {@code POST /upload}.
 */
public record UploadRequest(
		String docId,
		String content,
		@Nullable String title,
		@Nullable String author
) {
	public static final int MAX_DOC_ID_LENGTH = 100;
	public static final int MAX_CONTENT_LENGTH = 100_000;
	public static final int MAX_TITLE_LENGTH = 200;
	public static final int MAX_AUTHOR_LENGTH = 100;

	/**
	 * Check field lengths, counted in code points
	 *
	 * @return the first violation found, empty when the request is acceptable
	 */
	public Optional<String> validate() {
		if (docId == null || docId.isEmpty() || length(docId) > MAX_DOC_ID_LENGTH) {
			return Optional.of("doc_id must be between 1 and " + MAX_DOC_ID_LENGTH + " characters");
		}
		if (content == null || content.isEmpty() || length(content) > MAX_CONTENT_LENGTH) {
			return Optional.of("content must be between 1 and " + MAX_CONTENT_LENGTH + " characters");
		}
		if (title != null && length(title) > MAX_TITLE_LENGTH) {
			return Optional.of("title must be at most " + MAX_TITLE_LENGTH + " characters");
		}
		if (author != null && length(author) > MAX_AUTHOR_LENGTH) {
			return Optional.of("author must be at most " + MAX_AUTHOR_LENGTH + " characters");
		}
		return Optional.empty();
	}

	private static int length(String value) {
		return value.codePointCount(0, value.length());
	}
}
