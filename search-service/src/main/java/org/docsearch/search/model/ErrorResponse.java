package org.docsearch.search.model;

import java.time.Instant;

public record ErrorResponse(
		String error,
		String detail,
		String timestamp
) {
	public static ErrorResponse of(int status, String message) {
		return new ErrorResponse(message, "HTTP " + status + " error occurred", Instant.now().toString());
	}
}
