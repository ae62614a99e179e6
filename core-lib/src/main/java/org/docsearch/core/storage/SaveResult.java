package org.docsearch.core.storage;

import java.nio.file.Path;

public record SaveResult(
		boolean success,
		Path path,
		String error
) {
	public static SaveResult saved(Path path) {
		return new SaveResult(true, path, null);
	}

	public static SaveResult failed(Path path, String error) {
		return new SaveResult(false, path, error);
	}
}
