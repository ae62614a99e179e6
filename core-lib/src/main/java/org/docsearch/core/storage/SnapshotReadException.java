package org.docsearch.core.storage;

import java.io.IOException;

/**
 * Thrown when a snapshot file cannot be read, parsed or turned back into a consistent index.
 */
public class SnapshotReadException extends IOException {
	public SnapshotReadException(String message) {
		super(message);
	}

	public SnapshotReadException(String message, Throwable cause) {
		super(message, cause);
	}
}
