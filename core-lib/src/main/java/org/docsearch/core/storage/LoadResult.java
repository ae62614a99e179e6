package org.docsearch.core.storage;

import org.docsearch.core.index.InvertedIndex;

import java.nio.file.Path;

/**
 * Outcome of {@link SnapshotStore#load()}.
 *
 * @param index  the loaded index; {@code null} only when {@code status} is {@link Status#FAILED}
 * @param source file the index was read from, {@code null} for {@link Status#EMPTY} and {@link Status#FAILED}
 */
public record LoadResult(
		Status status,
		InvertedIndex index,
		Path source,
		String error
) {
	public enum Status {
		/** No snapshot has been written yet; the index is new and empty. */
		EMPTY,
		LOADED,
		/** The current snapshot was unreadable and a backup was used instead. */
		RESTORED_FROM_BACKUP,
		/** The current snapshot and every backup were unreadable. */
		FAILED
	}

	public static LoadResult empty() {
		return new LoadResult(Status.EMPTY, new InvertedIndex(), null, null);
	}

	public static LoadResult loaded(InvertedIndex index, Path source) {
		return new LoadResult(Status.LOADED, index, source, null);
	}

	public static LoadResult restored(InvertedIndex index, Path backup, String error) {
		return new LoadResult(Status.RESTORED_FROM_BACKUP, index, backup, error);
	}

	public static LoadResult failed(String error) {
		return new LoadResult(Status.FAILED, null, null, error);
	}

	public boolean isFailed() {
		return status == Status.FAILED;
	}
}
