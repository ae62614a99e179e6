package org.docsearch.core.model;

import org.jetbrains.annotations.Nullable;

/**
 * File-level facts about the stored snapshot.
 *
 * @param sizeBytes    {@code 0} when the file does not exist or its attributes could not be read
 * @param lastModified ISO-8601 modification time of the snapshot file, {@code null} when it does not exist or its
 *                     attributes could not be read
 */
public record SnapshotInfo(
		boolean exists,
		long sizeBytes,
		double sizeMb,
		@Nullable String lastModified,
		int backupCount
) {
	public static SnapshotInfo missing(int backupCount) {
		return new SnapshotInfo(false, 0L, 0.0, null, backupCount);
	}

	/**
	 * The snapshot file exists but its size and modification time could not be read
	 */
	public static SnapshotInfo unknownSize(int backupCount) {
		return new SnapshotInfo(true, 0L, 0.0, null, backupCount);
	}
}
