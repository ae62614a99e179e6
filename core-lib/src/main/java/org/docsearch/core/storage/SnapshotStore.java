package org.docsearch.core.storage;

import org.docsearch.core.index.InvertedIndex;
import org.docsearch.core.model.SnapshotInfo;

/**
 * Durable storage for index snapshots.
 *
 * <p>Expected outcomes are returned, not thrown: a failed save leaves the previous snapshot in place and says so in
 * its {@link SaveResult}, and a load distinguishes "nothing stored yet" from "stored but unreadable".</p>
 */
public interface SnapshotStore {
	/**
	 * Write a snapshot of the index, replacing the current one atomically
	 */
	SaveResult save(InvertedIndex index);

	/**
	 * Load the stored index, falling back to backups when the current snapshot is unreadable
	 */
	LoadResult load();

	/**
	 * Describe the stored snapshot without touching it
	 */
	SnapshotInfo info();

	/**
	 * Remove the snapshot and every backup
	 */
	boolean deleteAll();
}
