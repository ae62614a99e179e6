package org.docsearch.core.storage;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.docsearch.core.index.InvertedIndex;
import org.docsearch.core.model.IndexSnapshot;
import org.docsearch.core.model.SnapshotInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stores the index as a JSON file, {@code <dataDir>/index.json}.
 *
 * <p>A save writes {@code index.json.tmp} and renames it over {@code index.json}, so the canonical file always holds
 * one complete snapshot. Before each save the existing snapshot is copied to
 * {@code <dataDir>/backups/index_backup_<timestamp>.json}; only the most recently modified backups are kept.</p>
 */
public class JsonSnapshotStore implements SnapshotStore {
	private static final Logger logger = LoggerFactory.getLogger(JsonSnapshotStore.class);

	public static final String SNAPSHOT_FILENAME = "index.json";
	public static final String BACKUP_DIRECTORY = "backups";
	public static final int DEFAULT_BACKUP_KEEP = 5;

	private static final String BACKUP_PREFIX = "index_backup_";
	private static final String BACKUP_SUFFIX = ".json";
	private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

	private static final Comparator<Path> NEWEST_FIRST = Comparator
			.comparing(JsonSnapshotStore::modifiedTime)
			.thenComparing(path -> path.getFileName().toString())
			.reversed();

	private final Path dataDir;
	private final Path snapshotPath;
	private final Path tempPath;
	private final Path backupDir;
	private final int backupKeep;
	private final Clock clock;
	private final Gson gson;

	public JsonSnapshotStore(Path dataDir) {
		this(dataDir, DEFAULT_BACKUP_KEEP, Clock.systemDefaultZone());
	}

	public JsonSnapshotStore(Path dataDir, int backupKeep, Clock clock) {
		if (backupKeep < 1) {
			throw new IllegalArgumentException("backupKeep must be at least 1, got " + backupKeep);
		}
		this.dataDir = dataDir;
		this.snapshotPath = dataDir.resolve(SNAPSHOT_FILENAME);
		this.tempPath = dataDir.resolve(SNAPSHOT_FILENAME + ".tmp");
		this.backupDir = dataDir.resolve(BACKUP_DIRECTORY);
		this.backupKeep = backupKeep;
		this.clock = clock;
		this.gson = new GsonBuilder()
				.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
				.serializeNulls()
				.setPrettyPrinting()
				.create();

		try {
			Files.createDirectories(backupDir);
			logger.info("JSON snapshot store initialized at: {}", dataDir);
		} catch (IOException e) {
			logger.error("Failed to create snapshot directory {}", backupDir, e);
			throw new UncheckedIOException("Failed to create snapshot directory " + backupDir, e);
		}
	}

	@Override
	public synchronized SaveResult save(InvertedIndex index) {
		if (Files.exists(snapshotPath)) {
			createBackup();
		}

		try {
			IndexSnapshot snapshot = index.toSnapshot(OffsetDateTime.now(clock).toString());
			Files.writeString(tempPath, gson.toJson(snapshot), StandardCharsets.UTF_8);
			moveIntoPlace(tempPath, snapshotPath);

			logger.info("Saved index snapshot to {} ({} documents, {} terms)",
					snapshotPath, snapshot.totalDocuments(), snapshot.totalTerms());
			return SaveResult.saved(snapshotPath);

		} catch (IOException | RuntimeException e) {
			logger.error("Failed to save index snapshot to {}", snapshotPath, e);
			deleteTempFile();
			return SaveResult.failed(snapshotPath, e.getMessage());
		}
	}

	/**
	 * Replace {@code target} with {@code source} in one step where the filesystem supports it
	 */
	protected void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.warn("Atomic move not supported in {}, falling back to replace", dataDir);
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	@Override
	public LoadResult load() {
		if (!Files.exists(snapshotPath)) {
			logger.info("No existing index snapshot at {}, starting with an empty index", snapshotPath);
			return LoadResult.empty();
		}

		try {
			InvertedIndex index = readIndex(snapshotPath);
			logger.info("Loaded index snapshot from {} ({} documents, {} terms)",
					snapshotPath, index.totalDocuments(), index.totalTerms());
			return LoadResult.loaded(index, snapshotPath);
		} catch (SnapshotReadException e) {
			logger.error("Failed to load index snapshot {}: {}", snapshotPath, e.getMessage());
			return restoreFromBackup(e.getMessage());
		}
	}

	private LoadResult restoreFromBackup(String cause) {
		List<Path> backups = listBackups();
		if (backups.isEmpty()) {
			logger.warn("No backup files found in {}", backupDir);
			return LoadResult.failed("Snapshot unreadable (" + cause + ") and no backups available");
		}

		for (Path backup : backups) {
			logger.info("Attempting to restore from backup: {}", backup);
			try {
				InvertedIndex index = readIndex(backup);
				logger.info("Restored index from backup {} ({} documents)", backup, index.totalDocuments());
				return LoadResult.restored(index, backup, cause);
			} catch (SnapshotReadException e) {
				logger.warn("Backup {} is unusable: {}", backup, e.getMessage());
			}
		}

		return LoadResult.failed("Snapshot unreadable (" + cause + ") and all " + backups.size() + " backups failed");
	}

	private InvertedIndex readIndex(Path path) throws SnapshotReadException {
		IndexSnapshot snapshot = readSnapshot(path);
		try {
			return InvertedIndex.fromSnapshot(snapshot);
		} catch (IllegalArgumentException e) {
			throw new SnapshotReadException("Inconsistent snapshot " + path + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Parse one snapshot file without validating its contents
	 */
	public IndexSnapshot readSnapshot(Path path) throws SnapshotReadException {
		String json;
		try {
			json = Files.readString(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new SnapshotReadException("Cannot read " + path, e);
		}

		IndexSnapshot snapshot;
		try {
			snapshot = gson.fromJson(json, IndexSnapshot.class);
		} catch (RuntimeException e) {
			throw new SnapshotReadException("Malformed snapshot " + path, e);
		}

		if (snapshot == null) {
			throw new SnapshotReadException("Snapshot " + path + " is empty");
		}
		return snapshot;
	}

	private void createBackup() {
		try {
			Path backup = nextBackupPath();
			Files.copy(snapshotPath, backup);
			logger.info("Backup created: {}", backup);
			pruneBackups();
		} catch (IOException | UncheckedIOException e) {
			logger.error("Failed to back up {}", snapshotPath, e);
		}
	}

	private Path nextBackupPath() {
		String stamp = LocalDateTime.now(clock).format(BACKUP_TIMESTAMP);
		Path candidate = backupDir.resolve(BACKUP_PREFIX + stamp + BACKUP_SUFFIX);
		for (int n = 1; Files.exists(candidate); n++) {
			candidate = backupDir.resolve(String.format("%s%s_%03d%s", BACKUP_PREFIX, stamp, n, BACKUP_SUFFIX));
		}
		return candidate;
	}

	private void pruneBackups() throws IOException {
		List<Path> backups = listBackups();
		for (Path old : backups.subList(Math.min(backupKeep, backups.size()), backups.size())) {
			Files.delete(old);
			logger.info("Removed old backup: {}", old);
		}
	}

	/**
	 * Backup files, most recently modified first
	 */
	public List<Path> listBackups() {
		if (!Files.isDirectory(backupDir)) {
			return List.of();
		}

		try (Stream<Path> files = Files.list(backupDir)) {
			return files
					.filter(JsonSnapshotStore::isBackupFile)
					.sorted(NEWEST_FIRST)
					.toList();
		} catch (IOException | UncheckedIOException e) {
			logger.warn("Failed to list backups in {}", backupDir, e);
			return List.of();
		}
	}

	@Override
	public SnapshotInfo info() {
		int backupCount = listBackups().size();
		if (!Files.exists(snapshotPath)) {
			return SnapshotInfo.missing(backupCount);
		}

		try {
			BasicFileAttributes attributes = readAttributes(snapshotPath);
			long bytes = attributes.size();
			return new SnapshotInfo(true, bytes, bytes / (1024.0 * 1024.0),
					attributes.lastModifiedTime().toInstant().toString(), backupCount);
		} catch (IOException e) {
			logger.warn("Failed to read attributes of {}", snapshotPath, e);
			return SnapshotInfo.unknownSize(backupCount);
		}
	}

	protected BasicFileAttributes readAttributes(Path path) throws IOException {
		return Files.readAttributes(path, BasicFileAttributes.class);
	}

	@Override
	public synchronized boolean deleteAll() {
		try {
			if (Files.deleteIfExists(snapshotPath)) {
				logger.info("Snapshot file deleted: {}", snapshotPath);
			}
			Files.deleteIfExists(tempPath);
			for (Path backup : listBackups()) {
				Files.delete(backup);
				logger.info("Backup file deleted: {}", backup);
			}
			return true;
		} catch (IOException e) {
			logger.error("Failed to delete snapshot files in {}", dataDir, e);
			return false;
		}
	}

	public Path snapshotPath() {
		return snapshotPath;
	}

	public Path backupDir() {
		return backupDir;
	}

	private void deleteTempFile() {
		try {
			Files.deleteIfExists(tempPath);
		} catch (IOException e) {
			logger.warn("Failed to remove temporary snapshot {}", tempPath, e);
		}
	}

	private static boolean isBackupFile(Path path) {
		String name = path.getFileName().toString();
		return name.startsWith(BACKUP_PREFIX) && name.endsWith(BACKUP_SUFFIX);
	}

	private static FileTime modifiedTime(Path path) {
		try {
			return Files.getLastModifiedTime(path);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
