package org.docsearch.core.storage;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.docsearch.core.index.InvertedIndex;
import org.docsearch.core.model.IndexSnapshot;
import org.docsearch.core.model.SnapshotInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JsonSnapshotStoreTest {

	@Test
	public void testLoadWithoutSnapshotGivesEmptyIndex(@TempDir Path tempDir) {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);

		LoadResult result = store.load();

		assertEquals(LoadResult.Status.EMPTY, result.status());
		assertNotNull(result.index());
		assertEquals(0, result.index().totalDocuments());
		assertFalse(result.isFailed());
	}

	@Test
	public void testSaveAndLoadRoundTrip(@TempDir Path tempDir) {
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "Python is a programming language", "Python Intro", "John Doe");
		index.addDocument("doc2", "Java is also a programming language", null, "Jane Roe");
		index.addDocument("doc3", "Python is popular for data science, data!", "Data", null);

		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		assertTrue(store.save(index).success());

		LoadResult result = new JsonSnapshotStore(tempDir).load();

		assertEquals(LoadResult.Status.LOADED, result.status());
		assertEquals(store.snapshotPath(), result.source());
		InvertedIndex loaded = result.index();
		assertEquals(index.totalDocuments(), loaded.totalDocuments());
		assertEquals(index.totalTerms(), loaded.totalTerms());
		assertEquals(index.stats(), loaded.stats());
		for (String id : List.of("doc1", "doc2", "doc3")) {
			assertEquals(index.getDocument(id), loaded.getDocument(id));
		}
		assertEquals(new ArrayList<>(index.sampleTerms(100).keySet()), new ArrayList<>(loaded.sampleTerms(100).keySet()));
		assertEquals(index.sampleTerms(100), loaded.sampleTerms(100));
		assertEquals(index.search("python data", 10), loaded.search("python data", 10));
	}

	@Test
	public void testSnapshotLayout(@TempDir Path tempDir) throws IOException {
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha beta alpha");
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		store.save(index);

		JsonObject json = JsonParser.parseString(Files.readString(store.snapshotPath())).getAsJsonObject();

		assertEquals("1.0", json.get("version").getAsString());
		assertTrue(json.has("saved_at"));
		assertEquals(1, json.get("total_documents").getAsInt());
		assertEquals(2, json.get("total_terms").getAsInt());
		assertEquals(2, json.getAsJsonObject("index").getAsJsonObject("alpha").get("doc1").getAsInt());
		assertEquals(1, json.getAsJsonObject("term_stats").get("beta").getAsInt());
		assertEquals(3, json.getAsJsonObject("documents").getAsJsonObject("doc1").get("total_terms").getAsInt());
		assertFalse(Files.exists(tempDir.resolve(JsonSnapshotStore.SNAPSHOT_FILENAME + ".tmp")));
	}

	@Test
	public void testFailedRenameKeepsPreviousSnapshot(@TempDir Path tempDir) throws IOException {
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "first document");
		index.addDocument("doc2", "second document");
		assertTrue(new JsonSnapshotStore(tempDir).save(index).success());
		String before = Files.readString(tempDir.resolve(JsonSnapshotStore.SNAPSHOT_FILENAME));

		JsonSnapshotStore crashing = new JsonSnapshotStore(tempDir, 5, Clock.systemDefaultZone()) {
			@Override
			protected void moveIntoPlace(Path source, Path target) throws IOException {
				throw new IOException("simulated crash before rename");
			}
		};
		index.addDocument("doc3", "third document");
		SaveResult result = crashing.save(index);

		assertFalse(result.success());
		assertEquals("simulated crash before rename", result.error());
		assertFalse(Files.exists(tempDir.resolve(JsonSnapshotStore.SNAPSHOT_FILENAME + ".tmp")));
		assertEquals(before, Files.readString(crashing.snapshotPath()));

		LoadResult reloaded = new JsonSnapshotStore(tempDir).load();
		assertEquals(LoadResult.Status.LOADED, reloaded.status());
		assertEquals(2, reloaded.index().totalDocuments());
	}

	@Test
	public void testBackupRetention(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		InvertedIndex index = new InvertedIndex();

		for (int i = 1; i <= 8; i++) {
			index.addDocument("doc" + i, "document number" + i);
			assertTrue(store.save(index).success());
		}

		List<Path> backups = store.listBackups();
		assertEquals(5, backups.size());

		Set<Integer> documentCounts = new HashSet<>();
		for (Path backup : backups) {
			documentCounts.add(store.readSnapshot(backup).totalDocuments());
		}
		assertEquals(Set.of(3, 4, 5, 6, 7), documentCounts);
		assertEquals(5, store.info().backupCount());
	}

	@Test
	public void testCorruptSnapshotRestoredFromBackup(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha");
		index.addDocument("doc2", "beta");
		store.save(index);
		index.addDocument("doc3", "gamma");
		store.save(index);

		Files.writeString(store.snapshotPath(), "{ \"index\": { not valid json");

		LoadResult result = store.load();

		assertEquals(LoadResult.Status.RESTORED_FROM_BACKUP, result.status());
		assertEquals(2, result.index().totalDocuments());
		assertTrue(result.index().containsDocument("doc2"));
		assertNotNull(result.error());
	}

	@Test
	public void testUnreadableBackupIsSkipped(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha");
		store.save(index);
		index.addDocument("doc2", "beta");
		store.save(index);
		index.addDocument("doc3", "gamma");
		store.save(index);

		List<Path> backups = store.listBackups();
		assertEquals(2, backups.size());
		Files.writeString(backups.get(0), "garbage");
		Files.writeString(store.snapshotPath(), "");

		LoadResult result = store.load();

		assertEquals(LoadResult.Status.RESTORED_FROM_BACKUP, result.status());
		assertEquals(backups.get(1), result.source());
	}

	@Test
	public void testCorruptSnapshotWithoutBackupsFails(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha");
		store.save(index);

		Files.writeString(store.snapshotPath(), "not json at all");

		LoadResult result = store.load();

		assertEquals(LoadResult.Status.FAILED, result.status());
		assertTrue(result.isFailed());
		assertNull(result.index());
		assertNotNull(result.error());
	}

	@Test
	public void testAllBackupsCorruptFails(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha");
		store.save(index);
		store.save(index);

		for (Path backup : store.listBackups()) {
			Files.writeString(backup, "[]");
		}
		Files.writeString(store.snapshotPath(), "[]");

		assertEquals(LoadResult.Status.FAILED, store.load().status());
	}

	@Test
	public void testInconsistentSnapshotTreatedAsCorrupt(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		Files.writeString(store.snapshotPath(), """
				{
				  "index": {},
				  "documents": {},
				  "term_stats": {},
				  "total_documents": 3,
				  "total_terms": 0,
				  "saved_at": "2026-10-17T10:15:30Z",
				  "version": "1.0"
				}
				""");

		assertEquals(LoadResult.Status.FAILED, store.load().status());
	}

	@Test
	public void testUnknownVersionTreatedAsCorrupt(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		Files.writeString(store.snapshotPath(), """
				{"index": {}, "documents": {}, "term_stats": {}, "total_documents": 0, "total_terms": 0,
				 "saved_at": "2026-10-17T10:15:30Z", "version": "9.9"}
				""");

		assertEquals(LoadResult.Status.FAILED, store.load().status());
	}

	@Test
	public void testReadSnapshotOfGarbageThrows(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		Path file = tempDir.resolve("broken.json");
		Files.writeString(file, "{\"total_documents\": \"many\"}");

		assertThrows(SnapshotReadException.class, () -> store.readSnapshot(file));
		assertThrows(SnapshotReadException.class, () -> store.readSnapshot(tempDir.resolve("missing.json")));
	}

	@Test
	public void testInfo(@TempDir Path tempDir) {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);

		SnapshotInfo empty = store.info();
		assertFalse(empty.exists());
		assertEquals(0, empty.backupCount());
		assertNull(empty.lastModified());

		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha beta");
		store.save(index);
		store.save(index);

		SnapshotInfo info = store.info();
		assertTrue(info.exists());
		assertTrue(info.sizeBytes() > 0);
		assertEquals(info.sizeBytes() / (1024.0 * 1024.0), info.sizeMb(), 1e-12);
		assertNotNull(info.lastModified());
		assertEquals(1, info.backupCount());
	}

	@Test
	public void testInfoReportsExistingSnapshotWhenAttributesAreUnreadable(@TempDir Path tempDir) {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir) {
			@Override
			protected BasicFileAttributes readAttributes(Path path) throws IOException {
				throw new IOException("simulated stat failure");
			}
		};
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha beta");
		assertTrue(store.save(index).success());

		SnapshotInfo info = store.info();

		assertTrue(info.exists());
		assertEquals(0L, info.sizeBytes());
		assertNull(info.lastModified());
		assertEquals(0, info.backupCount());
	}

	@Test
	public void testDeleteAll(@TempDir Path tempDir) {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha");
		store.save(index);
		store.save(index);
		store.save(index);

		assertTrue(store.deleteAll());

		SnapshotInfo info = store.info();
		assertFalse(info.exists());
		assertEquals(0, info.backupCount());
		assertEquals(LoadResult.Status.EMPTY, store.load().status());
	}

	@Test
	public void testBackupKeepMustBePositive(@TempDir Path tempDir) {
		assertThrows(IllegalArgumentException.class, () -> new JsonSnapshotStore(tempDir, 0, Clock.systemUTC()));
	}

	@Test
	public void testSavedSnapshotIsReadable(@TempDir Path tempDir) throws IOException {
		JsonSnapshotStore store = new JsonSnapshotStore(tempDir);
		InvertedIndex index = new InvertedIndex();
		index.addDocument("doc1", "alpha");
		store.save(index);

		IndexSnapshot snapshot = store.readSnapshot(store.snapshotPath());

		assertEquals(IndexSnapshot.FORMAT_VERSION, snapshot.version());
		assertNotNull(snapshot.savedAt());
		assertEquals(1, snapshot.documents().size());
	}
}
