package org.docsearch.search.bootstrap;

import org.docsearch.core.index.InvertedIndex;
import org.docsearch.core.storage.JsonSnapshotStore;
import org.docsearch.core.storage.LoadResult;
import org.docsearch.core.storage.SnapshotStore;
import org.docsearch.search.config.SearchConfig;
import org.docsearch.search.controller.SearchController;
import org.docsearch.search.service.DocumentService;
import org.docsearch.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, restores the index from its snapshot, starts the HTTP API and registers a JVM shutdown hook
 * that saves the index on exit.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(String[] args) {
        try {
            start(args);
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start(String[] args) {
        SearchConfig cfg = SearchConfig.load(args);
        SnapshotStore store = new JsonSnapshotStore(
            Paths.get(cfg.storage().dataDir()),
            cfg.storage().backupKeep(),
            Clock.systemDefaultZone()
        );
        DocumentService service = new DocumentService(loadIndex(store), store);
        Javalin app = startHttp(cfg, service);
        addShutdownHook(service, app);
        logger.info("Search Service started successfully on port {}", app.port());
    }

    /**
     * Restores the index from the store.
     *
     * @throws IllegalStateException when a snapshot exists but neither it nor any backup can be read
     */
    static InvertedIndex loadIndex(SnapshotStore store) {
        LoadResult result = store.load();
        if (result.isFailed()) {
            throw new IllegalStateException("Refusing to start with an empty index: " + result.error());
        }
        if (result.status() == LoadResult.Status.RESTORED_FROM_BACKUP) {
            logger.warn("Index restored from backup {} after: {}", result.source(), result.error());
        }
        InvertedIndex index = result.index();
        logger.info("Index ready with {} documents and {} terms", index.totalDocuments(), index.totalTerms());
        return index;
    }

    private static Javalin startHttp(SearchConfig cfg, DocumentService service) {
        SearchController controller = new SearchController(service, cfg.defaultLimit(), cfg.maxLimit());
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(DocumentService service, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(service, app)));
    }

    private static void shutdown(DocumentService service, Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        service.persist();
        logger.info("Search Service stopped.");
    }
}
