package org.docsearch.search.controller;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.docsearch.core.model.IndexStats;
import org.docsearch.core.model.SnapshotInfo;
import org.docsearch.search.model.DeleteResponse;
import org.docsearch.search.model.DocumentResponse;
import org.docsearch.search.model.ErrorResponse;
import org.docsearch.search.model.HealthResponse;
import org.docsearch.search.model.IndexResponse;
import org.docsearch.search.model.ResetResponse;
import org.docsearch.search.model.SearchResponse;
import org.docsearch.search.model.SearchResult;
import org.docsearch.search.model.ServiceInfoResponse;
import org.docsearch.search.model.UploadRequest;
import org.docsearch.search.model.UploadResponse;
import org.docsearch.search.service.DeleteResult;
import org.docsearch.search.service.DocumentService;
import org.docsearch.search.service.SearchOutcome;
import org.docsearch.search.service.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new GsonBuilder()
			.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
			.serializeNulls()
			.create();

	public static final String VERSION = "1.0.0";
	private static final int SAMPLE_TERMS = 20;
	private static final int MAX_QUERY_LENGTH = 200;

	private final DocumentService documentService;
	private final int defaultLimit;
	private final int maxLimit;
	private final long startedAt;

	public SearchController(DocumentService documentService, int defaultLimit, int maxLimit) {
		this.documentService = documentService;
		this.defaultLimit = defaultLimit;
		this.maxLimit = maxLimit;
		this.startedAt = System.nanoTime();
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/", this::handleInfo);

		app.post("/upload", this::handleUpload);

		app.get("/search", this::handleSearch);

		app.get("/index", this::handleIndex);
		app.delete("/index", this::handleReset);

		app.get("/health", this::handleHealth);

		app.get("/documents/{doc_id}", this::handleGetDocument);
		app.delete("/documents/{doc_id}", this::handleDeleteDocument);

		app.exception(Exception.class, (e, ctx) -> {
			logger.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
			error(ctx, 500, "Internal server error");
		});

		logger.info("Search routes registered");
	}

	/**
	 * GET /
	 * Service description
	 */
	private void handleInfo(Context ctx) {
		Map<String, String> endpoints = new LinkedHashMap<>();
		endpoints.put("upload", "/upload - POST - Upload documents");
		endpoints.put("search", "/search - GET - Search documents");
		endpoints.put("index", "/index - GET - View index statistics, DELETE - Reset the index");
		endpoints.put("documents", "/documents/{doc_id} - GET, DELETE - Fetch or remove one document");
		endpoints.put("health", "/health - GET - Health check");

		ctx.result(gson.toJson(new ServiceInfoResponse(
				"Inverted Index Search API",
				VERSION,
				"Document search service backed by an in-memory inverted index",
				endpoints
		)));
	}

	/**
	 * POST /upload
	 * Index one document and save a snapshot
	 */
	private void handleUpload(Context ctx) {
		UploadRequest request;
		try {
			request = gson.fromJson(ctx.body(), UploadRequest.class);
		} catch (JsonParseException e) {
			error(ctx, 400, "Malformed JSON body");
			return;
		}

		if (request == null) {
			error(ctx, 400, "Request body is required");
			return;
		}

		Optional<String> violation = request.validate();
		if (violation.isPresent()) {
			error(ctx, 400, violation.get());
			return;
		}

		UploadResult result = documentService.upload(request.docId(), request.content(), request.title(), request.author());
		switch (result.outcome()) {
			case DUPLICATE -> error(ctx, 409, "Document with ID '" + result.docId() + "' already exists");
			case REJECTED -> error(ctx, 400, "Failed to index document. Please check the content.");
			case UPLOADED -> {
				UploadResponse response = new UploadResponse(
						"Document uploaded successfully",
						result.docId(),
						result.document().uniqueTerms(),
						result.totalDocuments(),
						result.persisted()
				);
				ctx.status(200).result(gson.toJson(response));
			}
		}
	}

	/**
	 * GET /search?query={query}&limit={limit}
	 * Ranked search
	 */
	private void handleSearch(Context ctx) {
		String query = ctx.queryParam("query");
		if (query == null || query.isBlank()) {
			error(ctx, 400, "Query cannot be empty");
			return;
		}
		if (query.codePointCount(0, query.length()) > MAX_QUERY_LENGTH) {
			error(ctx, 400, "Query must be at most " + MAX_QUERY_LENGTH + " characters");
			return;
		}

		int limit = defaultLimit;
		String limitStr = ctx.queryParam("limit");
		if (limitStr != null && !limitStr.isEmpty()) {
			try {
				limit = Integer.parseInt(limitStr);
			} catch (NumberFormatException e) {
				error(ctx, 400, "Invalid limit format. Must be an integer.");
				return;
			}
			if (limit < 1 || limit > maxLimit) {
				error(ctx, 400, "Limit must be between 1 and " + maxLimit);
				return;
			}
		}

		SearchOutcome outcome = documentService.search(query, limit);
		List<SearchResult> results = outcome.hits().stream()
				.map(SearchResult::fromHit)
				.toList();

		SearchResponse response = new SearchResponse(
				query,
				results,
				results.size(),
				Math.round(outcome.elapsedMillis() * 100) / 100.0
		);
		ctx.status(200).result(gson.toJson(response));
	}

	/**
	 * GET /index
	 * Statistics and a sample of terms
	 */
	private void handleIndex(Context ctx) {
		IndexStats stats = documentService.stats();
		SnapshotInfo info = documentService.storageInfo();

		IndexResponse.Stats summary = new IndexResponse.Stats(
				stats.totalDocuments(),
				stats.totalTerms(),
				Math.round(info.sizeMb() * 100) / 100.0,
				info.lastModified() != null ? info.lastModified() : Instant.now().toString()
		);

		ctx.status(200).result(gson.toJson(new IndexResponse(summary, documentService.sampleTerms(SAMPLE_TERMS))));
	}

	/**
	 * DELETE /index
	 * Drop every document and the stored snapshots
	 */
	private void handleReset(Context ctx) {
		boolean filesDeleted = documentService.reset();
		ResetResponse response = new ResetResponse("Index reset", documentService.totalDocuments(), filesDeleted);
		ctx.status(200).result(gson.toJson(response));
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		double uptimeSeconds = (System.nanoTime() - startedAt) / 1_000_000_000.0;
		ctx.result(gson.toJson(new HealthResponse("healthy", VERSION, Math.round(uptimeSeconds * 100) / 100.0)));
	}

	/**
	 * GET /documents/{doc_id}
	 */
	private void handleGetDocument(Context ctx) {
		String docId = ctx.pathParam("doc_id");
		documentService.getDocument(docId).ifPresentOrElse(
				record -> ctx.status(200).result(gson.toJson(DocumentResponse.from(record))),
				() -> error(ctx, 404, "Document with ID '" + docId + "' not found")
		);
	}

	/**
	 * DELETE /documents/{doc_id}
	 */
	private void handleDeleteDocument(Context ctx) {
		DeleteResult result = documentService.delete(ctx.pathParam("doc_id"));
		if (!result.removed()) {
			error(ctx, 404, "Document with ID '" + result.docId() + "' not found");
			return;
		}

		DeleteResponse response = new DeleteResponse(
				"Document deleted successfully",
				result.docId(),
				result.totalDocuments(),
				result.persisted()
		);
		ctx.status(200).result(gson.toJson(response));
	}

	private static void error(Context ctx, int status, String message) {
		ctx.status(status).result(gson.toJson(ErrorResponse.of(status, message)));
	}
}
