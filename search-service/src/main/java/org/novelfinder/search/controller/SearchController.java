package org.novelfinder.search.controller;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.novelfinder.search.model.SearchRequest;
import org.novelfinder.search.model.SearchResponse;
import org.novelfinder.search.service.NovelSearchService;
import org.novelfinder.search.session.SearchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final NovelSearchService searchService;

	public SearchController(NovelSearchService searchService) {
		this.searchService = searchService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/sources", this::handleSources);

		app.get("/search", this::handleSearch);

		app.post("/search", this::handleStartSearch);

		app.get("/search/{id}", this::handleSearchStatus);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("sources", searchService.sourceCount());
		health.put("active_sessions", searchService.activeSessions());

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /sources
	 * Every source reference that can be searched
	 */
	private void handleSources(Context ctx) {
		List<String> references = searchService.sourceReferences();

		Map<String, Object> response = new HashMap<>();
		response.put("total_sources", searchService.sourceCount());
		response.put("references", references);

		ctx.status(200).result(gson.toJson(response));
	}

	/**
	 * GET /search?q={query}&source={reference}...
	 * Searches and waits for every source to answer
	 */
	private void handleSearch(Context ctx) {
		try {
			String query = ctx.queryParam("q");
			if (query == null || query.trim().isEmpty()) {
				badRequest(ctx, "Query parameter 'q' is required.");
				return;
			}

			List<String> sources = sourcesOrCatalog(ctx.queryParams("source"));
			logger.info("Search request: q='{}', sources={}", query, sources.size());

			SearchSession session = searchService.runSearch(query, sources);

			ctx.status(200).result(gson.toJson(SearchResponse.fromSession(session)));
			logger.info("Returned {} search results", session.results().size());

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Search failed: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Search failed", e);
		}
	}

	/**
	 * POST /search  {"query": "...", "sources": ["https://..."]}
	 * Starts a search in the background; poll GET /search/{id} for progress
	 */
	private void handleStartSearch(Context ctx) {
		try {
			SearchRequest request;
			try {
				request = gson.fromJson(ctx.body(), SearchRequest.class);
			} catch (JsonParseException e) {
				badRequest(ctx, "Request body must be a JSON object.");
				return;
			}

			if (request == null || request.query() == null || request.query().trim().isEmpty()) {
				badRequest(ctx, "Field 'query' is required.");
				return;
			}

			List<String> sources = sourcesOrCatalog(request.sources());
			SearchSession session = searchService.startSearch(request.query(), sources);
			logger.info("Started search session {}: q='{}', sources={}", session.id(), request.query(), sources.size());

			Map<String, Object> response = new HashMap<>();
			response.put("session_id", session.id());
			response.put("query", session.query());
			response.put("progress", session.progress());

			ctx.status(202).result(gson.toJson(response));

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Search failed: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Failed to start search", e);
		}
	}

	/**
	 * GET /search/{id}
	 * Progress of a background search, with its results once finished
	 */
	private void handleSearchStatus(Context ctx) {
		String id = ctx.pathParam("id");
		Optional<SearchSession> session = searchService.findSession(id);

		if (session.isEmpty()) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Unknown search session: " + id);
			ctx.status(404).result(gson.toJson(error));
			return;
		}

		ctx.status(200).result(gson.toJson(SearchResponse.fromSession(session.get())));
		logger.debug("Reported progress of session {}", id);
	}

	private List<String> sourcesOrCatalog(List<String> requested) {
		if (requested == null || requested.isEmpty()) {
			return searchService.sourceReferences();
		}
		return requested;
	}

	private void badRequest(Context ctx, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(400).result(gson.toJson(error));
	}
}
