package org.novelfinder.search.service;

import org.novelfinder.core.model.CombinedSearchResult;
import org.novelfinder.core.model.SearchResult;
import org.novelfinder.search.session.SearchSession;
import org.novelfinder.search.session.SearchSessionRegistry;
import org.novelfinder.search.source.SourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the search engine: fans a query out over the given sources and ranks what they return.
 */
public class NovelSearchService {
	private static final Logger logger = LoggerFactory.getLogger(NovelSearchService.class);
	public static final int DEFAULT_MAX_ACTIVE_SEARCHES = 4;

	private final SourceCatalog catalog;
	private final SearchDispatcher dispatcher;
	private final ResultAggregator aggregator;
	private final SearchSessionRegistry registry;
	private final ExecutorService coordinator;

	public NovelSearchService(SourceCatalog catalog, SearchDispatcher dispatcher,
							  ResultAggregator aggregator, SearchSessionRegistry registry) {
		this(catalog, dispatcher, aggregator, registry, DEFAULT_MAX_ACTIVE_SEARCHES);
	}

	/**
	 * @param maxActiveSearches background searches that may run at once; later ones wait at progress 0
	 */
	public NovelSearchService(SourceCatalog catalog, SearchDispatcher dispatcher,
							  ResultAggregator aggregator, SearchSessionRegistry registry, int maxActiveSearches) {
		if (maxActiveSearches < 1) {
			throw new IllegalArgumentException("maxActiveSearches must be at least 1, got " + maxActiveSearches);
		}
		this.catalog = catalog;
		this.dispatcher = dispatcher;
		this.aggregator = aggregator;
		this.registry = registry;
		this.coordinator = Executors.newFixedThreadPool(maxActiveSearches, coordinatorThreads());
	}

	/**
	 * Searches and blocks until every source has answered, failed or timed out.
	 */
	public SearchSession runSearch(String query, Collection<String> sourceReferences) {
		SearchSession session = newSession(query, sourceReferences);
		execute(session);
		return session;
	}

	/**
	 * Starts a search in the background. The returned session reports progress while the sources
	 * answer and can later be looked up again with {@link #findSession(String)}.
	 */
	public SearchSession startSearch(String query, Collection<String> sourceReferences) {
		SearchSession session = newSession(query, sourceReferences);
		registry.register(session);
		coordinator.execute(() -> {
			try {
				execute(session);
			} catch (RuntimeException e) {
				logger.error("Search session {} failed", session.id(), e);
			} catch (Error e) {
				logger.error("Search session {} failed", session.id(), e);
				throw e;
			} finally {
				// pollers wait for the finished flag
				session.finish(List.of());
			}
		});
		return session;
	}

	public Optional<SearchSession> findSession(String id) {
		return registry.find(id);
	}

	/** Every source reference the catalog knows, for callers that do not name any. */
	public List<String> sourceReferences() {
		return catalog.sourceReferences();
	}

	public int sourceCount() {
		return catalog.size();
	}

	public int activeSessions() {
		return registry.size();
	}

	private SearchSession newSession(String query, Collection<String> sourceReferences) {
		return new SearchSession(UUID.randomUUID().toString(), query, sourceReferences);
	}

	private void execute(SearchSession session) {
		long startTime = System.currentTimeMillis();
		List<SearchResult> collected = dispatcher.dispatch(session);
		List<CombinedSearchResult> ranked = aggregator.aggregate(collected, session.query());
		session.finish(ranked);
		logger.info("Search '{}' finished in {}ms: {} novels from {} results",
				session.query(), System.currentTimeMillis() - startTime, ranked.size(), collected.size());
	}

	public void shutdown() {
		coordinator.shutdownNow();
		try {
			if (!coordinator.awaitTermination(5, TimeUnit.SECONDS)) {
				logger.warn("Search coordinator did not stop within 5 seconds");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static ThreadFactory coordinatorThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "search-coordinator-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
