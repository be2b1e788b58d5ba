package org.novelfinder.search.service;

import org.novelfinder.core.model.SearchResult;
import org.novelfinder.core.source.CapabilityResolver;
import org.novelfinder.core.source.SearchCapability;
import org.novelfinder.core.source.SearchOptions;
import org.novelfinder.search.session.SearchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a query out to every distinct source of a session.
 *
 * <p>References are resolved in order and reduced to one task per capability id (first reference
 * wins). Tasks run on a pool of at most {@code maxConcurrency} threads and are drained as they
 * finish; the calling thread is the only one that writes to the session.</p>
 */
public class SearchDispatcher {
	private static final Logger logger = LoggerFactory.getLogger(SearchDispatcher.class);

	private final CapabilityResolver resolver;
	private final int maxConcurrency;
	private final Duration taskTimeout;

	/**
	 * @param resolver       maps references to capabilities
	 * @param maxConcurrency maximum number of sources searched at the same time
	 * @param taskTimeout    per-source limit counted from the moment the task starts; zero disables it
	 */
	public SearchDispatcher(CapabilityResolver resolver, int maxConcurrency, Duration taskTimeout) {
		if (maxConcurrency < 1) {
			throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
		}
		this.resolver = resolver;
		this.maxConcurrency = maxConcurrency;
		this.taskTimeout = taskTimeout == null ? Duration.ZERO : taskTimeout;
	}

	/**
	 * Runs every source of the session and blocks until each one has completed, failed or timed out.
	 *
	 * @return all collected results, in no particular order
	 */
	public List<SearchResult> dispatch(SearchSession session) {
		String query = session.query();
		if (query.isBlank() || session.sourceReferences().isEmpty()) {
			logger.info("Nothing to search for query '{}' over {} sources", query, session.sourceReferences().size());
			session.begin(0);
			return List.of();
		}

		List<SiteSearchTask> tasks = planTasks(session);
		session.begin(tasks.size());
		if (tasks.isEmpty()) {
			logger.info("No known source among {} references", session.sourceReferences().size());
			return List.of();
		}

		logger.info("Searching {} sources for '{}' (session {})", tasks.size(), query, session.id());
		ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxConcurrency, tasks.size()), workerThreads());
		try {
			drain(session, tasks, pool);
		} finally {
			pool.shutdownNow();
		}

		List<SearchResult> collected = session.collectedResults();
		logger.info("Session {} collected {} results from {} sources ({} failed)",
				session.id(), collected.size(), tasks.size(), session.failures().size());
		return collected;
	}

	List<SiteSearchTask> planTasks(SearchSession session) {
		Map<String, SiteSearchTask> byCapability = new LinkedHashMap<>();
		for (String reference : session.sourceReferences()) {
			Optional<SearchCapability> capability = resolver.resolve(reference);
			if (capability.isEmpty()) {
				logger.debug("No source matches reference {}", reference);
				continue;
			}
			byCapability.putIfAbsent(capability.get().id(),
					new SiteSearchTask(capability.get(), reference, session.query(), SearchOptions.forFanOut()));
		}
		return new ArrayList<>(byCapability.values());
	}

	private void drain(SearchSession session, List<SiteSearchTask> tasks, ExecutorService pool) {
		CompletionService<SiteSearchOutcome> completion = new ExecutorCompletionService<>(pool);
		Map<Future<SiteSearchOutcome>, SiteSearchTask> pending = new HashMap<>();
		for (SiteSearchTask task : tasks) {
			pending.put(completion.submit(task), task);
		}

		while (!pending.isEmpty()) {
			Future<SiteSearchOutcome> done;
			try {
				done = nextCompleted(completion, pending);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				abandon(session, pending, "search interrupted");
				return;
			}
			if (done != null) {
				SiteSearchTask task = pending.remove(done);
				// null when the task was already settled as timed out
				if (task != null) {
					settle(session, outcomeOf(done, task));
				}
			}
			expireOverdue(session, pending);
		}
	}

	private Future<SiteSearchOutcome> nextCompleted(CompletionService<SiteSearchOutcome> completion,
			Map<Future<SiteSearchOutcome>, SiteSearchTask> pending) throws InterruptedException {
		if (taskTimeout.isZero() || taskTimeout.isNegative()) {
			return completion.take();
		}
		return completion.poll(nextDeadlineMillis(pending.values()), TimeUnit.MILLISECONDS);
	}

	/** Milliseconds until the earliest running task becomes overdue, at least 1. */
	private long nextDeadlineMillis(Iterable<SiteSearchTask> running) {
		long timeoutNanos = taskTimeout.toNanos();
		long now = System.nanoTime();
		long wait = timeoutNanos;
		for (SiteSearchTask task : running) {
			if (task.hasStarted()) {
				wait = Math.min(wait, task.startedNanos() + timeoutNanos - now);
			}
		}
		return Math.max(1L, TimeUnit.NANOSECONDS.toMillis(wait));
	}

	private void expireOverdue(SearchSession session, Map<Future<SiteSearchOutcome>, SiteSearchTask> pending) {
		if (taskTimeout.isZero() || taskTimeout.isNegative()) {
			return;
		}
		long now = System.nanoTime();
		Iterator<Map.Entry<Future<SiteSearchOutcome>, SiteSearchTask>> it = pending.entrySet().iterator();
		while (it.hasNext()) {
			Map.Entry<Future<SiteSearchOutcome>, SiteSearchTask> entry = it.next();
			SiteSearchTask task = entry.getValue();
			// finished tasks are drained from the completion queue instead
			if (entry.getKey().isDone()) {
				continue;
			}
			if (task.hasStarted() && now - task.startedNanos() >= taskTimeout.toNanos()) {
				entry.getKey().cancel(true);
				it.remove();
				settle(session, SiteSearchOutcome.failure(task.sourceId(), task.sourceReference(),
						"timed out after " + taskTimeout.toMillis() + " ms"));
			}
		}
	}

	private void abandon(SearchSession session, Map<Future<SiteSearchOutcome>, SiteSearchTask> pending, String reason) {
		for (Map.Entry<Future<SiteSearchOutcome>, SiteSearchTask> entry : pending.entrySet()) {
			entry.getKey().cancel(true);
			SiteSearchTask task = entry.getValue();
			settle(session, SiteSearchOutcome.failure(task.sourceId(), task.sourceReference(), reason));
		}
		pending.clear();
	}

	private SiteSearchOutcome outcomeOf(Future<SiteSearchOutcome> done, SiteSearchTask task) {
		try {
			return done.get();
		} catch (ExecutionException e) {
			return SiteSearchOutcome.failure(task.sourceId(), task.sourceReference(), String.valueOf(e.getCause()));
		} catch (CancellationException e) {
			return SiteSearchOutcome.failure(task.sourceId(), task.sourceReference(), "cancelled");
		} catch (InterruptedException e) {
			// get() on a completed future does not block
			Thread.currentThread().interrupt();
			return SiteSearchOutcome.failure(task.sourceId(), task.sourceReference(), "interrupted");
		}
	}

	private void settle(SearchSession session, SiteSearchOutcome outcome) {
		if (outcome.succeeded()) {
			session.recordCompletion(outcome.sourceId(), outcome.results(), null);
		} else {
			logger.warn("Search task for {} failed: {}", outcome.sourceReference(), outcome.failure());
			session.recordCompletion(outcome.sourceId(), List.of(), outcome.failure());
		}
		logger.debug("Session {} progress {}%", session.id(), String.format("%.1f", session.progress()));
	}

	private static ThreadFactory workerThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "site-search-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
