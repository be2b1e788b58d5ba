package org.novelfinder.search.session;

import org.novelfinder.core.model.CombinedSearchResult;
import org.novelfinder.core.model.SearchResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * State of one search call: progress, collected results and the final ranking.
 *
 * <p>Readers may poll from any thread. Mutators are meant for the single thread that drains the
 * search tasks; they are synchronized so that readers always see a consistent snapshot.</p>
 */
public class SearchSession {
	private final String id;
	private final String query;
	private final Set<String> sourceReferences;
	private final CountDownLatch finishedSignal = new CountDownLatch(1);

	private int totalTasks = -1;
	private int completedTasks;
	private final List<SearchResult> collected = new ArrayList<>();
	private final Map<String, String> failures = new LinkedHashMap<>();
	private List<CombinedSearchResult> results = List.of();
	private Instant finishedAt;

	public SearchSession(String id, String query, Collection<String> sourceReferences) {
		this.id = id;
		this.query = query == null ? "" : query;
		this.sourceReferences = sourceReferences == null
				? Set.of()
				: Collections.unmodifiableSet(new LinkedHashSet<>(sourceReferences));
	}

	public String id() {
		return id;
	}

	public String query() {
		return query;
	}

	/** References in the order the caller gave them, duplicates removed. */
	public Set<String> sourceReferences() {
		return sourceReferences;
	}

	/** Records how many tasks were dispatched. Progress is 0 until the first completion. */
	public synchronized void begin(int taskCount) {
		if (totalTasks >= 0) {
			throw new IllegalStateException("Session " + id + " already started");
		}
		totalTasks = taskCount;
	}

	/** Accumulates one finished task and advances progress. */
	public synchronized void recordCompletion(String sourceId, List<SearchResult> results, String failure) {
		if (totalTasks < 0) {
			throw new IllegalStateException("Session " + id + " has not started");
		}
		if (completedTasks >= totalTasks) {
			throw new IllegalStateException("Session " + id + " received more completions than tasks");
		}
		collected.addAll(results);
		if (failure != null) {
			failures.put(sourceId, failure);
		}
		completedTasks++;
	}

	/** Publishes the final ranking and releases anyone waiting on this session. */
	public synchronized void finish(List<CombinedSearchResult> ranked) {
		if (finishedAt != null) {
			return;
		}
		if (totalTasks < 0) {
			totalTasks = 0;
		}
		results = List.copyOf(ranked);
		finishedAt = Instant.now();
		finishedSignal.countDown();
	}

	/** Percentage of tasks completed, 0 to 100. A session without tasks is at 100 once started. */
	public synchronized double progress() {
		if (totalTasks < 0) {
			return 0.0;
		}
		if (totalTasks == 0) {
			return 100.0;
		}
		return 100.0 * completedTasks / totalTasks;
	}

	public synchronized int totalTasks() {
		return Math.max(totalTasks, 0);
	}

	public synchronized int completedTasks() {
		return completedTasks;
	}

	public synchronized List<SearchResult> collectedResults() {
		return List.copyOf(collected);
	}

	/** Failure reason per source id. */
	public synchronized Map<String, String> failures() {
		return Map.copyOf(failures);
	}

	/** Final ranking; empty until {@link #isFinished()}. */
	public synchronized List<CombinedSearchResult> results() {
		return results;
	}

	public synchronized boolean isFinished() {
		return finishedAt != null;
	}

	public synchronized Instant finishedAt() {
		return finishedAt;
	}

	/**
	 * Waits for the session to finish.
	 *
	 * @return {@code true} if finished within the timeout
	 */
	public boolean await(Duration timeout) throws InterruptedException {
		return finishedSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}
}
