package org.novelfinder.search.service;

import org.novelfinder.core.model.RawHit;
import org.novelfinder.core.model.SearchResult;
import org.novelfinder.core.source.SearchCapability;
import org.novelfinder.core.source.SearchOptions;
import org.novelfinder.search.text.TitleCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Searches one source and normalizes its hits.
 *
 * <p>Never throws: any failure of the source, including a malformed (null) stream or hit, is
 * reported as a failed {@link SiteSearchOutcome}.</p>
 */
public class SiteSearchTask implements Callable<SiteSearchOutcome> {
	private static final Logger logger = LoggerFactory.getLogger(SiteSearchTask.class);

	private final SearchCapability capability;
	private final String sourceReference;
	private final String query;
	private final SearchOptions options;

	private volatile boolean started;
	private volatile long startedNanos;

	public SiteSearchTask(SearchCapability capability, String sourceReference, String query, SearchOptions options) {
		this.capability = capability;
		this.sourceReference = sourceReference;
		this.query = query;
		this.options = options;
	}

	@Override
	public SiteSearchOutcome call() {
		startedNanos = System.nanoTime();
		started = true;

		String sourceId = capability.id();
		Stream<RawHit> hits = null;
		try {
			hits = capability.search(query, options);
			if (hits == null) {
				return fail("source returned no result stream", null);
			}
			List<SearchResult> results = new ArrayList<>();
			Iterator<RawHit> iterator = hits.iterator();
			while (iterator.hasNext()) {
				RawHit hit = iterator.next();
				if (hit == null) {
					return fail("source yielded a malformed hit", null);
				}
				SearchResult.fromHit(new RawHit(TitleCase.apply(hit.title()), hit.url()), sourceId)
						.ifPresent(results::add);
			}
			logger.debug("<< {} >> returned {} results for '{}'", sourceReference, results.size(), query);
			return SiteSearchOutcome.success(sourceId, sourceReference, results);
		} catch (IOException | UncheckedIOException e) {
			return fail("I/O error: " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return fail("interrupted", e);
		} catch (RuntimeException e) {
			return fail(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
		} finally {
			close(hits);
		}
	}

	/** A failed close does not undo hits that were already read. */
	private void close(Stream<RawHit> hits) {
		if (hits == null) {
			return;
		}
		try {
			hits.close();
		} catch (RuntimeException e) {
			logger.warn("<< {} >> Failed to close result stream: {}", sourceReference, e.getMessage());
		}
	}

	private SiteSearchOutcome fail(String reason, Exception cause) {
		if (cause != null) {
			logger.debug("<< {} >> Search failed", sourceReference, cause);
		}
		return SiteSearchOutcome.failure(capability.id(), sourceReference, reason);
	}

	public String sourceId() {
		return capability.id();
	}

	public String sourceReference() {
		return sourceReference;
	}

	/** Whether a worker thread has picked this task up. */
	public boolean hasStarted() {
		return started;
	}

	/** {@link System#nanoTime()} at start; meaningful only once {@link #hasStarted()}. */
	public long startedNanos() {
		return startedNanos;
	}
}
