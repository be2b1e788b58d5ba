package org.novelfinder.search.service;

import org.novelfinder.core.model.SearchResult;

import java.util.List;

/**
 * What one per-source search produced: its results, or the reason it contributed none.
 */
public record SiteSearchOutcome(
		String sourceId,
		String sourceReference,
		boolean succeeded,
		List<SearchResult> results,
		String failure
) {
	public SiteSearchOutcome {
		results = List.copyOf(results);
	}

	public static SiteSearchOutcome success(String sourceId, String sourceReference, List<SearchResult> results) {
		return new SiteSearchOutcome(sourceId, sourceReference, true, results, null);
	}

	public static SiteSearchOutcome failure(String sourceId, String sourceReference, String reason) {
		return new SiteSearchOutcome(sourceId, sourceReference, false, List.of(), reason);
	}
}
