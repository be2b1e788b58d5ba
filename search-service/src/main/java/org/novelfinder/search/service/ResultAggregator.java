package org.novelfinder.search.service;

import org.novelfinder.core.model.CombinedSearchResult;
import org.novelfinder.core.model.SearchResult;
import org.novelfinder.search.text.SequenceMatcher;
import org.novelfinder.search.text.Slugifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges results from all sources into a ranked list of novels.
 *
 * <p>Results are grouped by the slug of their title. Groups with a slug of two characters or
 * fewer are dropped. Groups are ranked by size (larger first), then by how closely the title
 * matches the query, then by slug.</p>
 */
public class ResultAggregator {
	private static final int MIN_KEY_LENGTH = 3;

	private final int maxResults;

	public ResultAggregator(int maxResults) {
		if (maxResults < 1) {
			throw new IllegalArgumentException("maxResults must be at least 1, got " + maxResults);
		}
		this.maxResults = maxResults;
	}

	public List<CombinedSearchResult> aggregate(List<SearchResult> results, String query) {
		String baseline = query == null ? "" : query;
		Map<String, List<SearchResult>> groups = groupBySlug(results);

		List<Ranked> ranked = new ArrayList<>(groups.size());
		for (Map.Entry<String, List<SearchResult>> group : groups.entrySet()) {
			CombinedSearchResult combined = combine(group.getKey(), group.getValue());
			ranked.add(new Ranked(combined, similarity(combined.title(), baseline)));
		}

		return ranked.stream()
				.sorted(Comparator.comparingInt((Ranked r) -> -r.result().size())
						.thenComparingDouble(r -> -r.similarity())
						.thenComparing(r -> r.result().id()))
				.limit(maxResults)
				.map(Ranked::result)
				.collect(Collectors.toList());
	}

	private Map<String, List<SearchResult>> groupBySlug(List<SearchResult> results) {
		Map<String, List<SearchResult>> groups = new LinkedHashMap<>();
		for (SearchResult result : results) {
			if (result == null || result.title().isEmpty()) {
				continue;
			}
			String key = Slugifier.slugify(result.title());
			if (key.length() < MIN_KEY_LENGTH) {
				continue;
			}
			groups.computeIfAbsent(key, k -> new ArrayList<>()).add(result);
		}
		return groups;
	}

	private CombinedSearchResult combine(String key, List<SearchResult> members) {
		List<SearchResult> byUrl = new ArrayList<>(members);
		byUrl.sort(Comparator.comparing(SearchResult::url));
		return new CombinedSearchResult(key, byUrl.get(0).title(), byUrl);
	}

	private static double similarity(String title, String query) {
		if (query.isEmpty()) {
			return 0.0;
		}
		return SequenceMatcher.ratio(title, query);
	}

	private record Ranked(CombinedSearchResult result, double similarity) {}
}
