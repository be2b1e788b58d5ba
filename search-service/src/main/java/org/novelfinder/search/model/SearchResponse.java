package org.novelfinder.search.model;

import com.google.gson.annotations.SerializedName;
import org.novelfinder.core.model.CombinedSearchResult;
import org.novelfinder.search.session.SearchSession;

import java.util.List;
import java.util.Map;

public record SearchResponse(
		@SerializedName("session_id") String sessionId,
		String query,
		double progress,
		boolean finished,
		@SerializedName("sources_searched") int sourcesSearched,
		@SerializedName("total_results") int totalResults,
		List<CombinedSearchResult> results,
		Map<String, String> failures
) {
	public static SearchResponse fromSession(SearchSession session) {
		List<CombinedSearchResult> results = session.results();
		return new SearchResponse(
				session.id(),
				session.query(),
				session.progress(),
				session.isFinished(),
				session.totalTasks(),
				results.size(),
				results,
				session.failures()
		);
	}
}
