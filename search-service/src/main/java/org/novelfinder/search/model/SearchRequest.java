package org.novelfinder.search.model;

import java.util.List;

public record SearchRequest(
		String query,
		List<String> sources
) {}
