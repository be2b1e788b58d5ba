package org.novelfinder.search.source;

import java.util.List;

/**
 * One entry of the source catalog file.
 *
 * @param id           identifier shared by all mirrors of the source
 * @param searchUrl    search endpoint, with {@code {query}} standing for the URL-encoded query
 * @param mirrors      base URLs under which the source is known
 * @param resultsField field holding the hit array when the response is an object; {@code null} for a top-level array
 * @param titleField   hit field holding the title; {@code title} when absent
 * @param urlField     hit field holding the link; {@code url} when absent
 */
public record SourceDefinition(
		String id,
		String searchUrl,
		List<String> mirrors,
		String resultsField,
		String titleField,
		String urlField
) {
	public String titleFieldOrDefault() {
		return titleField == null || titleField.isBlank() ? "title" : titleField;
	}

	public String urlFieldOrDefault() {
		return urlField == null || urlField.isBlank() ? "url" : urlField;
	}

	public List<String> mirrorsOrEmpty() {
		return mirrors == null ? List.of() : mirrors;
	}
}
