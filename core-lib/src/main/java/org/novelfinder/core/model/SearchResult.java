package org.novelfinder.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.util.Optional;

/**
 * A validated hit from one source. Title and url are never blank.
 */
public record SearchResult(
        String title,
        String url,
        String sourceId
) implements Serializable {

    public SearchResult {
        if (isBlank(title)) {
            throw new IllegalArgumentException("Search result title must not be empty");
        }
        if (isBlank(url)) {
            throw new IllegalArgumentException("Search result url must not be empty");
        }
        title = title.strip();
        url = url.strip();
    }

    /**
     * Builds a result from a raw hit, or returns empty when the hit has no title or url.
     */
    public static Optional<SearchResult> fromHit(RawHit hit, String sourceId) {
        if (hit == null || isBlank(hit.title()) || isBlank(hit.url())) {
            return Optional.empty();
        }
        return Optional.of(new SearchResult(hit.title(), hit.url(), sourceId));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("SearchResult{title='%s', url='%s', source='%s'}", title, url, sourceId);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
