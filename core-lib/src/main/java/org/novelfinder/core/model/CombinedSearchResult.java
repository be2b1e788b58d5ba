package org.novelfinder.core.model;

import java.util.List;

/**
 * One logical novel matched by one or more sources.
 *
 * @param id     slug of the title shared by every member
 * @param title  title of the member with the smallest url
 * @param novels members ordered by url
 */
public record CombinedSearchResult(
        String id,
        String title,
        List<SearchResult> novels
) {
    public CombinedSearchResult {
        novels = List.copyOf(novels);
    }

    public int size() {
        return novels.size();
    }
}
