package org.novelfinder.core.source;

/**
 * Hints passed to a {@link SearchCapability} for one invocation.
 *
 * @param browserEnabled whether the source may start a browser session to answer the query
 */
public record SearchOptions(boolean browserEnabled) {

    /** Options used by the fan-out search: no browser start-up per source. */
    public static SearchOptions forFanOut() {
        return new SearchOptions(false);
    }
}
