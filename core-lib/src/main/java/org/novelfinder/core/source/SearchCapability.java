package org.novelfinder.core.source;

import org.novelfinder.core.model.RawHit;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Query execution for one content source.
 *
 * <p>Mirrors of the same site share one capability and therefore one {@link #id()}.</p>
 */
public interface SearchCapability {

    /** Identifier of the implementation, shared by all of its mirrors. */
    String id();

    /**
     * Runs a free-text query against this source.
     *
     * <p>The returned stream is lazy and finite, is created fresh for every call and must be
     * closed by the caller. Consuming it may throw {@link java.io.UncheckedIOException} or any
     * other runtime exception.</p>
     *
     * @param query   free-text query
     * @param options invocation hints
     * @return hits in source order
     * @throws IOException          if the source cannot be reached
     * @throws InterruptedException if the calling thread is interrupted while waiting on the source
     */
    Stream<RawHit> search(String query, SearchOptions options) throws IOException, InterruptedException;
}
