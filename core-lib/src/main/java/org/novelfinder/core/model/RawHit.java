package org.novelfinder.core.model;

/**
 * A single hit as yielded by a source, before validation.
 * Either field may be {@code null} or blank.
 */
public record RawHit(
        String title,
        String url
) {}
