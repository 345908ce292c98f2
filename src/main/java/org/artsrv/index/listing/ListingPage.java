package org.artsrv.index.listing;

/**
 * A rendered listing for one request.
 *
 * @param totalEntriesSeen entries counted in enumeration order, skipped ones included
 * @param renderedEntries  rows actually emitted
 * @param bodyBytes        UTF-8 size of the emitted rows
 */
public record ListingPage(
        String document,
        int totalEntriesSeen,
        int renderedEntries,
        long bodyBytes,
        boolean truncated
) {}
