package org.artsrv.index.edge;

import org.artsrv.index.listing.ListingPage;

/**
 * Either a generated listing, or the untouched request to forward to the origin.
 */
public final class EdgeResult {
    private final EdgeRequest passthrough;
    private final EdgeResponse response;
    private final ListingPage page;

    private EdgeResult(EdgeRequest passthrough, EdgeResponse response, ListingPage page) {
        this.passthrough = passthrough;
        this.response = response;
        this.page = page;
    }

    public static EdgeResult passthrough(EdgeRequest request) {
        return new EdgeResult(request, null, null);
    }

    public static EdgeResult respond(EdgeResponse response, ListingPage page) {
        return new EdgeResult(null, response, page);
    }

    public boolean isPassthrough() {
        return passthrough != null;
    }

    public EdgeRequest request() {
        return passthrough;
    }

    public EdgeResponse response() {
        return response;
    }

    /** The rendered page behind {@link #response()}; null on passthrough. */
    public ListingPage page() {
        return page;
    }
}
