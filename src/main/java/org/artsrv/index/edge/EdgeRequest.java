package org.artsrv.index.edge;

import java.util.List;
import java.util.Map;

/**
 * The parts of a CDN origin request the listing cares about. Headers are keyed by lower-case name.
 */
public record EdgeRequest(
        String uri,
        String querystring,
        Map<String, List<EdgeHeader>> headers
) {
    public EdgeRequest {
        uri = uri == null ? "" : uri;
        querystring = querystring == null ? "" : querystring;
        headers = headers == null ? Map.of() : headers;
    }
}
