package org.artsrv.index.edge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A response generated at the edge, in the shape CloudFront expects from an origin-request hook.
 */
public record EdgeResponse(
        String status,
        String statusDescription,
        Map<String, List<EdgeHeader>> headers,
        String body
) {
    public static EdgeResponse html(String body) {
        Map<String, List<EdgeHeader>> headers = new LinkedHashMap<>();
        headers.put("cache-control", List.of(new EdgeHeader("Cache-Control", "max-age=0")));
        headers.put("content-type", List.of(new EdgeHeader("Content-Type", "text/html")));
        return new EdgeResponse("200", "OK", headers, body);
    }

    public static EdgeResponse badGateway() {
        Map<String, List<EdgeHeader>> headers = new LinkedHashMap<>();
        headers.put("cache-control", List.of(new EdgeHeader("Cache-Control", "no-store")));
        headers.put("content-type", List.of(new EdgeHeader("Content-Type", "text/plain")));
        return new EdgeResponse("502", "Bad Gateway", headers, "Directory listing is temporarily unavailable.");
    }

    public String header(String name) {
        List<EdgeHeader> values = headers.get(name.toLowerCase(Locale.ROOT));
        return values == null || values.isEmpty() ? null : values.get(0).value();
    }
}
