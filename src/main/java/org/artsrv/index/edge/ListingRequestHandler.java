package org.artsrv.index.edge;

import org.artsrv.index.listing.ListingPage;
import org.artsrv.index.listing.ListingProperties;
import org.artsrv.index.listing.PageRenderer;
import org.artsrv.index.listing.StoreEnumerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Origin-request entry point: turns a directory-like URI into a generated HTML listing.
 *
 * <p>The request is returned untouched when the URI tries to climb with {@code ..}, cannot be
 * decoded, or when the derived prefix has nothing to list (a real object or a genuine 404).
 * A failing store call surfaces as {@link org.artsrv.index.listing.ListingException}.
 */
@Service
public class ListingRequestHandler {
    private static final Logger log = LoggerFactory.getLogger(ListingRequestHandler.class);

    static final String ENTRY_PARAM = "entry";

    private final StoreEnumerator enumerator;
    private final PageRenderer renderer;
    private final ListingProperties props;

    public ListingRequestHandler(StoreEnumerator enumerator, PageRenderer renderer, ListingProperties props) {
        this.enumerator = enumerator;
        this.renderer = renderer;
        this.props = props;
    }

    public EdgeResult handle(EdgeRequest request) {
        log.debug("Edge request uri='{}' querystring='{}'", request.uri(), request.querystring());

        String rawUri = request.uri();
        if (rawUri.contains("..")) {
            log.debug("Passing through path traversal attempt: {}", rawUri);
            return EdgeResult.passthrough(request);
        }

        // Browsers escape chars like '+' as %2B; the store wants the literal key.
        String uri;
        try {
            uri = UriUtils.decode(rawUri, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Passing through undecodable uri '{}': {}", rawUri, e.getMessage());
            return EdgeResult.passthrough(request);
        }
        if (uri.contains("..")) {
            log.debug("Passing through path traversal attempt: {}", uri);
            return EdgeResult.passthrough(request);
        }

        String dirKey = deriveDirectoryKey(uri, props.getIndexFileName());
        int skipCount = Math.max(0, parseEntryParam(request.querystring()) - 1);

        ListingPage page = renderer.render(lastSegment(dirKey), enumerator.list(dirKey), skipCount);
        if (page.totalEntriesSeen() == 0) {
            log.debug("Nothing to list under '{}', passing through", dirKey);
            return EdgeResult.passthrough(request);
        }

        log.info("Listed '{}': {} entries seen, {} rendered{}", dirKey, page.totalEntriesSeen(),
                page.renderedEntries(), page.truncated() ? " (truncated)" : "");
        return EdgeResult.respond(EdgeResponse.html(page.document()), page);
    }

    /**
     * "/a/b/" and "/a/b/index.html" both list "a/b"; anything else is used as-is, minus the
     * leading '/'.
     */
    static String deriveDirectoryKey(String uri, String indexFileName) {
        String key;
        if (uri.endsWith("/")) {
            key = stripTrailing(uri);
        } else if (uri.equals(indexFileName) || uri.endsWith("/" + indexFileName)) {
            int slash = uri.lastIndexOf('/');
            key = slash < 0 ? "" : uri.substring(0, slash);
        } else {
            key = uri;
        }
        int i = 0;
        while (i < key.length() && key.charAt(i) == '/') i++;
        return key.substring(i);
    }

    /** 1-based index of the first entry to show; 0 when absent or unusable. */
    static int parseEntryParam(String querystring) {
        if (querystring == null || querystring.isBlank()) return 0;
        String value;
        try {
            value = UriComponentsBuilder.newInstance().query(querystring).build()
                    .getQueryParams().getFirst(ENTRY_PARAM);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unparseable querystring '{}'", querystring);
            return 0;
        }
        if (value == null || value.isBlank()) return 0;
        try {
            int n = Integer.parseInt(UriUtils.decode(value, StandardCharsets.UTF_8).trim());
            if (n < 0) {
                log.warn("Ignoring negative {}={}", ENTRY_PARAM, n);
                return 0;
            }
            return n;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed {}={}", ENTRY_PARAM, value);
            return 0;
        }
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }

    private static String lastSegment(String dirKey) {
        return dirKey.substring(dirKey.lastIndexOf('/') + 1);
    }
}
