package org.artsrv.index.listing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Streams {@link Entry} values into an HTML listing.
 *
 * <p>Entries are rendered in enumeration order. The first {@code skipCount} counted entries are
 * skipped, which is how the {@code ?entry=N} link resumes a truncated listing. Once the emitted
 * rows exceed {@link ListingProperties#getTruncateAboveBytes()} rendering stops and a
 * "next page" row is added.
 */
@Service
public class PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(PageRenderer.class);

    static final String HEAD_TEMPLATE = "listing/head.html";

    private static final DateTimeFormatter ISO_SECONDS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx", Locale.ROOT);
    // strftime("%c") in the C locale
    private static final DateTimeFormatter C_LOCALE =
            DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss uuuu", Locale.US);

    private static final String FOOT = """

                </tbody>
            </table>
        </div>
    </main>
    </body>
    </html>""";

    private final ListingProperties props;
    private final String headTemplate;

    public PageRenderer(ListingProperties props) {
        this.props = props;
        this.headTemplate = loadTemplate(HEAD_TEMPLATE);
    }

    public ListingPage render(String title, Iterable<Entry> entries, int skipCount) {
        String indexFile = props.getIndexFileName();
        long limit = props.getTruncateAboveBytes();

        StringBuilder rows = new StringBuilder();
        long bodyBytes = 0;
        int seen = 0;
        int rendered = 0;
        boolean truncated = false;

        for (Entry entry : entries) {
            if (entry.name().equalsIgnoreCase(indexFile)) {
                continue;
            }
            log.debug("{}", entry.absolutePath());

            seen++;
            if (seen <= skipCount) {
                continue;
            }

            String row;
            try {
                row = row(entry);
            } catch (RuntimeException e) {
                log.error("Skipping listing entry {}: {}", entry.absolutePath(), e.getMessage(), e);
                continue;
            }
            rows.append(row);
            bodyBytes += row.getBytes(StandardCharsets.UTF_8).length;
            rendered++;

            if (bodyBytes > limit) {
                rows.append(nextPageRow(seen + 1));
                truncated = true;
                log.info("Listing '{}' truncated after entry {} ({} bytes)", title, seen, bodyBytes);
                break;
            }
        }

        String head = headTemplate.replace("${title}", HtmlUtils.htmlEscape(title == null ? "" : title));
        String document = head + rows + FOOT;
        return new ListingPage(document, seen, rendered, bodyBytes, truncated);
    }

    String row(Entry entry) {
        String sizeOrder = "-1";
        String sizePretty = "&mdash;";
        String modifiedIso = "";
        String modifiedHuman = "-";

        if (entry.file()) {
            if (entry.sizeBytes() == null) {
                throw new IllegalStateException("object has no size");
            }
            if (entry.lastModified() == null) {
                throw new IllegalStateException("object has no last-modified time");
            }
            OffsetDateTime modified = entry.lastModified().atOffset(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
            sizeOrder = String.valueOf(entry.sizeBytes());
            sizePretty = EntryFormatter.prettySize(entry.sizeBytes());
            modifiedIso = ISO_SECONDS.format(modified);
            modifiedHuman = C_LOCALE.format(modified);
        }

        // Encode every reserved char so a name like "sha256:abc" never reads as a URI scheme.
        String linkPath = UriUtils.encode(entry.name(), StandardCharsets.UTF_8);
        if (entry.directory() && !entry.symlink() && props.isAppendDirectorySeparator()) {
            linkPath = linkPath + "/";
        }

        return """

                <tr class="file">
                    <td></td>
                    <td>
                        <a href="%s">
                            <svg width="1.5em" height="1em" version="1.1" viewBox="0 0 265 323"><use xlink:href="#%s"></use></svg>
                            <span class="name">%s</span>
                        </a>
                    </td>
                    <td data-order="%s">%s</td>
                    <td class="hideable"><time datetime="%s">%s</time></td>
                    <td class="hideable"></td>
                </tr>
                """.formatted(
                HtmlUtils.htmlEscape(linkPath),
                EntryFormatter.iconClass(entry),
                HtmlUtils.htmlEscape(entry.name()),
                sizeOrder,
                sizePretty,
                modifiedIso,
                modifiedHuman);
    }

    static String nextPageRow(int nextEntry) {
        return "<tr><td></td><td><b>Listing truncated...</b> <a href=\"?entry=" + nextEntry
                + "\">Next Page</a></td><td></td><td></td><td></td></tr>\n";
    }

    private static String loadTemplate(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load listing template " + path, e);
        }
    }
}
