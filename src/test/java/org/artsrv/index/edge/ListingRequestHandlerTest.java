package org.artsrv.index.edge;

import org.artsrv.index.aws.s3.S3AccessException;
import org.artsrv.index.aws.s3.S3ListingLayer;
import org.artsrv.index.aws.s3.S3Models;
import org.artsrv.index.listing.ListingException;
import org.artsrv.index.listing.ListingProperties;
import org.artsrv.index.listing.PageRenderer;
import org.artsrv.index.listing.StoreEnumerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ListingRequestHandlerTest {

    private static final Instant LM = Instant.parse("2024-05-06T07:08:09Z");

    private S3ListingLayer store;
    private ListingProperties props;
    private ListingRequestHandler handler;

    @BeforeEach
    void setUp() {
        store = mock(S3ListingLayer.class);
        props = new ListingProperties();
        props.setBucket("art-srv-enterprise");
        handler = new ListingRequestHandler(new StoreEnumerator(store, props), new PageRenderer(props), props);
    }

    private void storeHas(String prefix, List<String> dirs, List<S3Models.ObjectSummary> objects) {
        when(store.listPage(eq("art-srv-enterprise"), eq(prefix), eq("/"), any(), anyInt()))
                .thenReturn(new S3Models.ListPage(dirs, objects, false, null));
    }

    private static List<String> sizeCells(String document) {
        Matcher m = Pattern.compile("<td data-order=\"[^\"]*\">([^<]*)</td>").matcher(document);
        List<String> out = new ArrayList<>();
        while (m.find()) out.add(m.group(1));
        return out;
    }

    @Test
    void derivesDirectoryKeyFromUri() {
        assertEquals("a/b", ListingRequestHandler.deriveDirectoryKey("/a/b/", "index.html"));
        assertEquals("a/b", ListingRequestHandler.deriveDirectoryKey("/a/b/index.html", "index.html"));
        assertEquals("a/b", ListingRequestHandler.deriveDirectoryKey("/a/b", "index.html"));
        assertEquals("", ListingRequestHandler.deriveDirectoryKey("/", "index.html"));
        assertEquals("", ListingRequestHandler.deriveDirectoryKey("/index.html", "index.html"));
        assertEquals("a/myindex.html", ListingRequestHandler.deriveDirectoryKey("/a/myindex.html", "index.html"));
    }

    @Test
    void parsesEntryParameter() {
        assertEquals(0, ListingRequestHandler.parseEntryParam(""));
        assertEquals(0, ListingRequestHandler.parseEntryParam(null));
        assertEquals(1737, ListingRequestHandler.parseEntryParam("entry=1737"));
        assertEquals(5, ListingRequestHandler.parseEntryParam("x=1&entry=5&entry=9"));
        assertEquals(0, ListingRequestHandler.parseEntryParam("entry=abc"));
        assertEquals(0, ListingRequestHandler.parseEntryParam("entry=-4"));
        assertEquals(0, ListingRequestHandler.parseEntryParam("other=3"));
    }

    @Test
    void pathTraversalIsPassedThroughUntouchedWithoutStoreCalls() {
        EdgeRequest request = new EdgeRequest("/foo/../bar", "entry=2",
                Map.of("host", List.of(new EdgeHeader("Host", "example.com"))));

        EdgeResult result = handler.handle(request);

        assertTrue(result.isPassthrough());
        assertSame(request, result.request());
        assertEquals("/foo/../bar", result.request().uri());
        assertEquals("entry=2", result.request().querystring());
        verifyNoInteractions(store);
    }

    @Test
    void encodedPathTraversalIsPassedThrough() {
        EdgeRequest request = new EdgeRequest("/foo/%2E%2E/bar", "", null);

        EdgeResult result = handler.handle(request);

        assertTrue(result.isPassthrough());
        verifyNoInteractions(store);
    }

    @Test
    void undecodableUriIsPassedThrough() {
        EdgeRequest request = new EdgeRequest("/a/%zz/", "", null);

        EdgeResult result = handler.handle(request);

        assertTrue(result.isPassthrough());
        assertSame(request, result.request());
        verifyNoInteractions(store);
    }

    @Test
    void emptyListingPassesThroughSoRealObjectsAreNotShadowed() {
        storeHas("a/b.txt/", List.of(), List.of());
        EdgeRequest request = new EdgeRequest("/a/b.txt", "", null);

        EdgeResult result = handler.handle(request);

        assertTrue(result.isPassthrough());
        assertSame(request, result.request());
    }

    @Test
    void listingWithOnlyIndexHtmlPassesThrough() {
        storeHas("site/", List.of(), List.of(new S3Models.ObjectSummary("site/index.html", 10L, LM)));

        assertTrue(handler.handle(new EdgeRequest("/site/", "", null)).isPassthrough());
    }

    @Test
    void listsTwoDirectoriesAndOneFile() {
        storeHas("a/b/", List.of("a/b/x/", "a/b/y/"), List.of(new S3Models.ObjectSummary("a/b/f.txt", 2048L, LM)));

        EdgeResult result = handler.handle(new EdgeRequest("/a/b/", "", null));

        assertFalse(result.isPassthrough());
        EdgeResponse response = result.response();
        assertEquals("200", response.status());
        assertEquals("OK", response.statusDescription());
        assertEquals("text/html", response.header("Content-Type"));
        assertEquals("max-age=0", response.header("Cache-Control"));
        assertThat(sizeCells(response.body())).containsExactlyInAnyOrder("&mdash;", "&mdash;", "2 KB");
        assertEquals(3, result.page().totalEntriesSeen());
        assertThat(response.body()).contains("<h1>b</h1>");
    }

    @Test
    void decodesUriBeforeQueryingStore() {
        storeHas("c++/lib/", List.of(), List.of(new S3Models.ObjectSummary("c++/lib/x.so", 1L, LM)));

        EdgeResult result = handler.handle(new EdgeRequest("/c%2B%2B/lib/index.html", "", null));

        assertFalse(result.isPassthrough());
        verify(store).listPage(eq("art-srv-enterprise"), eq("c++/lib/"), eq("/"), any(), anyInt());
    }

    @Test
    void entryParameterResumesAtThatEntry() {
        storeHas("d/", List.of(), List.of(
                new S3Models.ObjectSummary("d/one", 1L, LM),
                new S3Models.ObjectSummary("d/two", 1L, LM),
                new S3Models.ObjectSummary("d/three", 1L, LM)));

        EdgeResult result = handler.handle(new EdgeRequest("/d/", "entry=2", null));

        String body = result.response().body();
        assertThat(body).doesNotContain(">one<").contains(">two<").contains(">three<");
        assertEquals(3, result.page().totalEntriesSeen());
        assertEquals(2, result.page().renderedEntries());
    }

    @Test
    void nextPageLinkReplaysWithoutLosingEntries() {
        props.setTruncateAboveBytes(1);
        when(store.listPage(any(), eq("d/"), any(), any(), anyInt()))
                .thenAnswer(inv -> new S3Models.ListPage(List.of(), List.of(
                        new S3Models.ObjectSummary("d/one", 1L, LM),
                        new S3Models.ObjectSummary("d/two", 1L, LM)), false, null));

        EdgeResult first = handler.handle(new EdgeRequest("/d/", "", null));
        assertThat(first.response().body()).contains(">one<").doesNotContain(">two<").contains("?entry=2");

        EdgeResult second = handler.handle(new EdgeRequest("/d/", "entry=2", null));
        assertThat(second.response().body()).doesNotContain(">one<").contains(">two<");
    }

    @Test
    void storeFailureAbortsTheWholeListing() {
        when(store.listPage(any(), any(), any(), any(), anyInt())).thenThrow(new S3AccessException("boom"));

        assertThrows(ListingException.class, () -> handler.handle(new EdgeRequest("/a/", "", null)));
    }
}
