package org.artsrv.index.listing;

import org.artsrv.index.aws.s3.S3ListingLayer;
import org.artsrv.index.aws.s3.S3Models;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lists one logical directory of the configured bucket, page by page.
 *
 * <p>The returned sequence is lazy and single-use: a page is fetched only when the consumer asks
 * for an entry past the current one, and a second pass needs a fresh {@link #list(String)} call.
 * A store failure is thrown as {@link ListingException} from {@code hasNext()}/{@code next()}.
 */
@Service
public class StoreEnumerator {
    private static final Logger log = LoggerFactory.getLogger(StoreEnumerator.class);

    static final String DELIMITER = "/";

    private final S3ListingLayer store;
    private final ListingProperties props;

    public StoreEnumerator(S3ListingLayer store, ListingProperties props) {
        this.store = store;
        this.props = props;
    }

    public Iterable<Entry> list(String dirPath) {
        String prefix = toPrefix(dirPath);
        AtomicBoolean handedOut = new AtomicBoolean();
        return () -> {
            if (!handedOut.compareAndSet(false, true)) {
                throw new IllegalStateException("Listing of '" + prefix + "' was already consumed");
            }
            return new PageIterator(props.getBucket(), prefix);
        };
    }

    /**
     * "", ".", "/" and null are the bucket root; anything else becomes "dir/".
     */
    static String toPrefix(String dirPath) {
        if (dirPath == null) return "";
        String p = dirPath;
        while (p.startsWith(DELIMITER)) p = p.substring(1);
        if (p.isEmpty() || p.equals(".")) return "";
        while (p.endsWith(DELIMITER)) p = p.substring(0, p.length() - 1);
        return p + DELIMITER;
    }

    private final class PageIterator implements Iterator<Entry> {
        private final String bucket;
        private final String prefix;
        private final Deque<Entry> buffered = new ArrayDeque<>();
        private String continuationToken;
        private boolean morePages = true;
        private int pagesFetched;

        private PageIterator(String bucket, String prefix) {
            this.bucket = bucket;
            this.prefix = prefix;
        }

        @Override
        public boolean hasNext() {
            while (buffered.isEmpty() && morePages) {
                fetchPage();
            }
            return !buffered.isEmpty();
        }

        @Override
        public Entry next() {
            if (!hasNext()) throw new NoSuchElementException();
            return buffered.poll();
        }

        private void fetchPage() {
            log.debug("Querying {} with prefix '{}' and continuation: {}", bucket, prefix, continuationToken);
            S3Models.ListPage page;
            try {
                page = store.listPage(bucket, prefix, DELIMITER, continuationToken, props.getPageSize());
            } catch (RuntimeException e) {
                morePages = false;
                throw new ListingException("Listing failed for s3://" + bucket + "/" + prefix
                        + " after " + pagesFetched + " page(s)", e);
            }
            pagesFetched++;

            if (page.truncated()) {
                if (page.nextContinuationToken() == null || page.nextContinuationToken().isEmpty()) {
                    morePages = false;
                    throw new ListingException("Malformed listing page for s3://" + bucket + "/" + prefix
                            + ": truncated without a continuation token");
                }
                continuationToken = page.nextContinuationToken();
            } else {
                morePages = false;
            }

            for (String commonPrefix : page.commonPrefixes()) {
                buffered.add(EntryFormatter.fromCommonPrefix(commonPrefix));
            }
            for (S3Models.ObjectSummary object : page.contents()) {
                // directory marker object for the prefix itself
                if (object.key().equals(prefix)) continue;
                buffered.add(EntryFormatter.fromObject(object));
            }

            log.debug("Page {} of '{}' yielded {} prefixes and {} objects", pagesFetched, prefix,
                    page.commonPrefixes().size(), page.contents().size());
        }
    }
}
