package org.artsrv.index.aws.s3;

import org.artsrv.index.listing.ListingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Local filesystem implementation of {@link S3ListingLayer}.
 *
 * <p>Intended for development so listings can be browsed without any S3 dependency. Keys are
 * mapped as:
 * <pre>
 *   {localBaseDir}/{bucket}/{key}
 * </pre>
 * Only regular files are keys; empty directories are invisible, as they would be in S3.
 * Continuation tokens are the offset of the next row in the sorted listing.
 */
@Service
@Primary
@ConditionalOnProperty(prefix = "art-srv.listing", name = "store", havingValue = "local")
public class LocalFsS3ListingLayer implements S3ListingLayer {
    private static final Logger log = LoggerFactory.getLogger(LocalFsS3ListingLayer.class);

    private final Path base;

    public LocalFsS3ListingLayer(ListingProperties props) {
        this.base = Path.of(props.getLocalBaseDir()).toAbsolutePath().normalize();
        log.info("Using LOCAL object store for listings: baseDir={}", this.base);
    }

    @Override
    public S3Models.ListPage listPage(String bucket, String prefix, String delimiter, String continuationToken, int maxKeys) {
        String p = prefix == null ? "" : prefix;
        Path bucketRoot = base.resolve(bucket).normalize();
        if (!bucketRoot.startsWith(base)) {
            throw new IllegalArgumentException("Illegal bucket (path traversal): " + bucket);
        }
        int slash = p.lastIndexOf('/');
        Path walkRoot = slash < 0 ? bucketRoot : bucketRoot.resolve(p.substring(0, slash)).normalize();
        if (!walkRoot.startsWith(bucketRoot)) {
            throw new IllegalArgumentException("Illegal list prefix (path traversal): " + p);
        }

        // key -> summary, or key -> null for a common prefix
        TreeMap<String, S3Models.ObjectSummary> rows = new TreeMap<>();
        if (Files.isDirectory(walkRoot)) {
            try (var stream = Files.walk(walkRoot)) {
                for (Path file : stream.filter(Files::isRegularFile).toList()) {
                    String key = bucketRoot.relativize(file).toString().replace('\\', '/');
                    if (!key.startsWith(p)) continue;
                    String rest = key.substring(p.length());
                    int cut = delimiter == null || delimiter.isEmpty() ? -1 : rest.indexOf(delimiter);
                    if (cut >= 0) {
                        rows.put(p + rest.substring(0, cut + delimiter.length()), null);
                    } else {
                        rows.put(key, new S3Models.ObjectSummary(key, Files.size(file), lastModified(file)));
                    }
                }
            } catch (IOException e) {
                throw new S3AccessException("Local list failed bucket=" + bucket + " prefix=" + p, e);
            }
        }

        List<String> all = new ArrayList<>(rows.keySet());
        int start = parseToken(continuationToken);
        int end = Math.min(all.size(), start + Math.max(1, maxKeys));

        List<String> prefixes = new ArrayList<>();
        List<S3Models.ObjectSummary> contents = new ArrayList<>();
        for (String key : all.subList(Math.min(start, end), end)) {
            S3Models.ObjectSummary summary = rows.get(key);
            if (summary == null) prefixes.add(key);
            else contents.add(summary);
        }
        boolean truncated = end < all.size();
        return new S3Models.ListPage(prefixes, contents, truncated, truncated ? String.valueOf(end) : null);
    }

    private static Instant lastModified(Path file) throws IOException {
        return Files.getLastModifiedTime(file).toInstant();
    }

    private static int parseToken(String token) {
        if (token == null || token.isEmpty()) return 0;
        try {
            return Math.max(0, Integer.parseInt(token));
        } catch (NumberFormatException e) {
            throw new S3AccessException("Invalid continuation token: " + token, e);
        }
    }
}
