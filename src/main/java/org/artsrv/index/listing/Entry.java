package org.artsrv.index.listing;

import java.time.Instant;

/**
 * One item under a listed prefix: a common prefix ({@code directory}) or an object.
 * {@code sizeBytes} and {@code lastModified} are only meaningful for objects and may be null
 * when the store omitted them. The store has no symlinks, so {@code symlink} is always false.
 */
public record Entry(
        boolean directory,
        String name,
        String absolutePath,
        Long sizeBytes,
        Instant lastModified,
        boolean symlink
) {
    public boolean file() {
        return !directory;
    }
}
