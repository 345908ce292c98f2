package org.artsrv.index.listing;

import org.artsrv.index.aws.s3.S3Models;

/**
 * Turns raw listing rows into {@link Entry} values and renders byte counts for humans.
 */
public final class EntryFormatter {

    private static final long[] FACTORS = {
            1L << 50, 1L << 40, 1L << 30, 1L << 20, 1L << 10
    };
    private static final String[] SUFFIXES = {"PB", "TB", "GB", "MB", "KB"};

    private EntryFormatter() {}

    public static Entry fromCommonPrefix(String prefix) {
        String absolute = stripLeadingSlashes(prefix == null ? "" : prefix);
        return new Entry(true, lastSegment(absolute), absolute, null, null, false);
    }

    public static Entry fromObject(S3Models.ObjectSummary object) {
        String key = object.key();
        return new Entry(false, lastSegment(key), key, object.size(), object.lastModified(), false);
    }

    /**
     * Largest binary unit that fits, truncated toward zero: 1536 is "1 KB", 1023 is "1023 bytes".
     */
    public static String prettySize(long bytes) {
        for (int i = 0; i < FACTORS.length; i++) {
            if (bytes >= FACTORS[i]) {
                return (bytes / FACTORS[i]) + " " + SUFFIXES[i];
            }
        }
        return bytes + (bytes == 1 ? " byte" : " bytes");
    }

    public static String iconClass(Entry entry) {
        if (entry.directory()) {
            return entry.symlink() ? "folder-shortcut" : "folder";
        }
        return entry.symlink() ? "file-shortcut" : "file";
    }

    /** Final non-empty segment of a '/'-separated path; "" for the root. */
    static String lastSegment(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') end--;
        int start = path.lastIndexOf('/', end - 1) + 1;
        return path.substring(start, end);
    }

    private static String stripLeadingSlashes(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == '/') i++;
        return s.substring(i);
    }
}
