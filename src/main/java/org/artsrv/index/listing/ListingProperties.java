package org.artsrv.index.listing;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the generated directory listings.
 */
@ConfigurationProperties(prefix = "art-srv.listing")
public class ListingProperties {

    /** Bucket backing the static file origin. */
    private String bucket = "art-srv-enterprise";

    /** {@code s3} or {@code local}. */
    private String store = "s3";

    /** Root directory when {@code store=local}; buckets are its subdirectories. */
    private String localBaseDir = "./local-store";

    /** maxKeys for each listing call. */
    private int pageSize = 1000;

    /** Rendering stops once the rows of a page exceed this many bytes. */
    private long truncateAboveBytes = 1_000_000L;

    /** Append '/' to directory links. Turn off for separator-insensitive clients. */
    private boolean appendDirectorySeparator = true;

    /** Name of the generated artifact; never listed as content. */
    private String indexFileName = "index.html";

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getLocalBaseDir() {
        return localBaseDir;
    }

    public void setLocalBaseDir(String localBaseDir) {
        this.localBaseDir = localBaseDir;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public long getTruncateAboveBytes() {
        return truncateAboveBytes;
    }

    public void setTruncateAboveBytes(long truncateAboveBytes) {
        this.truncateAboveBytes = truncateAboveBytes;
    }

    public boolean isAppendDirectorySeparator() {
        return appendDirectorySeparator;
    }

    public void setAppendDirectorySeparator(boolean appendDirectorySeparator) {
        this.appendDirectorySeparator = appendDirectorySeparator;
    }

    public String getIndexFileName() {
        return indexFileName;
    }

    public void setIndexFileName(String indexFileName) {
        this.indexFileName = indexFileName;
    }
}
