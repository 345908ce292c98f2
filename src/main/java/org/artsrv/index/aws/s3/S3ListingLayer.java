package org.artsrv.index.aws.s3;

public interface S3ListingLayer {

    /**
     * Issues a single delimited listing call.
     *
     * @param continuationToken token from the previous page, or {@code null} for the first page
     * @throws S3AccessException when the store call fails
     */
    S3Models.ListPage listPage(String bucket, String prefix, String delimiter, String continuationToken, int maxKeys);
}
